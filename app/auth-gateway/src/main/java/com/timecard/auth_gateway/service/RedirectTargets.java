package com.timecard.auth_gateway.service;

import java.net.URI;
import java.net.URISyntaxException;
import org.springframework.web.util.UriComponentsBuilder;

// ログイン後の遷移先はアプリ内パスに限る。外部 URL やプロトコル相対 URL は "/" に落とす。
public final class RedirectTargets {

  public static final String DEFAULT_TARGET = "/";

  private RedirectTargets() {}

  public static String sanitize(String target) {
    if (target == null || target.isBlank()) {
      return DEFAULT_TARGET;
    }
    if (!target.startsWith("/") || target.startsWith("//") || target.startsWith("/\\")) {
      return DEFAULT_TARGET;
    }
    return target;
  }

  /**
   * Location ヘッダに載せる URI を作る。
   *
   * <p>ブラウザはクエリ中の {@code {}} や {@code |} を生のまま送ってくるので、URI として読めない
   * 遷移先だけ成分ごとにエスケープし直す。エスケープ済みの遷移先はそのまま使う。
   */
  public static URI toLocation(String target) {
    final String sanitized = sanitize(target);
    try {
      return new URI(sanitized);
    } catch (URISyntaxException ex) {
      return UriComponentsBuilder.fromUriString(sanitized).build().encode().toUri();
    }
  }
}
