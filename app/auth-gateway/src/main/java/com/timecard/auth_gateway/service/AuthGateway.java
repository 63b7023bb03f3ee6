/*
 * どこで: Auth Gateway サービス層
 * 何を: リクエストごとに認証元を順に確認し、認証済みかどうかと Identity を決める
 * なぜ: 後段が参照する判定をこの 1 箇所に集めるため
 */
package com.timecard.auth_gateway.service;

import com.timecard.auth_gateway.model.AuthResult;
import com.timecard.auth_gateway.model.Identity;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;
import org.springframework.web.util.UriComponentsBuilder;

@Service
@RequiredArgsConstructor
public class AuthGateway {

  private static final Logger logger = LoggerFactory.getLogger(AuthGateway.class);

  static final List<String> PUBLIC_PATHS =
      List.of(
          "/login",
          "/login/google",
          "/login/lineworks",
          "/login/woff",
          "/auth/google/callback",
          "/auth/lineworks/callback",
          "/auth/woff/callback",
          "/auth/token",
          "/logout",
          "/sw.js",
          "/manifest.webmanifest",
          "/icon-192.png",
          "/icon-512.png",
          "/api/broadcast",
          "/api/auth/check",
          "/actuator/health");

  private final ExternalJwtVerifier externalJwtVerifier;
  private final SessionTokenService sessionTokenService;
  private final AuthMetrics authMetrics;

  /**
   * 役割:
   * - リクエストが認証済みかを判定する。
   *
   * 期待動作:
   * - Cloudflare Access のアサーション、セッション Cookie の順に確認し、最初に通ったものを採用する。
   * - 公開鍵が取得できないときはログを残してセッション Cookie の確認へ進む。
   */
  public AuthResult authenticate(HttpServletRequest request) {
    final Optional<Identity> external = verifyExternal(request);
    if (external.isPresent()) {
      authMetrics.recordAuthentication("cf_access");
      return AuthResult.authenticated(external.get());
    }
    final Optional<Identity> session = sessionTokenService.verify(request);
    if (session.isPresent()) {
      authMetrics.recordAuthentication("session");
      return AuthResult.authenticated(session.get());
    }
    authMetrics.recordAuthentication("none");
    return AuthResult.unauthenticated();
  }

  // 完全一致か、直後が '?' の前方一致だけを公開扱いにする。"/loginX" は対象外。
  public boolean isPublicPath(String pathWithQuery) {
    if (pathWithQuery == null) {
      return false;
    }
    for (String path : PUBLIC_PATHS) {
      if (pathWithQuery.equals(path) || pathWithQuery.startsWith(path + "?")) {
        return true;
      }
    }
    return false;
  }

  public boolean isPublicPath(HttpServletRequest request) {
    return isPublicPath(pathWithQuery(request));
  }

  public URI buildLoginRedirect(HttpServletRequest request) {
    return UriComponentsBuilder.fromUriString(originOf(request))
        .path("/login")
        .queryParam("redirect", pathWithQuery(request))
        .build()
        .encode()
        .toUri();
  }

  /** scheme://host[:port]。転送ヘッダは ForwardedHeaderFilter 適用後の値を使う。 */
  public static String originOf(HttpServletRequest request) {
    return ServletUriComponentsBuilder.fromRequestUri(request)
        .replacePath(null)
        .replaceQuery(null)
        .build()
        .toUriString();
  }

  static String pathWithQuery(HttpServletRequest request) {
    final String path = request.getRequestURI();
    final String query = request.getQueryString();
    return query == null || query.isEmpty() ? path : path + "?" + query;
  }

  private Optional<Identity> verifyExternal(HttpServletRequest request) {
    try {
      return externalJwtVerifier.verify(request);
    } catch (UpstreamIntegrationException ex) {
      logger.warn("cf access verification skipped reason={}: {}", ex.reason(), ex.getMessage());
      authMetrics.recordError("KEY_SET_UNAVAILABLE");
      return Optional.empty();
    }
  }
}
