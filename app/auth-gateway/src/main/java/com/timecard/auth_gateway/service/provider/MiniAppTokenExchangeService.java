/*
 * どこで: Auth Gateway プロバイダ層
 * 何を: LINE WORKS アプリ内 SDK が渡すアクセストークンでログインし、外部ブラウザ用の一時トークンを発行する
 * なぜ: アプリ内ブラウザで得たログインを OS 標準ブラウザへ引き継ぐため
 */
package com.timecard.auth_gateway.service.provider;

import com.timecard.auth_gateway.config.OAuthProvidersProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.LoginCompletion;
import com.timecard.auth_gateway.model.MiniAppLoginResult;
import com.timecard.auth_gateway.service.AuthConfigurationException;
import com.timecard.auth_gateway.service.AuthMetrics;
import com.timecard.auth_gateway.service.AuthProtocolException;
import com.timecard.auth_gateway.service.LoginCompletionService;
import com.timecard.auth_gateway.service.RedirectTargets;
import com.timecard.auth_gateway.service.SessionTokenService;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class MiniAppTokenExchangeService {

  private static final Logger logger = LoggerFactory.getLogger(MiniAppTokenExchangeService.class);

  public static final String CALLBACK_PATH = "/auth/woff/callback";
  public static final String BRIDGE_PATH = "/auth/token";

  private final LineworksProviderAdapter lineworksProviderAdapter;
  private final LoginCompletionService loginCompletionService;
  private final SessionTokenService sessionTokenService;
  private final AuthMetrics authMetrics;
  private final String woffId;

  public MiniAppTokenExchangeService(
      LineworksProviderAdapter lineworksProviderAdapter,
      LoginCompletionService loginCompletionService,
      SessionTokenService sessionTokenService,
      AuthMetrics authMetrics,
      OAuthProvidersProperties providersProperties) {
    this.lineworksProviderAdapter = lineworksProviderAdapter;
    this.loginCompletionService = loginCompletionService;
    this.sessionTokenService = sessionTokenService;
    this.authMetrics = authMetrics;
    this.woffId = providersProperties.lineworks().woffId();
  }

  /** SDK ページの初期化に使う WOFF ID。未設定はデプロイ不備として扱う。 */
  public String requireWoffId() {
    if (woffId == null || woffId.isBlank()) {
      throw new AuthConfigurationException("WOFF_ID is not configured");
    }
    return woffId;
  }

  /**
   * 役割:
   * - SDK のアクセストークンから LINE WORKS ユーザーを確定し、セッションを発行する。
   *
   * 期待動作:
   * - state も redirect_uri も無い。プロフィール取得以降は通常の callback と同じ。
   * - 外部ブラウザで開く {@code /auth/token?token=...&redirect=...} を合わせて返す。
   */
  public MiniAppLoginResult exchange(String accessToken, String redirectTarget) {
    if (accessToken == null || accessToken.isBlank()) {
      throw new AuthProtocolException(
          AuthProtocolException.Reason.MISSING_PARAMETERS, "Missing access token");
    }
    final Identity identity = lineworksProviderAdapter.resolveIdentity(accessToken);
    final LoginCompletion completion = loginCompletionService.complete(identity);
    final String target = RedirectTargets.sanitize(redirectTarget);
    final String bridgeUrl =
        UriComponentsBuilder.fromPath(BRIDGE_PATH)
            .queryParam("token", sessionTokenService.mintBridging(identity))
            .queryParam("redirect", target)
            .build()
            .encode()
            .toUriString();
    return new MiniAppLoginResult(
        completion.identity(), completion.sessionCookie(), target, bridgeUrl);
  }

  // 一時トークンは期限内なら何度でも使える。許可リストは発行時に確認済み。
  public Optional<LoginCompletion> redeem(String bridgingToken) {
    final Optional<Identity> identity = sessionTokenService.verifyBridging(bridgingToken);
    if (identity.isEmpty()) {
      logger.info("bridging token rejected");
      authMetrics.recordLogin("bridging", "rejected");
      return Optional.empty();
    }
    authMetrics.recordLogin(identity.get().provider().claimValue(), "bridged");
    return identity.map(
        value -> new LoginCompletion(value, sessionTokenService.mint(value)));
  }
}
