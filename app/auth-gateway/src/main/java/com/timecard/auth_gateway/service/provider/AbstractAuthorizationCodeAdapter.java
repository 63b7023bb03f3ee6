/*
 * どこで: Auth Gateway プロバイダ層
 * 何を: 認可コードフローのログイン開始と callback 処理の共通手順
 * なぜ: プロバイダ差分をエンドポイント・scope・プロフィール変換だけに閉じ込めるため
 */
package com.timecard.auth_gateway.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.timecard.auth_gateway.model.AntiForgeryState;
import com.timecard.auth_gateway.model.CallbackRequest;
import com.timecard.auth_gateway.model.CallbackResult;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.LoginCompletion;
import com.timecard.auth_gateway.model.LoginRedirect;
import com.timecard.auth_gateway.model.ProviderClientConfig;
import com.timecard.auth_gateway.service.AuthProtocolException;
import com.timecard.auth_gateway.service.LoginCompletionService;
import com.timecard.auth_gateway.service.RedirectTargets;
import com.timecard.auth_gateway.service.SessionTokenService;
import com.timecard.auth_gateway.service.StateCodec;
import com.timecard.auth_gateway.service.UpstreamIntegrationException;
import java.net.URI;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;

public abstract class AbstractAuthorizationCodeAdapter implements ProviderAdapter {

  private static final Logger logger =
      LoggerFactory.getLogger(AbstractAuthorizationCodeAdapter.class);

  private final StateCodec stateCodec;
  private final SessionTokenService sessionTokenService;
  private final OAuthEndpointClient endpointClient;
  private final LoginCompletionService loginCompletionService;
  private final ProviderClientConfigParser configParser;

  protected AbstractAuthorizationCodeAdapter(
      StateCodec stateCodec,
      SessionTokenService sessionTokenService,
      OAuthEndpointClient endpointClient,
      LoginCompletionService loginCompletionService,
      ProviderClientConfigParser configParser) {
    this.stateCodec = stateCodec;
    this.sessionTokenService = sessionTokenService;
    this.endpointClient = endpointClient;
    this.loginCompletionService = loginCompletionService;
    this.configParser = configParser;
  }

  protected abstract String authorizationEndpoint();

  protected abstract String tokenEndpoint();

  protected abstract String userinfoEndpoint();

  /** 環境変数名。設定不備のエラーメッセージに使う。 */
  protected abstract String clientConfigName();

  protected abstract String rawClientConfig();

  protected abstract String scope();

  /** プロバイダ固有の追加パラメータ。既定では何も足さない。 */
  protected void customizeAuthorization(UriComponentsBuilder builder) {}

  protected abstract Identity toIdentity(JsonNode profile);

  /**
   * 役割:
   * - IdP の認可エンドポイントへ送り出す URL と state Cookie を作る。
   *
   * 期待動作:
   * - nonce は毎回新しい UUID。
   * - 同じ state 文字列を query と Cookie の両方に載せる。
   */
  @Override
  public LoginRedirect buildLoginRedirect(String requestOrigin, String redirectTarget) {
    final ProviderClientConfig config = clientConfig();
    final String state =
        stateCodec.encode(RedirectTargets.sanitize(redirectTarget), UUID.randomUUID().toString());
    final UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(authorizationEndpoint())
            .queryParam("client_id", config.clientId())
            .queryParam("redirect_uri", callbackUri(requestOrigin))
            .queryParam("response_type", "code")
            .queryParam("scope", scope())
            .queryParam("state", state);
    customizeAuthorization(builder);
    final URI location = builder.build().encode().toUri();
    return new LoginRedirect(location, sessionTokenService.stateCookie(state));
  }

  /**
   * 役割:
   * - IdP から戻ってきた callback を検証し、ログインを完了させる。
   *
   * 期待動作:
   * - error / code,state 欠落 / Cookie 不一致 / state 破損の順に 400 で弾く。
   * - トークン交換とプロフィール取得はそれぞれ 1 回だけ呼ぶ。
   * - 成功時は state Cookie を消し、state に入っていた遷移先を返す。
   */
  @Override
  public CallbackResult handleCallback(CallbackRequest request) {
    if (!isBlank(request.error())) {
      logger.info("oauth callback returned error provider={} error={}", pathId(), request.error());
      throw new AuthProtocolException(
          AuthProtocolException.Reason.OAUTH_PROVIDER_ERROR, "OAuth error: " + request.error());
    }
    if (isBlank(request.code()) || isBlank(request.state())) {
      throw new AuthProtocolException(
          AuthProtocolException.Reason.MISSING_PARAMETERS, "Missing code or state");
    }
    if (request.stateCookie() == null || !request.stateCookie().equals(request.state())) {
      throw new AuthProtocolException(
          AuthProtocolException.Reason.STATE_MISMATCH, "State mismatch");
    }
    final AntiForgeryState state = stateCodec.decode(request.state());

    final ProviderClientConfig config = clientConfig();
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("code", request.code());
    form.add("client_id", config.clientId());
    form.add("client_secret", config.clientSecret());
    form.add("redirect_uri", callbackUri(request.origin()));
    form.add("grant_type", "authorization_code");
    final String accessToken = endpointClient.exchangeCode(tokenEndpoint(), form);

    final Identity identity = resolveIdentity(accessToken);
    final LoginCompletion completion = loginCompletionService.complete(identity);
    return new CallbackResult(
        completion.identity(),
        completion.sessionCookie(),
        sessionTokenService.clearStateCookie(),
        RedirectTargets.sanitize(state.redirectTarget()));
  }

  /** アクセストークンでプロフィールを取得し、正規化した Identity にする。 */
  public Identity resolveIdentity(String accessToken) {
    final JsonNode profile = endpointClient.fetchProfile(userinfoEndpoint(), accessToken);
    return toIdentity(profile);
  }

  protected String callbackUri(String origin) {
    return origin + "/auth/" + pathId() + "/callback";
  }

  protected ProviderClientConfig clientConfig() {
    return configParser.parse(rawClientConfig(), clientConfigName());
  }

  protected static String text(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    return value.isValueNode() ? value.asText() : null;
  }

  protected static UpstreamIntegrationException invalidProfile(String detail) {
    logger.warn("profile response is invalid: {}", detail);
    return new UpstreamIntegrationException(
        UpstreamIntegrationException.Reason.PROFILE_FETCH_FAILED, "Failed to get user info");
  }

  protected static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
