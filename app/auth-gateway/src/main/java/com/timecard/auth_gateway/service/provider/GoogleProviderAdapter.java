package com.timecard.auth_gateway.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.timecard.auth_gateway.config.OAuthProvidersProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import com.timecard.auth_gateway.service.LoginCompletionService;
import com.timecard.auth_gateway.service.SessionTokenService;
import com.timecard.auth_gateway.service.StateCodec;
import java.util.Objects;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@Order(1)
public class GoogleProviderAdapter extends AbstractAuthorizationCodeAdapter {

  private final OAuthProvidersProperties.Google properties;

  public GoogleProviderAdapter(
      OAuthProvidersProperties providersProperties,
      StateCodec stateCodec,
      SessionTokenService sessionTokenService,
      OAuthEndpointClient endpointClient,
      LoginCompletionService loginCompletionService,
      ProviderClientConfigParser configParser) {
    super(stateCodec, sessionTokenService, endpointClient, loginCompletionService, configParser);
    this.properties = providersProperties.google();
  }

  @Override
  public IdentityProvider provider() {
    return IdentityProvider.GOOGLE;
  }

  @Override
  protected String authorizationEndpoint() {
    return properties.authorizationEndpoint();
  }

  @Override
  protected String tokenEndpoint() {
    return properties.tokenEndpoint();
  }

  @Override
  protected String userinfoEndpoint() {
    return properties.userinfoEndpoint();
  }

  @Override
  protected String clientConfigName() {
    return "GOOGLE_OAUTH_CONFIG";
  }

  @Override
  protected String rawClientConfig() {
    return properties.clientConfig();
  }

  @Override
  protected String scope() {
    return "openid email profile";
  }

  @Override
  protected void customizeAuthorization(UriComponentsBuilder builder) {
    builder.queryParam("access_type", "online").queryParam("prompt", "select_account");
  }

  @Override
  protected Identity toIdentity(JsonNode profile) {
    final String id = text(profile, "id");
    if (isBlank(id)) {
      throw invalidProfile("google profile has no id");
    }
    // email と name は欠けていても補完しない。空文字のまま許可リスト判定へ回す。
    return Identity.unissued(
        id,
        Objects.toString(text(profile, "email"), ""),
        Objects.toString(text(profile, "name"), ""),
        IdentityProvider.GOOGLE);
  }
}
