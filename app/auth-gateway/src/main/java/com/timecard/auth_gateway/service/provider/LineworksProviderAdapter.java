package com.timecard.auth_gateway.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.timecard.auth_gateway.config.OAuthProvidersProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import com.timecard.auth_gateway.service.LoginCompletionService;
import com.timecard.auth_gateway.service.SessionTokenService;
import com.timecard.auth_gateway.service.StateCodec;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class LineworksProviderAdapter extends AbstractAuthorizationCodeAdapter {

  private final OAuthProvidersProperties.Lineworks properties;

  public LineworksProviderAdapter(
      OAuthProvidersProperties providersProperties,
      StateCodec stateCodec,
      SessionTokenService sessionTokenService,
      OAuthEndpointClient endpointClient,
      LoginCompletionService loginCompletionService,
      ProviderClientConfigParser configParser) {
    super(stateCodec, sessionTokenService, endpointClient, loginCompletionService, configParser);
    this.properties = providersProperties.lineworks();
  }

  @Override
  public IdentityProvider provider() {
    return IdentityProvider.LINEWORKS;
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
    return "LINEWORKS_CONFIG";
  }

  @Override
  protected String rawClientConfig() {
    return properties.clientConfig();
  }

  @Override
  protected String scope() {
    return "user.read";
  }

  // メールアドレス未登録のメンバーもいるため userId から擬似アドレスを作る
  @Override
  protected Identity toIdentity(JsonNode profile) {
    final String userId = text(profile, "userId");
    if (isBlank(userId)) {
      throw invalidProfile("lineworks profile has no userId");
    }
    final String email = text(profile, "email");
    final JsonNode userName = profile.get("userName");
    final String name;
    if (userName != null && userName.isObject()) {
      final String lastName = text(userName, "lastName");
      final String firstName = text(userName, "firstName");
      name = (nullToEmpty(lastName) + " " + nullToEmpty(firstName)).trim();
    } else {
      name = userId;
    }
    return Identity.unissued(
        userId, isBlank(email) ? userId + "@lineworks" : email, name, IdentityProvider.LINEWORKS);
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
