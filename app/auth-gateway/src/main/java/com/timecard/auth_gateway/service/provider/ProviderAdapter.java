package com.timecard.auth_gateway.service.provider;

import com.timecard.auth_gateway.model.CallbackRequest;
import com.timecard.auth_gateway.model.CallbackResult;
import com.timecard.auth_gateway.model.IdentityProvider;
import com.timecard.auth_gateway.model.LoginRedirect;

/** 認可コードフローを持つ外部 IdP 1 つ分の入口。 */
public interface ProviderAdapter {

  IdentityProvider provider();

  /** {@code /login/{id}} と {@code /auth/{id}/callback} に使う識別子。 */
  default String pathId() {
    return provider().claimValue();
  }

  LoginRedirect buildLoginRedirect(String requestOrigin, String redirectTarget);

  CallbackResult handleCallback(CallbackRequest request);
}
