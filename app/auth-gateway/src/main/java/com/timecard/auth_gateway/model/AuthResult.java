package com.timecard.auth_gateway.model;

import java.util.Optional;

public record AuthResult(boolean authenticated, Identity identity) {

  private static final AuthResult UNAUTHENTICATED = new AuthResult(false, null);

  public static AuthResult authenticated(Identity identity) {
    return new AuthResult(true, identity);
  }

  public static AuthResult unauthenticated() {
    return UNAUTHENTICATED;
  }

  public Optional<Identity> identityIfPresent() {
    return Optional.ofNullable(identity);
  }
}
