package com.timecard.auth_gateway.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

// 認証元。claim 値はセッショントークンの provider claim にそのまま入る。
public enum IdentityProvider {
  CF_ACCESS("cf_access"),
  GOOGLE("google"),
  LINEWORKS("lineworks");

  private final String claimValue;

  IdentityProvider(String claimValue) {
    this.claimValue = claimValue;
  }

  @JsonValue
  public String claimValue() {
    return claimValue;
  }

  public static Optional<IdentityProvider> fromClaim(Object value) {
    if (!(value instanceof String text)) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(p -> p.claimValue.equals(text)).findFirst();
  }
}
