package com.timecard.auth_gateway.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeResponse(
    String sub,
    String email,
    String name,
    IdentityProvider provider,
    Instant issuedAt,
    Instant expiresAt) {

  public static MeResponse from(Identity identity) {
    return new MeResponse(
        identity.sub(),
        identity.email(),
        identity.name(),
        identity.provider(),
        identity.issuedAt(),
        identity.expiresAt());
  }
}
