/*
 * どこで: Auth Gateway の設定バインド
 * 何を: 署名鍵と Cookie 名、各トークンの有効期間を保持する
 * なぜ: HS256 の鍵長不足を起動時に検知するため
 */
package com.timecard.auth_gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "auth.session")
public record SessionProperties(
    @NotBlank @Size(min = 32) String secret,
    String cookieName,
    String stateCookieName,
    Duration ttl,
    Duration stateTtl,
    Duration bridgingTtl,
    boolean enforceExpiry) {

  public SessionProperties {
    cookieName = cookieName == null || cookieName.isBlank() ? "session" : cookieName;
    stateCookieName =
        stateCookieName == null || stateCookieName.isBlank() ? "oauth_state" : stateCookieName;
    ttl = ttl == null ? Duration.ofHours(24) : ttl;
    stateTtl = stateTtl == null ? Duration.ofMinutes(10) : stateTtl;
    bridgingTtl = bridgingTtl == null ? Duration.ofMinutes(5) : bridgingTtl;
  }
}
