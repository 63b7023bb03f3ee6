package com.timecard.auth_gateway.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.cf-access")
public record CfAccessProperties(
    String teamName, String audience, String headerName, String certsUrl, Duration cacheTtl) {

  public CfAccessProperties {
    headerName = headerName == null || headerName.isBlank() ? "Cf-Access-Jwt-Assertion" : headerName;
    cacheTtl = cacheTtl == null ? Duration.ofHours(1) : cacheTtl;
    audience = audience == null || audience.isBlank() ? null : audience;
  }

  /** certs-url が明示されていなければ team 名から公開鍵 URL を組み立てる。未設定なら null。 */
  public String resolvedCertsUrl() {
    if (certsUrl != null && !certsUrl.isBlank()) {
      return certsUrl;
    }
    if (teamName == null || teamName.isBlank()) {
      return null;
    }
    return "https://" + teamName + ".cloudflareaccess.com/cdn-cgi/access/certs";
  }
}
