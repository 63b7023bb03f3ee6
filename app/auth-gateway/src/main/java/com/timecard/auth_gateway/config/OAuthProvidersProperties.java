package com.timecard.auth_gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

// client-config は環境変数の JSON 文字列をそのまま受け取り、利用時にパースする。
@ConfigurationProperties(prefix = "auth.providers")
public record OAuthProvidersProperties(Google google, Lineworks lineworks) {

  public OAuthProvidersProperties {
    google = google == null ? new Google(null, null, null, null) : google;
    lineworks = lineworks == null ? new Lineworks(null, null, null, null, null) : lineworks;
  }

  public record Google(
      String clientConfig,
      String authorizationEndpoint,
      String tokenEndpoint,
      String userinfoEndpoint) {

    public Google {
      authorizationEndpoint =
          isBlank(authorizationEndpoint)
              ? "https://accounts.google.com/o/oauth2/v2/auth"
              : authorizationEndpoint;
      tokenEndpoint = isBlank(tokenEndpoint) ? "https://oauth2.googleapis.com/token" : tokenEndpoint;
      userinfoEndpoint =
          isBlank(userinfoEndpoint)
              ? "https://www.googleapis.com/oauth2/v2/userinfo"
              : userinfoEndpoint;
    }
  }

  public record Lineworks(
      String clientConfig,
      String authorizationEndpoint,
      String tokenEndpoint,
      String userinfoEndpoint,
      String woffId) {

    public Lineworks {
      authorizationEndpoint =
          isBlank(authorizationEndpoint)
              ? "https://auth.worksmobile.com/oauth2/v2.0/authorize"
              : authorizationEndpoint;
      tokenEndpoint =
          isBlank(tokenEndpoint) ? "https://auth.worksmobile.com/oauth2/v2.0/token" : tokenEndpoint;
      userinfoEndpoint =
          isBlank(userinfoEndpoint) ? "https://www.worksapis.com/v1.0/users/me" : userinfoEndpoint;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
