package com.timecard.auth_gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({
  SessionProperties.class,
  OAuthProvidersProperties.class,
  CfAccessProperties.class,
  EmailAllowlistProperties.class
})
public class AuthGatewayConfig {

  @Bean
  RestClient authRestClient(RestClient.Builder builder) {
    // token 交換・プロフィール取得・公開鍵取得は絶対 URL で呼ぶため baseUrl は持たない。
    return builder.build();
  }
}
