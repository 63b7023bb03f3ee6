package com.timecard.auth_gateway.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.timecard.auth_gateway.service.AuthGateway;
import jakarta.servlet.DispatcherType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.AnonymousAuthenticationFilter;

@Configuration
public class GatewaySecurityConfig {

  // state は Cookie と query の一致で守り、Cookie は SameSite=Lax なので CSRF トークンは使わない
  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http, AuthGateway authGateway, ObjectMapper objectMapper) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .requestCache(cache -> cache.disable())
        .formLogin(form -> form.disable())
        .httpBasic(basic -> basic.disable())
        .logout(logout -> logout.disable())
        .addFilterBefore(new AuthGatewayFilter(authGateway), AnonymousAuthenticationFilter.class)
        .authorizeHttpRequests(
            auth ->
                auth.dispatcherTypeMatchers(DispatcherType.ERROR)
                    .permitAll()
                    .requestMatchers(request -> authGateway.isPublicPath(request))
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .exceptionHandling(
            ex ->
                ex.authenticationEntryPoint(
                    new LoginRedirectEntryPoint(authGateway, objectMapper)));
    return http.build();
  }
}
