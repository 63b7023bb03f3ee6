package com.timecard.auth_gateway.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.timecard.auth_gateway.service.UpstreamIntegrationException;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * 認可コードのトークン交換とプロフィール取得を行う HTTP クライアント。
 *
 * <p>どちらも 1 回だけ呼び、失敗は {@link UpstreamIntegrationException} にする。アクセストークン自体は
 * ログに出さない。
 */
@Component
@RequiredArgsConstructor
public class OAuthEndpointClient {

  private static final Logger logger = LoggerFactory.getLogger(OAuthEndpointClient.class);

  private final RestClient authRestClient;

  public String exchangeCode(String tokenEndpoint, MultiValueMap<String, String> form) {
    final JsonNode response;
    try {
      response =
          authRestClient
              .post()
              .uri(URI.create(tokenEndpoint))
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .accept(MediaType.APPLICATION_JSON)
              .body(form)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "token exchange failed status={} body={}",
          ex.getStatusCode().value(),
          ex.getResponseBodyAsString());
      throw tokenExchangeFailed(ex);
    } catch (ResourceAccessException ex) {
      logger.warn("token exchange connection failed endpoint={}", tokenEndpoint, ex);
      throw tokenExchangeFailed(ex);
    } catch (RestClientException ex) {
      logger.warn("token exchange response parse failed", ex);
      throw tokenExchangeFailed(ex);
    }
    final JsonNode accessToken = response == null ? null : response.get("access_token");
    if (accessToken == null || !accessToken.isTextual() || accessToken.asText().isBlank()) {
      logger.warn(
          "token exchange response has no access_token error={}",
          response == null ? null : response.path("error").asText(null));
      throw tokenExchangeFailed(null);
    }
    return accessToken.asText();
  }

  public JsonNode fetchProfile(String userinfoEndpoint, String accessToken) {
    final JsonNode profile;
    try {
      profile =
          authRestClient
              .get()
              .uri(URI.create(userinfoEndpoint))
              .headers(headers -> headers.setBearerAuth(accessToken))
              .accept(MediaType.APPLICATION_JSON)
              .retrieve()
              .body(JsonNode.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "profile fetch failed status={} body={}",
          ex.getStatusCode().value(),
          ex.getResponseBodyAsString());
      throw profileFetchFailed(ex);
    } catch (ResourceAccessException ex) {
      logger.warn("profile fetch connection failed endpoint={}", userinfoEndpoint, ex);
      throw profileFetchFailed(ex);
    } catch (RestClientException ex) {
      logger.warn("profile fetch response parse failed", ex);
      throw profileFetchFailed(ex);
    }
    if (profile == null || !profile.isObject()) {
      logger.warn("profile fetch returned non-object body");
      throw profileFetchFailed(null);
    }
    return profile;
  }

  private UpstreamIntegrationException tokenExchangeFailed(Throwable cause) {
    return new UpstreamIntegrationException(
        UpstreamIntegrationException.Reason.TOKEN_EXCHANGE_FAILED, "Token exchange failed", cause);
  }

  private UpstreamIntegrationException profileFetchFailed(Throwable cause) {
    return new UpstreamIntegrationException(
        UpstreamIntegrationException.Reason.PROFILE_FETCH_FAILED, "Failed to get user info", cause);
  }
}
