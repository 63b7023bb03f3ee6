package com.timecard.auth_gateway.service;

import com.nimbusds.jose.jwk.JWKSet;
import com.timecard.auth_gateway.config.CfAccessProperties;
import java.net.URI;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Cloudflare Access 署名鍵のプロセス内キャッシュ。
 *
 * <p>TTL 経過後の最初の参照で 1 回だけ取得し直す。ロックは取らないので、同時に期限切れを観測した
 * リクエストはそれぞれ取得し、最後に書いたものが残る。取得対象は公開情報なので重複取得は許容する。
 */
@Component
public class JwksCache {

  private static final Logger logger = LoggerFactory.getLogger(JwksCache.class);

  private final RestClient authRestClient;
  private final CfAccessProperties properties;
  private final Clock clock;
  private volatile Snapshot snapshot;

  public JwksCache(RestClient authRestClient, CfAccessProperties properties, Clock clock) {
    this.authRestClient = authRestClient;
    this.properties = properties;
    this.clock = clock;
  }

  public JWKSet getKeySet() {
    final Snapshot current = snapshot;
    final Instant now = clock.instant();
    if (current != null && isFresh(current, now)) {
      return current.keySet();
    }
    final JWKSet fetched = fetch();
    snapshot = new Snapshot(fetched, now);
    logger.info("cf access key set refreshed keys={}", fetched.getKeys().size());
    return fetched;
  }

  public Optional<Instant> lastFetchedAt() {
    final Snapshot current = snapshot;
    return current == null ? Optional.empty() : Optional.of(current.fetchedAt());
  }

  private boolean isFresh(Snapshot current, Instant now) {
    return Duration.between(current.fetchedAt(), now).compareTo(properties.cacheTtl()) < 0;
  }

  private JWKSet fetch() {
    final String certsUrl = properties.resolvedCertsUrl();
    if (certsUrl == null) {
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.KEY_SET_UNAVAILABLE,
          "cf access team name is not configured");
    }
    final String body;
    try {
      body = authRestClient.get().uri(URI.create(certsUrl)).retrieve().body(String.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "cf access certs fetch failed status={} body={}",
          ex.getStatusCode().value(),
          ex.getResponseBodyAsString());
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.KEY_SET_UNAVAILABLE,
          "Failed to fetch CF Access certs: " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      logger.warn("cf access certs fetch connection failed", ex);
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.KEY_SET_UNAVAILABLE,
          "Failed to fetch CF Access certs",
          ex);
    }
    if (body == null || body.isBlank()) {
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.KEY_SET_UNAVAILABLE, "CF Access certs are empty");
    }
    try {
      return JWKSet.parse(body);
    } catch (ParseException ex) {
      logger.warn("cf access certs parse failed", ex);
      throw new UpstreamIntegrationException(
          UpstreamIntegrationException.Reason.KEY_SET_UNAVAILABLE,
          "CF Access certs are malformed",
          ex);
    }
  }

  private record Snapshot(JWKSet keySet, Instant fetchedAt) {}
}
