package com.timecard.auth_gateway.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.timecard.auth_gateway.config.CfAccessProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import jakarta.servlet.http.HttpServletRequest;
import java.security.Key;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Cloudflare Access が付与する署名付きアサーションを検証する。
 *
 * <p>ヘッダが無いときは「この認証元は無い」として empty を返す。署名や claim の不一致も empty。鍵セット
 * の取得失敗だけは {@link UpstreamIntegrationException} として呼び出し元に返す。
 */
@Service
public class ExternalJwtVerifier {

  private static final Logger logger = LoggerFactory.getLogger(ExternalJwtVerifier.class);
  private static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

  private final JwksCache jwksCache;
  private final CfAccessProperties properties;
  private final Clock clock;
  private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

  public ExternalJwtVerifier(JwksCache jwksCache, CfAccessProperties properties, Clock clock) {
    this.jwksCache = jwksCache;
    this.properties = properties;
    this.clock = clock;
  }

  public Optional<Identity> verify(HttpServletRequest request) {
    final String assertion = request.getHeader(properties.headerName());
    if (assertion == null || assertion.isBlank()) {
      return Optional.empty();
    }
    if (properties.resolvedCertsUrl() == null) {
      logger.warn("cf access assertion received but team name is not configured");
      return Optional.empty();
    }
    final JWKSet keySet = jwksCache.getKeySet();
    return verifyAssertion(assertion.trim(), keySet);
  }

  Optional<Identity> verifyAssertion(String assertion, JWKSet keySet) {
    try {
      final SignedJWT jwt = SignedJWT.parse(assertion);
      final JWSHeader header = jwt.getHeader();
      final Key key = resolveKey(keySet, header);
      if (key == null) {
        logger.debug("cf access assertion rejected: no key for kid={}", header.getKeyID());
        return Optional.empty();
      }
      final JWSVerifier verifier = verifierFactory.createJWSVerifier(header, key);
      if (!jwt.verify(verifier)) {
        logger.debug("cf access assertion rejected: signature mismatch");
        return Optional.empty();
      }
      final JWTClaimsSet claims = jwt.getJWTClaimsSet();
      if (!isAudienceAccepted(claims) || !isWithinValidity(claims)) {
        return Optional.empty();
      }
      final String email = Optional.ofNullable(claims.getStringClaim("email")).orElse("");
      // Cloudflare Access は表示名を持たないので name は email で代用する
      return Optional.of(
          new Identity(
              claims.getSubject(),
              email,
              email,
              IdentityProvider.CF_ACCESS,
              toInstant(claims.getIssueTime()),
              toInstant(claims.getExpirationTime())));
    } catch (ParseException | JOSEException ex) {
      logger.debug("cf access assertion rejected: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private Key resolveKey(JWKSet keySet, JWSHeader header) throws JOSEException {
    final JWK jwk;
    if (header.getKeyID() != null) {
      jwk = keySet.getKeyByKeyId(header.getKeyID());
    } else {
      final List<JWK> keys = keySet.getKeys();
      jwk = keys.size() == 1 ? keys.get(0) : null;
    }
    if (jwk instanceof RSAKey rsaKey) {
      return rsaKey.toRSAPublicKey();
    }
    if (jwk instanceof ECKey ecKey) {
      return ecKey.toECPublicKey();
    }
    return null;
  }

  private boolean isAudienceAccepted(JWTClaimsSet claims) {
    if (properties.audience() == null) {
      return true;
    }
    final List<String> audience = claims.getAudience();
    if (audience == null || !audience.contains(properties.audience())) {
      logger.debug("cf access assertion rejected: audience mismatch");
      return false;
    }
    return true;
  }

  private boolean isWithinValidity(JWTClaimsSet claims) {
    final Instant now = clock.instant();
    final Instant expiresAt = toInstant(claims.getExpirationTime());
    if (expiresAt != null && !now.isBefore(expiresAt.plus(CLOCK_SKEW))) {
      logger.debug("cf access assertion rejected: expired at {}", expiresAt);
      return false;
    }
    final Instant notBefore = toInstant(claims.getNotBeforeTime());
    if (notBefore != null && now.isBefore(notBefore.minus(CLOCK_SKEW))) {
      logger.debug("cf access assertion rejected: not valid before {}", notBefore);
      return false;
    }
    return true;
  }

  private Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }
}
