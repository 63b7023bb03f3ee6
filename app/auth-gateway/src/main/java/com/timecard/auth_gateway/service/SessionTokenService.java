/*
 * どこで: Auth Gateway サービス層
 * 何を: 自前のセッション JWT と外部ブラウザ引き継ぎ用の一時トークンを発行・検証する
 * なぜ: サーバー側にセッションを保存せず、Cookie だけで認証状態を持ち回るため
 */
package com.timecard.auth_gateway.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.timecard.auth_gateway.config.SessionProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Service;
import org.springframework.web.util.WebUtils;

@Service
public class SessionTokenService {

  private static final Logger logger = LoggerFactory.getLogger(SessionTokenService.class);

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_NAME = "name";
  static final String CLAIM_PROVIDER = "provider";
  static final String CLAIM_TYPE = "type";
  static final String BRIDGING_TYPE = "temp";

  private final SessionProperties properties;
  private final Clock clock;
  private final JWSSigner signer;
  private final JWSVerifier verifier;

  public SessionTokenService(SessionProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
    final byte[] secret = properties.secret().getBytes(StandardCharsets.UTF_8);
    try {
      this.signer = new MACSigner(secret);
      this.verifier = new MACVerifier(secret);
    } catch (JOSEException ex) {
      throw new IllegalStateException("session signing secret is unusable for HS256", ex);
    }
    if (properties.enforceExpiry()) {
      logger.info("session token expiry is enforced on verification");
    } else {
      // 署名のみ検証する。期限は Cookie の Max-Age に任せる。
      logger.info("session token expiry is not enforced on verification; relying on cookie max-age");
    }
  }

  /**
   * 役割:
   * - ログイン成功時のセッション Cookie を発行する。
   *
   * 期待動作:
   * - sub/email/name/provider と iat/exp を HS256 で署名する。
   * - Max-Age は埋め込んだ有効期間と一致させる。
   */
  public ResponseCookie mint(Identity identity) {
    final String token = sign(identity, properties.ttl(), null);
    return sessionCookie(token, properties.ttl());
  }

  public Optional<Identity> verify(HttpServletRequest request) {
    final Cookie cookie = WebUtils.getCookie(request, properties.cookieName());
    if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
      return Optional.empty();
    }
    return verifyToken(cookie.getValue(), properties.enforceExpiry())
        .map(SignedToken::identity);
  }

  public ResponseCookie clear() {
    return sessionCookie("", Duration.ZERO);
  }

  public String mintBridging(Identity identity) {
    return sign(identity, properties.bridgingTtl(), BRIDGING_TYPE);
  }

  // 一時トークンは期限切れを必ず拒否する。使い回しの検知はしない。
  public Optional<Identity> verifyBridging(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    return verifyToken(token, true)
        .filter(
            signed -> {
              if (!BRIDGING_TYPE.equals(signed.type())) {
                logger.debug("bridging token rejected: type discriminator is missing");
                return false;
              }
              return true;
            })
        .map(SignedToken::identity);
  }

  public ResponseCookie stateCookie(String encodedState) {
    return cookie(properties.stateCookieName(), encodedState, properties.stateTtl());
  }

  public ResponseCookie clearStateCookie() {
    return cookie(properties.stateCookieName(), "", Duration.ZERO);
  }

  public Optional<String> readStateCookie(HttpServletRequest request) {
    final Cookie cookie = WebUtils.getCookie(request, properties.stateCookieName());
    if (cookie == null || cookie.getValue() == null || cookie.getValue().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(cookie.getValue());
  }

  private String sign(Identity identity, Duration ttl, String type) {
    final Instant now = clock.instant();
    final JWTClaimsSet.Builder claims =
        new JWTClaimsSet.Builder()
            .subject(identity.sub())
            .claim(CLAIM_EMAIL, identity.email())
            .claim(CLAIM_NAME, identity.name())
            .claim(CLAIM_PROVIDER, identity.provider().claimValue())
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(ttl)));
    if (type != null) {
      claims.claim(CLAIM_TYPE, type);
    }
    final SignedJWT jwt =
        new SignedJWT(
            new JWSHeader.Builder(JWSAlgorithm.HS256).type(JOSEObjectType.JWT).build(),
            claims.build());
    try {
      jwt.sign(signer);
    } catch (JOSEException ex) {
      throw new IllegalStateException("session token signing failed", ex);
    }
    return jwt.serialize();
  }

  private Optional<SignedToken> verifyToken(String token, boolean enforceExpiry) {
    try {
      final SignedJWT jwt = SignedJWT.parse(token);
      if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
        logger.debug("token rejected: unexpected alg={}", jwt.getHeader().getAlgorithm());
        return Optional.empty();
      }
      if (!jwt.verify(verifier)) {
        logger.debug("token rejected: signature mismatch");
        return Optional.empty();
      }
      final JWTClaimsSet claims = jwt.getJWTClaimsSet();
      final Optional<IdentityProvider> provider =
          IdentityProvider.fromClaim(claims.getClaim(CLAIM_PROVIDER));
      if (claims.getSubject() == null || provider.isEmpty()) {
        logger.debug("token rejected: sub or provider claim is missing");
        return Optional.empty();
      }
      final Instant issuedAt = toInstant(claims.getIssueTime());
      final Instant expiresAt = toInstant(claims.getExpirationTime());
      if (enforceExpiry && (expiresAt == null || !clock.instant().isBefore(expiresAt))) {
        logger.debug("token rejected: expired at {}", expiresAt);
        return Optional.empty();
      }
      final Identity identity =
          new Identity(
              claims.getSubject(),
              claims.getStringClaim(CLAIM_EMAIL),
              claims.getStringClaim(CLAIM_NAME),
              provider.get(),
              issuedAt,
              expiresAt);
      return Optional.of(new SignedToken(identity, claims.getStringClaim(CLAIM_TYPE)));
    } catch (ParseException | JOSEException ex) {
      logger.debug("token rejected: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private ResponseCookie sessionCookie(String value, Duration maxAge) {
    return cookie(properties.cookieName(), value, maxAge);
  }

  private ResponseCookie cookie(String name, String value, Duration maxAge) {
    return ResponseCookie.from(name, value)
        .path("/")
        .httpOnly(true)
        .secure(true)
        .sameSite("Lax")
        .maxAge(maxAge)
        .build();
  }

  private Instant toInstant(Date date) {
    return date == null ? null : date.toInstant();
  }

  private record SignedToken(Identity identity, String type) {}
}
