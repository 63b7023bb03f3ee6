/*
 * どこで: Auth Gateway サービス層テスト
 * 何を: セッション Cookie と一時トークンの発行・検証を検証する
 * なぜ: 署名・期限・種別の判定が緩むと他人のセッションや期限切れトークンが通るため
 */
package com.timecard.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.timecard.auth_gateway.config.SessionProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import jakarta.servlet.http.Cookie;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;
import org.springframework.mock.web.MockHttpServletRequest;

class SessionTokenServiceTest {

  private static final String SECRET = "test-session-secret-0123456789abcdef";
  private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
  private static final Identity USER =
      Identity.unissued("google-123", "a@example.com", "Alice", IdentityProvider.GOOGLE);

  @Test
  void mintedSessionCookieVerifiesToSameIdentity() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);

    final ResponseCookie cookie = service.mint(USER);
    final Optional<Identity> verified = service.verify(requestWith(cookie));

    assertThat(verified).isPresent();
    assertThat(verified.get().sub()).isEqualTo("google-123");
    assertThat(verified.get().email()).isEqualTo("a@example.com");
    assertThat(verified.get().name()).isEqualTo("Alice");
    assertThat(verified.get().provider()).isEqualTo(IdentityProvider.GOOGLE);
    assertThat(verified.get().issuedAt()).isEqualTo(NOW);
    assertThat(verified.get().expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(24)));
  }

  @Test
  void sessionCookieCarriesBrowserAttributes() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);

    final String header = service.mint(USER).toString();

    assertThat(header).startsWith("session=");
    assertThat(header).contains("Path=/", "Max-Age=86400", "Secure", "HttpOnly", "SameSite=Lax");
  }

  @Test
  void tamperedTokenIsRejected() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);
    final String token = service.mint(USER).getValue();
    final String[] parts = token.split("\\.");
    final String forgedPayload =
        java.util.Base64.getUrlEncoder()
            .withoutPadding()
            .encodeToString(
                "{\"sub\":\"admin\",\"email\":\"admin@example.com\",\"provider\":\"google\"}"
                    .getBytes(StandardCharsets.UTF_8));
    final String forged = parts[0] + "." + forgedPayload + "." + parts[2];

    assertThat(service.verify(requestWith("session", forged))).isEmpty();
  }

  @Test
  void tokenSignedWithOtherSecretIsRejected() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);
    final SessionTokenService other =
        new SessionTokenService(
            new SessionProperties(
                "another-secret-0123456789abcdefghijkl", null, null, null, null, null, false),
            new MutableClock(NOW));

    assertThat(service.verify(requestWith(other.mint(USER)))).isEmpty();
  }

  @Test
  void missingCookieYieldsEmpty() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);

    assertThat(service.verify(new MockHttpServletRequest())).isEmpty();
  }

  @Test
  void expiredSessionStillVerifiesWhenExpiryIsNotEnforced() {
    final MutableClock clock = new MutableClock(NOW);
    final SessionTokenService service = newService(clock, false);
    final ResponseCookie cookie = service.mint(USER);

    clock.advance(Duration.ofHours(25));

    assertThat(service.verify(requestWith(cookie))).isPresent();
  }

  @Test
  void expiredSessionIsRejectedWhenExpiryIsEnforced() {
    final MutableClock clock = new MutableClock(NOW);
    final SessionTokenService service = newService(clock, true);
    final ResponseCookie cookie = service.mint(USER);

    clock.advance(Duration.ofHours(23));
    assertThat(service.verify(requestWith(cookie))).isPresent();

    clock.advance(Duration.ofHours(2));
    assertThat(service.verify(requestWith(cookie))).isEmpty();
  }

  @Test
  void clearedCookieExpiresImmediately() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);

    final ResponseCookie cleared = service.clear();

    assertThat(cleared.getName()).isEqualTo("session");
    assertThat(cleared.getValue()).isEmpty();
    assertThat(cleared.getMaxAge()).isEqualTo(Duration.ZERO);
  }

  @Test
  void bridgingTokenVerifiesWithinItsLifetime() {
    final MutableClock clock = new MutableClock(NOW);
    final SessionTokenService service = newService(clock, false);
    final String token = service.mintBridging(USER);

    clock.advance(Duration.ofMinutes(4));

    assertThat(service.verifyBridging(token)).map(Identity::sub).contains("google-123");
  }

  @Test
  void expiredBridgingTokenIsRejectedRegardlessOfSessionMode() {
    final MutableClock clock = new MutableClock(NOW);
    final SessionTokenService service = newService(clock, false);
    final String token = service.mintBridging(USER);

    clock.advance(Duration.ofMinutes(6));

    assertThat(service.verifyBridging(token)).isEmpty();
  }

  @Test
  void sessionTokenIsNotAcceptedAsBridgingToken() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);
    final String sessionToken = service.mint(USER).getValue();

    assertThat(service.verifyBridging(sessionToken)).isEmpty();
  }

  @Test
  void bridgingTokenWithoutTypeDiscriminatorIsRejected() throws Exception {
    final SessionTokenService service = newService(new MutableClock(NOW), false);
    final SignedJWT jwt =
        new SignedJWT(
            new JWSHeader(JWSAlgorithm.HS256),
            new JWTClaimsSet.Builder()
                .subject("google-123")
                .claim("email", "a@example.com")
                .claim("name", "Alice")
                .claim("provider", "google")
                .issueTime(Date.from(NOW))
                .expirationTime(Date.from(NOW.plus(Duration.ofMinutes(5))))
                .build());
    jwt.sign(new MACSigner(SECRET.getBytes(StandardCharsets.UTF_8)));

    assertThat(service.verifyBridging(jwt.serialize())).isEmpty();
  }

  @Test
  void stateCookieRoundTripsThroughRequest() {
    final SessionTokenService service = newService(new MutableClock(NOW), false);

    final ResponseCookie stateCookie = service.stateCookie("abc");

    assertThat(stateCookie.toString()).contains("oauth_state=abc", "Max-Age=600");
    assertThat(service.readStateCookie(requestWith(stateCookie))).contains("abc");
    assertThat(service.clearStateCookie().getMaxAge()).isEqualTo(Duration.ZERO);
  }

  private SessionTokenService newService(MutableClock clock, boolean enforceExpiry) {
    return new SessionTokenService(
        new SessionProperties(SECRET, null, null, null, null, null, enforceExpiry), clock);
  }

  private MockHttpServletRequest requestWith(ResponseCookie cookie) {
    return requestWith(cookie.getName(), cookie.getValue());
  }

  private MockHttpServletRequest requestWith(String name, String value) {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
    request.setCookies(new Cookie(name, value));
    return request;
  }
}
