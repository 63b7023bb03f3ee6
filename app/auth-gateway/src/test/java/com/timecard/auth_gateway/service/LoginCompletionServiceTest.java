package com.timecard.auth_gateway.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.timecard.auth_gateway.config.SessionProperties;
import com.timecard.auth_gateway.model.Identity;
import com.timecard.auth_gateway.model.IdentityProvider;
import com.timecard.auth_gateway.model.LoginCompletion;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class LoginCompletionServiceTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final LoginCompletionService service =
      new LoginCompletionService(
          EmailAllowlistFilter.of("@example.com"),
          new SessionTokenService(
              new SessionProperties(
                  "test-session-secret-0123456789abcdef", null, null, null, null, null, false),
              new MutableClock(Instant.parse("2024-06-01T00:00:00Z"))),
          new AuthMetrics(registry));

  @Test
  void allowedIdentityGetsSessionCookie() {
    final LoginCompletion completion =
        service.complete(
            Identity.unissued("lw-1", "a@example.com", "山田 太郎", IdentityProvider.LINEWORKS));

    assertThat(completion.sessionCookie().getName()).isEqualTo("session");
    assertThat(completion.sessionCookie().getValue()).isNotBlank();
    assertThat(
            registry
                .get("auth.login.total")
                .tags("provider", "lineworks", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void identityOutsideAllowlistIsRejected() {
    assertThatThrownBy(
            () ->
                service.complete(
                    Identity.unissued("g-1", "x@other.test", "X", IdentityProvider.GOOGLE)))
        .isInstanceOf(EmailNotAllowedException.class)
        .hasMessage("このメールアドレスは許可されていません");
    assertThat(
            registry
                .get("auth.login.total")
                .tags("provider", "google", "result", "denied")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }
}
