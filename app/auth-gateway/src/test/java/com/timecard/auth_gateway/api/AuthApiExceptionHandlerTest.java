/*
 * どこで: Auth Gateway API 層テスト
 * 何を: 例外ごとの HTTP ステータス・エラーコードとメトリクス記録を検証する
 * なぜ: 400/403/500 の切り分けが崩れると画面側のエラー表示が誤るため
 */
package com.timecard.auth_gateway.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.timecard.auth_gateway.service.AuthConfigurationException;
import com.timecard.auth_gateway.service.AuthMetrics;
import com.timecard.auth_gateway.service.AuthProtocolException;
import com.timecard.auth_gateway.service.EmailNotAllowedException;
import com.timecard.auth_gateway.service.UnknownProviderException;
import com.timecard.auth_gateway.service.UpstreamIntegrationException;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class AuthApiExceptionHandlerTest {

  private final AuthMetrics metrics = Mockito.mock(AuthMetrics.class);
  private final AuthApiExceptionHandler handler = new AuthApiExceptionHandler(metrics);

  @Test
  void protocolErrorsAreBadRequest() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleProtocol(
            new AuthProtocolException(
                AuthProtocolException.Reason.STATE_MISMATCH, "State mismatch"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).isEqualTo(new ApiErrorResponse("STATE_MISMATCH", "State mismatch"));
    verify(metrics).recordError("STATE_MISMATCH");
  }

  @Test
  void malformedStateUsesInvalidStateCode() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleProtocol(
            new AuthProtocolException(AuthProtocolException.Reason.MALFORMED_STATE, "Invalid state"));

    assertThat(response.getBody().code()).isEqualTo("INVALID_STATE");
    verify(metrics).recordError("INVALID_STATE");
  }

  @Test
  void upstreamErrorsAreServerErrors() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleUpstream(
            new UpstreamIntegrationException(
                UpstreamIntegrationException.Reason.TOKEN_EXCHANGE_FAILED, "Token exchange failed"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().message()).isEqualTo("Token exchange failed");
    verify(metrics).recordError("TOKEN_EXCHANGE_FAILED");
  }

  @Test
  void disallowedEmailIsForbiddenWithLocalizedMessage() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleEmailNotAllowed(new EmailNotAllowedException("x@other.test"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().message()).isEqualTo("このメールアドレスは許可されていません");
    verify(metrics).recordError("EMAIL_NOT_ALLOWED");
  }

  @Test
  void rejectedEmailExposesOnlyItsDomain() {
    assertThat(new EmailNotAllowedException("x@other.test").emailDomain()).isEqualTo("other.test");
    assertThat(new EmailNotAllowedException("no-at-sign").emailDomain()).isEmpty();
    assertThat(new EmailNotAllowedException(null).emailDomain()).isEmpty();
  }

  @Test
  void unknownProviderIsNotFound() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleUnknownProvider(new UnknownProviderException("github"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    verify(metrics).recordError("PROVIDER_NOT_FOUND");
  }

  @Test
  void configurationErrorDoesNotLeakDetails() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleConfiguration(
            new AuthConfigurationException("GOOGLE_OAUTH_CONFIG is not valid JSON"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().code()).isEqualTo("AUTH_CONFIG_ERROR");
    assertThat(response.getBody().message()).doesNotContain("GOOGLE_OAUTH_CONFIG");
    verify(metrics).recordError("AUTH_CONFIG_ERROR");
  }
}
