package com.timecard.auth_gateway.api;

import com.timecard.auth_gateway.service.AuthConfigurationException;
import com.timecard.auth_gateway.service.AuthMetrics;
import com.timecard.auth_gateway.service.AuthProtocolException;
import com.timecard.auth_gateway.service.EmailNotAllowedException;
import com.timecard.auth_gateway.service.UnknownProviderException;
import com.timecard.auth_gateway.service.UpstreamIntegrationException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class AuthApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  private final AuthMetrics authMetrics;

  @ExceptionHandler(AuthProtocolException.class)
  public ResponseEntity<ApiErrorResponse> handleProtocol(AuthProtocolException ex) {
    final String code =
        switch (ex.reason()) {
          case OAUTH_PROVIDER_ERROR -> "OAUTH_PROVIDER_ERROR";
          case MISSING_PARAMETERS -> "MISSING_PARAMETERS";
          case STATE_MISMATCH -> "STATE_MISMATCH";
          case MALFORMED_STATE -> "INVALID_STATE";
        };
    authMetrics.recordError(code);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(UpstreamIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleUpstream(UpstreamIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case TOKEN_EXCHANGE_FAILED -> "TOKEN_EXCHANGE_FAILED";
          case PROFILE_FETCH_FAILED -> "PROFILE_FETCH_FAILED";
          case KEY_SET_UNAVAILABLE -> "KEY_SET_UNAVAILABLE";
        };
    authMetrics.recordError(code);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse(code, ex.getMessage()));
  }

  @ExceptionHandler(EmailNotAllowedException.class)
  public ResponseEntity<ApiErrorResponse> handleEmailNotAllowed(EmailNotAllowedException ex) {
    logger.info("email not allowed domain={}", ex.emailDomain());
    authMetrics.recordError("EMAIL_NOT_ALLOWED");
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("EMAIL_NOT_ALLOWED", EmailNotAllowedException.USER_MESSAGE));
  }

  @ExceptionHandler(UnknownProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownProvider(UnknownProviderException ex) {
    authMetrics.recordError("PROVIDER_NOT_FOUND");
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PROVIDER_NOT_FOUND", ex.getMessage()));
  }

  // 設定値そのものは返さない
  @ExceptionHandler(AuthConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(AuthConfigurationException ex) {
    logger.error("auth configuration error: {}", ex.getMessage(), ex);
    authMetrics.recordError("AUTH_CONFIG_ERROR");
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("AUTH_CONFIG_ERROR", "Authentication is not configured"));
  }
}
