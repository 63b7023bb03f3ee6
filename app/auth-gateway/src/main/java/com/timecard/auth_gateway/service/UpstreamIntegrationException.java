package com.timecard.auth_gateway.service;

public class UpstreamIntegrationException extends RuntimeException {

  public enum Reason {
    TOKEN_EXCHANGE_FAILED,
    PROFILE_FETCH_FAILED,
    KEY_SET_UNAVAILABLE
  }

  private final Reason reason;

  public UpstreamIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public UpstreamIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
