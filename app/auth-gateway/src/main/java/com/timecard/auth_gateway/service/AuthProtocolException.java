package com.timecard.auth_gateway.service;

// OAuth 往復の中で呼び出し側が原因となる失敗。リトライせず 400 で終える。
public class AuthProtocolException extends RuntimeException {

  public enum Reason {
    OAUTH_PROVIDER_ERROR,
    MISSING_PARAMETERS,
    STATE_MISMATCH,
    MALFORMED_STATE
  }

  private final Reason reason;

  public AuthProtocolException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthProtocolException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
