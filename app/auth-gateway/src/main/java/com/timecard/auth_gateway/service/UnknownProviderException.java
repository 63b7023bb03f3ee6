package com.timecard.auth_gateway.service;

public class UnknownProviderException extends RuntimeException {

  private final String provider;

  public UnknownProviderException(String provider) {
    super("Unknown provider: " + provider);
    this.provider = provider;
  }

  public String provider() {
    return provider;
  }
}
