package com.logimetrics.coordinator.integration;

public class IntegrationCallException extends RuntimeException {

  public enum Reason {
    NOT_CONFIGURED,
    UNAUTHORIZED,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public IntegrationCallException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IntegrationCallException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
