/*
 * Where: Cron evaluation
 * What: Signals a cron expression or timezone that cannot be evaluated
 * Why: Registration rejects broken schedules with a structured error instead of failing later at fire time
 */
package com.logimetrics.coordinator.cron;

public class InvalidScheduleException extends RuntimeException {

  public enum Reason {
    BLANK_EXPRESSION,
    FIELD_COUNT,
    MALFORMED_FIELD,
    UNKNOWN_TIMEZONE
  }

  private final Reason reason;
  private final String expression;

  public InvalidScheduleException(Reason reason, String expression, String message) {
    super(message);
    this.reason = reason;
    this.expression = expression;
  }

  public InvalidScheduleException(
      Reason reason, String expression, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.expression = expression;
  }

  public Reason reason() {
    return reason;
  }

  public String expression() {
    return expression;
  }
}
