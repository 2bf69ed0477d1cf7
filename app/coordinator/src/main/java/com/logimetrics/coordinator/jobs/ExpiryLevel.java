package com.logimetrics.coordinator.jobs;

/** Alert level for something that expires or falls due on a calendar day. */
public enum ExpiryLevel {
  EXPIRED("expired"),
  URGENT("urgent"),
  WARNING("warning"),
  NOTICE("notice");

  static final int URGENT_DAYS = 7;
  static final int WARNING_DAYS = 15;
  static final int NOTICE_DAYS = 30;

  private final String value;

  ExpiryLevel(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ExpiryLevel of(long daysUntilExpiry) {
    if (daysUntilExpiry <= 0) {
      return EXPIRED;
    }
    if (daysUntilExpiry <= URGENT_DAYS) {
      return URGENT;
    }
    if (daysUntilExpiry <= WARNING_DAYS) {
      return WARNING;
    }
    return NOTICE;
  }

  /** Expired or urgent items escalate to every contact channel. */
  public boolean escalates() {
    return this == EXPIRED || this == URGENT;
  }
}
