package com.logimetrics.coordinator.notification;

public record DrainSummary(
    boolean queueAvailable,
    int popped,
    int delivered,
    int retried,
    int dropped,
    int malformed,
    int returned) {

  static DrainSummary unavailable() {
    return new DrainSummary(false, 0, 0, 0, 0, 0, 0);
  }
}
