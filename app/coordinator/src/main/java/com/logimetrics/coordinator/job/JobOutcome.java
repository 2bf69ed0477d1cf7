package com.logimetrics.coordinator.job;

public enum JobOutcome {
  OK("ok"),
  FAILED("failed"),
  SKIPPED("skipped"),
  TIMED_OUT("timed-out");

  private final String value;

  JobOutcome(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
