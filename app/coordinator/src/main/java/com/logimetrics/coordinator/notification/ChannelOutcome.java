package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelOutcome {
  OK("ok"),
  SKIPPED("skipped"),
  FAILED("failed");

  private final String value;

  ChannelOutcome(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
