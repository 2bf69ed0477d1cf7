package com.logimetrics.coordinator.health;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthState {
  HEALTHY("healthy", 1),
  UNHEALTHY("unhealthy", 0),
  UNKNOWN("unknown", -1);

  private final String value;
  private final int gaugeValue;

  HealthState(String value, int gaugeValue) {
    this.value = value;
    this.gaugeValue = gaugeValue;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public int gaugeValue() {
    return gaugeValue;
  }
}
