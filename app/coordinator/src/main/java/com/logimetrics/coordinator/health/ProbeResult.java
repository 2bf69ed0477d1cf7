package com.logimetrics.coordinator.health;

public record ProbeResult(HealthState state, long latencyMs, String detail) {

  public static ProbeResult healthy(long latencyMs) {
    return new ProbeResult(HealthState.HEALTHY, latencyMs, null);
  }

  public static ProbeResult unhealthy(long latencyMs, String detail) {
    return new ProbeResult(HealthState.UNHEALTHY, latencyMs, detail);
  }
}
