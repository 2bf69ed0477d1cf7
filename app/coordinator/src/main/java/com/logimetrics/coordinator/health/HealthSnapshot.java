package com.logimetrics.coordinator.health;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HealthSnapshot(
    Instant timestamp, HealthState overall, Map<String, ProbeResult> stores, List<String> issues) {

  public HealthSnapshot {
    stores = Map.copyOf(stores);
    issues = List.copyOf(issues);
  }

  public HealthState state(String store) {
    final ProbeResult result = stores.get(store);
    return result == null ? HealthState.UNKNOWN : result.state();
  }
}
