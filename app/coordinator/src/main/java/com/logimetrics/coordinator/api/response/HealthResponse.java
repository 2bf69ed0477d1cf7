package com.logimetrics.coordinator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.logimetrics.coordinator.health.HealthSnapshot;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthResponse(
    String timestamp, String overall, Map<String, StoreHealth> stores, List<String> issues) {

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record StoreHealth(String state, long latencyMs, String detail) {}

  public static HealthResponse from(HealthSnapshot snapshot) {
    final Map<String, StoreHealth> stores = new TreeMap<>();
    snapshot
        .stores()
        .forEach(
            (name, result) ->
                stores.put(
                    name,
                    new StoreHealth(result.state().value(), result.latencyMs(), result.detail())));
    return new HealthResponse(
        snapshot.timestamp().toString(), snapshot.overall().value(), stores, snapshot.issues());
  }
}
