package com.logimetrics.coordinator.integration;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** One ETA from the ML service; {@code raw} is the result object as returned. */
public record EtaPrediction(UUID shipmentId, Instant eta, Map<String, Object> raw) {

  public EtaPrediction {
    raw = raw == null ? Map.of() : Map.copyOf(raw);
  }
}
