package com.logimetrics.coordinator.notification;

import java.time.Instant;
import java.util.Map;

/** Web push endpoint registered by a browser or device. Identity is the endpoint URL. */
public record PushSubscription(String endpoint, Map<String, String> keys, Instant createdAt) {

  public PushSubscription {
    if (endpoint == null || endpoint.isBlank()) {
      throw new IllegalArgumentException("endpoint is required");
    }
    keys = keys == null ? Map.of() : Map.copyOf(keys);
  }
}
