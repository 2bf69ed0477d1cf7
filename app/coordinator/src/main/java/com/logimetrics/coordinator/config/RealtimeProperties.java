package com.logimetrics.coordinator.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.realtime")
public record RealtimeProperties(
    String path,
    List<String> allowedOrigins,
    Duration locationTtl,
    Duration sendTimeLimit,
    int sendBufferSizeLimit) {

  public RealtimeProperties {
    path = path == null || path.isBlank() ? "/ws" : path;
    allowedOrigins = allowedOrigins == null ? List.of("*") : List.copyOf(allowedOrigins);
    locationTtl = locationTtl == null ? Duration.ofHours(1) : locationTtl;
    sendTimeLimit = sendTimeLimit == null ? Duration.ofSeconds(5) : sendTimeLimit;
    sendBufferSizeLimit = sendBufferSizeLimit <= 0 ? 512 * 1024 : sendBufferSizeLimit;
  }
}
