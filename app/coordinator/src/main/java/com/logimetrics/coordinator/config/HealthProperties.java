package com.logimetrics.coordinator.config;

import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** externalServices maps a service name to its HTTP health URL. */
@ConfigurationProperties(prefix = "coordinator.health")
public record HealthProperties(
    Duration snapshotTtl, Map<String, String> externalServices, String filesystemPath) {

  public HealthProperties {
    snapshotTtl = snapshotTtl == null ? Duration.ofMinutes(10) : snapshotTtl;
    externalServices = externalServices == null ? Map.of() : Map.copyOf(externalServices);
    filesystemPath = filesystemPath == null || filesystemPath.isBlank() ? "." : filesystemPath;
  }
}
