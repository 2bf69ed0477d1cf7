package com.logimetrics.coordinator.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "coordinator.queue")
public record NotificationQueueProperties(
    String key, @Positive int batchSize, @Min(0) @Max(10) int maxRetries) {

  public NotificationQueueProperties {
    key = key == null || key.isBlank() ? "notifications:pending" : key;
    batchSize = batchSize <= 0 ? 100 : batchSize;
  }
}
