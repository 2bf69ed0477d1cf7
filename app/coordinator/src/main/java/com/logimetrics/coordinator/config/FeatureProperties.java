package com.logimetrics.coordinator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.features")
public record FeatureProperties(boolean externalSyncEnabled, String mlServiceUrl) {

  public FeatureProperties {
    mlServiceUrl = mlServiceUrl == null ? "" : mlServiceUrl.trim();
  }

  public boolean mlPredictionsEnabled() {
    return !mlServiceUrl.isEmpty();
  }
}
