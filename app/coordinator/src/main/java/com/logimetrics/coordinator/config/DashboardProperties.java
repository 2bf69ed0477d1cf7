package com.logimetrics.coordinator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordinator.dashboard")
public record DashboardProperties(Duration snapshotTtl, Duration subscriberTtl) {

  public DashboardProperties {
    snapshotTtl = snapshotTtl == null ? Duration.ofMinutes(15) : snapshotTtl;
    subscriberTtl = subscriberTtl == null ? Duration.ofSeconds(30) : subscriberTtl;
  }
}
