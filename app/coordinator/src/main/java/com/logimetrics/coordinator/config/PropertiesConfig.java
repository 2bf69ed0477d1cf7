package com.logimetrics.coordinator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  SchedulerProperties.class,
  NotificationQueueProperties.class,
  RetentionProperties.class,
  FeatureProperties.class,
  DashboardProperties.class,
  HealthProperties.class,
  ChannelProperties.class,
  RealtimeProperties.class,
  InternalApiProperties.class,
  IntegrationProperties.class
})
public class PropertiesConfig {}
