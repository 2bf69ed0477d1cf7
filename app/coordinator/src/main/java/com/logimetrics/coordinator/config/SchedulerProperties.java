/*
 * Where: Coordinator configuration binding
 * What: Holds scheduler timezone, worker pool sizes, timeouts and shutdown grace
 * Why: Cadence zone and resource limits differ per environment
 */
package com.logimetrics.coordinator.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "coordinator.scheduler")
public record SchedulerProperties(
    boolean enabled,
    @NotBlank String timezone,
    Duration defaultTimeout,
    Duration shutdownGrace,
    @Positive int workerPoolSize,
    @Positive int tenantPoolSize,
    Duration minTenantTimeout) {

  public SchedulerProperties {
    timezone = timezone == null || timezone.isBlank() ? "Asia/Kolkata" : timezone;
    defaultTimeout = defaultTimeout == null ? Duration.ofMinutes(5) : defaultTimeout;
    shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
    workerPoolSize = workerPoolSize <= 0 ? 8 : workerPoolSize;
    tenantPoolSize = tenantPoolSize <= 0 ? 4 : tenantPoolSize;
    minTenantTimeout = minTenantTimeout == null ? Duration.ofSeconds(2) : minTenantTimeout;
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }

  @AssertTrue(message = "coordinator.scheduler.timezone must be a valid IANA zone id")
  public boolean isTimezoneValid() {
    try {
      ZoneId.of(timezone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  @AssertTrue(message = "coordinator.scheduler durations must be positive")
  public boolean isDurationsPositive() {
    return isPositive(defaultTimeout) && isPositive(shutdownGrace) && isPositive(minTenantTimeout);
  }

  private static boolean isPositive(Duration value) {
    return value != null && !value.isZero() && !value.isNegative();
  }
}
