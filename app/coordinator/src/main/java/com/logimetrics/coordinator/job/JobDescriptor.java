/*
 * Where: Job model
 * What: Immutable definition of a named periodic job
 * Why: Registration validates everything up front so the scheduler only deals with well-formed jobs
 */
package com.logimetrics.coordinator.job;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.BooleanSupplier;

public final class JobDescriptor {

  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

  private final String name;
  private final String cron;
  private final ZoneId zone;
  private final JobHandler handler;
  private final BooleanSupplier enabledWhen;
  private final Duration timeout;
  private final ConcurrencyPolicy concurrencyPolicy;
  private final String description;

  private JobDescriptor(Builder builder) {
    this.name = builder.name;
    this.cron = builder.cron;
    this.zone = builder.zone;
    this.handler = builder.handler;
    this.enabledWhen = builder.enabledWhen;
    this.timeout = builder.timeout;
    this.concurrencyPolicy = builder.concurrencyPolicy;
    this.description = builder.description;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String name() {
    return name;
  }

  public String cron() {
    return cron;
  }

  public ZoneId zone() {
    return zone;
  }

  public JobHandler handler() {
    return handler;
  }

  /** Feature gate, evaluated once when the job is registered. */
  public BooleanSupplier enabledWhen() {
    return enabledWhen;
  }

  public Duration timeout() {
    return timeout;
  }

  public ConcurrencyPolicy concurrencyPolicy() {
    return concurrencyPolicy;
  }

  public String description() {
    return description;
  }

  public static final class Builder {

    private final String name;
    private String cron;
    private ZoneId zone = ZoneId.of("UTC");
    private JobHandler handler;
    private BooleanSupplier enabledWhen = () -> true;
    private Duration timeout = DEFAULT_TIMEOUT;
    private ConcurrencyPolicy concurrencyPolicy = ConcurrencyPolicy.SKIP_IF_RUNNING;
    private String description = "";

    private Builder(String name) {
      this.name = name;
    }

    public Builder cron(String cron) {
      this.cron = cron;
      return this;
    }

    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    public Builder handler(JobHandler handler) {
      this.handler = handler;
      return this;
    }

    public Builder enabledWhen(BooleanSupplier enabledWhen) {
      this.enabledWhen = enabledWhen;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder concurrencyPolicy(ConcurrencyPolicy concurrencyPolicy) {
      this.concurrencyPolicy = concurrencyPolicy;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public JobDescriptor build() {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("job name is required");
      }
      Objects.requireNonNull(handler, "handler is required for job " + name);
      Objects.requireNonNull(zone, "zone is required for job " + name);
      Objects.requireNonNull(enabledWhen, "enabledWhen is required for job " + name);
      Objects.requireNonNull(concurrencyPolicy, "concurrencyPolicy is required for job " + name);
      if (timeout == null || timeout.isZero() || timeout.isNegative()) {
        throw new IllegalArgumentException("timeout must be positive for job " + name);
      }
      return new JobDescriptor(this);
    }
  }
}
