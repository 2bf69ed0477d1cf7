/*
 * Where: Tenant iteration
 * What: Bounds applied to one pass over all tenants
 * Why: One large company must not monopolise a job cycle or hide failures of the others
 */
package com.logimetrics.coordinator.tenant;

import java.time.Duration;

public final class IterationOptions {

  public static final int DEFAULT_BATCH_SIZE = 100;
  public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMinutes(5);
  public static final Duration MIN_TENANT_TIMEOUT = Duration.ofSeconds(2);

  private final int batchSize;
  private final Duration perTenantTimeout;
  private final Duration jobTimeout;
  private final Duration minTenantTimeout;
  private final boolean continueOnError;

  private IterationOptions(Builder builder) {
    this.batchSize = builder.batchSize;
    this.perTenantTimeout = builder.perTenantTimeout;
    this.jobTimeout = builder.jobTimeout;
    this.minTenantTimeout = builder.minTenantTimeout;
    this.continueOnError = builder.continueOnError;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static IterationOptions defaults() {
    return builder().build();
  }

  public int batchSize() {
    return batchSize;
  }

  public boolean continueOnError() {
    return continueOnError;
  }

  /**
   * Explicit per-tenant timeout if one was set, otherwise the job timeout split evenly across
   * {@code tenantCount} tenants with a floor.
   */
  public Duration resolvePerTenantTimeout(int tenantCount) {
    if (perTenantTimeout != null) {
      return perTenantTimeout;
    }
    final Duration share = jobTimeout.dividedBy(Math.max(1, tenantCount));
    return share.compareTo(minTenantTimeout) < 0 ? minTenantTimeout : share;
  }

  public static final class Builder {

    private int batchSize = DEFAULT_BATCH_SIZE;
    private Duration perTenantTimeout;
    private Duration jobTimeout = DEFAULT_JOB_TIMEOUT;
    private Duration minTenantTimeout = MIN_TENANT_TIMEOUT;
    private boolean continueOnError = true;

    private Builder() {}

    public Builder batchSize(int batchSize) {
      if (batchSize <= 0) {
        throw new IllegalArgumentException("batchSize must be positive");
      }
      this.batchSize = batchSize;
      return this;
    }

    public Builder perTenantTimeout(Duration perTenantTimeout) {
      this.perTenantTimeout = perTenantTimeout;
      return this;
    }

    public Builder jobTimeout(Duration jobTimeout) {
      this.jobTimeout = jobTimeout;
      return this;
    }

    public Builder minTenantTimeout(Duration minTenantTimeout) {
      this.minTenantTimeout = minTenantTimeout;
      return this;
    }

    public Builder continueOnError(boolean continueOnError) {
      this.continueOnError = continueOnError;
      return this;
    }

    public IterationOptions build() {
      if (jobTimeout == null || jobTimeout.isNegative() || jobTimeout.isZero()) {
        throw new IllegalArgumentException("jobTimeout must be positive");
      }
      if (perTenantTimeout != null
          && (perTenantTimeout.isNegative() || perTenantTimeout.isZero())) {
        throw new IllegalArgumentException("perTenantTimeout must be positive");
      }
      return new IterationOptions(this);
    }
  }
}
