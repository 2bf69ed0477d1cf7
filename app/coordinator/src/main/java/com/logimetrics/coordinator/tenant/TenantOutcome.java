package com.logimetrics.coordinator.tenant;

import java.util.UUID;

public record TenantOutcome(UUID tenantId, Status status, String error) {

  public enum Status {
    OK,
    FAILED,
    TIMED_OUT,
    NOT_ATTEMPTED
  }

  public static TenantOutcome ok(UUID tenantId) {
    return new TenantOutcome(tenantId, Status.OK, null);
  }

  public boolean attempted() {
    return status != Status.NOT_ATTEMPTED;
  }
}
