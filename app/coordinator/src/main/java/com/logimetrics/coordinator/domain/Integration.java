package com.logimetrics.coordinator.domain;

import java.time.Instant;
import java.util.UUID;

/** Per-tenant connection to an external ERP, TMS or WMS. */
public record Integration(
    UUID id,
    UUID companyId,
    String type,
    String name,
    String baseUrl,
    String apiKey,
    Instant lastSyncedAt) {

  @Override
  public String toString() {
    return "Integration[id=" + id + ", companyId=" + companyId + ", type=" + type + "]";
  }
}
