package com.logimetrics.coordinator.dashboard;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Aggregate state of one tenant. Missing statuses are simply absent from the maps. */
public record DashboardSnapshot(
    UUID tenantId,
    Instant generatedAt,
    Map<String, Long> shipmentsByStatus,
    Map<String, Long> fleetByStatus,
    Map<String, Long> driversByStatus,
    TodayCounts today) {

  public DashboardSnapshot {
    shipmentsByStatus = shipmentsByStatus == null ? Map.of() : Map.copyOf(shipmentsByStatus);
    fleetByStatus = fleetByStatus == null ? Map.of() : Map.copyOf(fleetByStatus);
    driversByStatus = driversByStatus == null ? Map.of() : Map.copyOf(driversByStatus);
    today = today == null ? TodayCounts.EMPTY : today;
  }

  public record TodayCounts(long shipmentsCreated, long shipmentsDelivered, BigDecimal revenue) {
    public static final TodayCounts EMPTY = new TodayCounts(0, 0, BigDecimal.ZERO);

    public TodayCounts {
      revenue = revenue == null ? BigDecimal.ZERO : revenue;
    }
  }
}
