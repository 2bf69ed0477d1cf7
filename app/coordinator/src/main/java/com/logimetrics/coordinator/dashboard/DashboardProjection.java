/*
 * Where: Dashboard projection
 * What: Two-tier cached tenant snapshot plus delta events on material domain changes
 * Why: Dashboards open with a cheap cached read and stay live through deltas instead of polling
 */
package com.logimetrics.coordinator.dashboard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.DashboardProperties;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import com.logimetrics.coordinator.realtime.RoomKey;
import com.logimetrics.coordinator.realtime.RoomScope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Store templates and the bus are shared Spring-managed components")
public class DashboardProjection {

  public static final String SUBSCRIBER_KEY_PREFIX = "dashboard:metrics:";
  public static final String REFRESH_KEY_PREFIX = "analytics:dashboard:";
  static final String EVENT_METRICS_UPDATE = "dashboard:metrics:update";
  static final String EVENT_SHIPMENT_COUNT = "dashboard:shipment:count";
  static final String EVENT_VEHICLE_STATUS = "dashboard:vehicle:status";
  static final String EVENT_ALERT = "dashboard:alert";
  static final String EVENT_ALERT_NEW = "alert:new";

  private static final Logger logger = LoggerFactory.getLogger(DashboardProjection.class);

  private final DashboardRepository repository;
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final RealtimeBus realtimeBus;
  private final DashboardProperties properties;
  private final ZoneId zone;
  private final Clock clock;

  public DashboardProjection(
      DashboardRepository repository,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RealtimeBus realtimeBus,
      DashboardProperties properties,
      SchedulerProperties schedulerProperties,
      Clock clock) {
    this.repository = repository;
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.realtimeBus = realtimeBus;
    this.properties = properties;
    this.zone = schedulerProperties.zoneId();
    this.clock = clock;
  }

  /** On-connect read: subscriber cache first, then the periodic cache, then a fresh compute. */
  public DashboardSnapshot snapshot(UUID tenantId) {
    final Optional<DashboardSnapshot> subscriberCached = read(SUBSCRIBER_KEY_PREFIX, tenantId);
    if (subscriberCached.isPresent()) {
      return subscriberCached.get();
    }
    final DashboardSnapshot snapshot =
        read(REFRESH_KEY_PREFIX, tenantId).orElseGet(() -> compute(tenantId));
    write(SUBSCRIBER_KEY_PREFIX, snapshot, properties.subscriberTtl());
    return snapshot;
  }

  /** Periodic refresh: recompute, store for the refresh window and notify open dashboards. */
  public DashboardSnapshot refresh(UUID tenantId) {
    final DashboardSnapshot snapshot = compute(tenantId);
    write(REFRESH_KEY_PREFIX, snapshot, properties.snapshotTtl());
    realtimeBus.emitToRoom(dashboardRoom(tenantId), EVENT_METRICS_UPDATE, snapshot);
    return snapshot;
  }

  public DashboardSnapshot compute(UUID tenantId) {
    final LocalDate today = LocalDate.now(clock.withZone(zone));
    final Instant from = today.atStartOfDay(zone).toInstant();
    final Instant to = today.plusDays(1).atStartOfDay(zone).toInstant();
    return new DashboardSnapshot(
        tenantId,
        Instant.now(clock),
        repository.shipmentsByStatus(tenantId),
        repository.vehiclesByStatus(tenantId),
        repository.driversByStatus(tenantId),
        repository.todayCounts(tenantId, from, to));
  }

  public void invalidate(UUID tenantId) {
    try {
      redisTemplate.delete(
          List.of(SUBSCRIBER_KEY_PREFIX + tenantId, REFRESH_KEY_PREFIX + tenantId));
    } catch (DataAccessException ex) {
      logger.warn("dashboard cache invalidation failed tenantId={}", tenantId, ex);
    }
  }

  @EventListener
  public void onShipmentStatusChanged(ShipmentStatusChanged event) {
    invalidate(event.companyId());
    final Map<String, Object> delta = new LinkedHashMap<>();
    delta.put("shipmentId", event.shipmentId());
    delta.put("previousStatus", event.previousStatus());
    delta.put("status", event.newStatus());
    realtimeBus.emitToRoom(dashboardRoom(event.companyId()), EVENT_SHIPMENT_COUNT, delta);
  }

  @EventListener
  public void onVehicleStatusChanged(VehicleStatusChanged event) {
    invalidate(event.companyId());
    final Map<String, Object> delta = new LinkedHashMap<>();
    delta.put("vehicleId", event.vehicleId());
    delta.put("previousStatus", event.previousStatus());
    delta.put("status", event.newStatus());
    delta.put("reason", event.reason());
    realtimeBus.emitToRoom(dashboardRoom(event.companyId()), EVENT_VEHICLE_STATUS, delta);
  }

  @EventListener
  public void onAlertRaised(DashboardAlertRaised event) {
    invalidate(event.companyId());
    final Map<String, Object> alert = new LinkedHashMap<>();
    alert.put("severity", event.severity());
    alert.put("title", event.title());
    alert.put("message", event.message());
    alert.put("data", event.data());
    realtimeBus.emitToRoom(dashboardRoom(event.companyId()), EVENT_ALERT, alert);
    realtimeBus.emitToRoom(RoomKey.of(RoomScope.ALERTS, event.companyId()), EVENT_ALERT_NEW, alert);
  }

  private static RoomKey dashboardRoom(UUID tenantId) {
    return RoomKey.of(RoomScope.DASHBOARD, tenantId);
  }

  private Optional<DashboardSnapshot> read(String prefix, UUID tenantId) {
    final String raw;
    try {
      raw = redisTemplate.opsForValue().get(prefix + tenantId);
    } catch (DataAccessException ex) {
      logger.warn("dashboard cache read failed key={}{}", prefix, tenantId, ex);
      return Optional.empty();
    }
    if (raw == null) {
      return Optional.empty();
    }
    try {
      final DashboardSnapshot cached = objectMapper.readValue(raw, DashboardSnapshot.class);
      // a cached value for another tenant is never served
      return tenantId.equals(cached.tenantId()) ? Optional.of(cached) : Optional.empty();
    } catch (JsonProcessingException ex) {
      logger.warn("dashboard cache entry unreadable key={}{}", prefix, tenantId, ex);
      return Optional.empty();
    }
  }

  private void write(String prefix, DashboardSnapshot snapshot, Duration ttl) {
    try {
      redisTemplate
          .opsForValue()
          .set(prefix + snapshot.tenantId(), objectMapper.writeValueAsString(snapshot), ttl);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("dashboard snapshot is not serializable", ex);
    } catch (DataAccessException ex) {
      logger.warn("dashboard cache write failed key={}{}", prefix, snapshot.tenantId(), ex);
    }
  }
}
