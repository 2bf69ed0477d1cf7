/*
 * Where: Realtime bus
 * What: Accepts driver location pings, caches the latest fix and re-broadcasts it to tracking and vehicle rooms
 * Why: Only authenticated drivers of the owning company may move a vehicle on everyone's map
 */
package com.logimetrics.coordinator.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.RealtimeProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Store templates and the bus are shared Spring-managed components")
public class LiveLocationPublisher {

  public static final String VEHICLE_KEY_PREFIX = "tracking:vehicle:";
  public static final String LATEST_KEY_PREFIX = "tracking:latest:";
  public static final String LIVE_TRACKING_COLLECTION = "live_tracking";
  static final String EVENT_LOCATION_UPDATE = "location:update";
  static final String EVENT_VEHICLE_LOCATION = "vehicle:location";

  private static final Logger logger = LoggerFactory.getLogger(LiveLocationPublisher.class);

  private final RealtimeBus realtimeBus;
  private final RoomOwnershipResolver ownershipResolver;
  private final StringRedisTemplate redisTemplate;
  private final MongoTemplate mongoTemplate;
  private final ObjectMapper objectMapper;
  private final RealtimeProperties properties;
  private final Clock clock;

  public LiveLocationPublisher(
      RealtimeBus realtimeBus,
      RoomOwnershipResolver ownershipResolver,
      StringRedisTemplate redisTemplate,
      MongoTemplate mongoTemplate,
      ObjectMapper objectMapper,
      RealtimeProperties properties,
      Clock clock) {
    this.realtimeBus = realtimeBus;
    this.ownershipResolver = ownershipResolver;
    this.redisTemplate = redisTemplate;
    this.mongoTemplate = mongoTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.clock = clock;
  }

  public void publish(RealtimePrincipal principal, DriverLocation location) {
    if (location.vehicleId() == null) {
      throw new IllegalArgumentException("vehicleId is required");
    }
    final RoomKey vehicleRoom = RoomKey.of(RoomScope.VEHICLE, location.vehicleId());
    if (!principal.isAuthenticated() || !principal.hasRole(RealtimePrincipal.ROLE_DRIVER)) {
      throw new RealtimeAccessDeniedException(vehicleRoom, "only drivers may publish locations");
    }
    if (!location.hasValidCoordinates()) {
      throw new IllegalArgumentException("coordinates out of range");
    }
    final boolean owned =
        ownershipResolver
            .companyOfVehicle(location.vehicleId())
            .map(owner -> owner.equals(principal.companyId()))
            .orElse(false);
    if (!owned) {
      throw new RealtimeAccessDeniedException(vehicleRoom, "vehicle not in driver's company");
    }

    final Instant now = Instant.now(clock);
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("vehicleId", location.vehicleId());
    payload.put("shipmentId", location.shipmentId());
    payload.put("driverId", principal.driverId());
    payload.put("latitude", location.latitude());
    payload.put("longitude", location.longitude());
    payload.put("speed", location.speed());
    payload.put("heading", location.heading());
    payload.put("timestamp", now.toString());

    cache(location.vehicleId(), payload);
    persist(principal, location, now);

    if (location.shipmentId() != null) {
      realtimeBus.emitToTracking(location.shipmentId().toString(), EVENT_LOCATION_UPDATE, payload);
    }
    realtimeBus.emitToVehicle(location.vehicleId(), EVENT_VEHICLE_LOCATION, payload);
  }

  private void cache(UUID vehicleId, Map<String, Object> payload) {
    try {
      final String json = objectMapper.writeValueAsString(payload);
      final Duration ttl = properties.locationTtl();
      redisTemplate.opsForValue().set(VEHICLE_KEY_PREFIX + vehicleId, json, ttl);
      redisTemplate.opsForValue().set(LATEST_KEY_PREFIX + vehicleId, json, ttl);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("location payload is not serializable", ex);
    } catch (DataAccessException ex) {
      // the broadcast still goes out; the cache catches up with the next ping
      logger.warn("live location cache write failed vehicleId={}", vehicleId, ex);
    }
  }

  private void persist(RealtimePrincipal principal, DriverLocation location, Instant now) {
    final Document point =
        new Document("vehicleId", location.vehicleId().toString())
            .append("companyId", principal.companyId().toString())
            .append("driverId", Objects.toString(principal.driverId(), null))
            .append("shipmentId", Objects.toString(location.shipmentId(), null))
            .append(
                "location",
                new Document("type", "Point")
                    .append("coordinates", List.of(location.longitude(), location.latitude())))
            .append("speed", location.speed())
            .append("heading", location.heading())
            .append("timestamp", Date.from(now));
    try {
      mongoTemplate.insert(point, LIVE_TRACKING_COLLECTION);
    } catch (DataAccessException ex) {
      logger.warn("live tracking point not stored vehicleId={}", location.vehicleId(), ex);
    }
  }
}
