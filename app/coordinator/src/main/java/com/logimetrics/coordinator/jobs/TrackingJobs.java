/*
 * Where: Periodic jobs
 * What: Tracking archival, stale live-session cleanup and daily per-vehicle movement metrics
 * Why: Live tracking collections grow with every GPS ping and must stay small and current
 */
package com.logimetrics.coordinator.jobs;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.group;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.match;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.newAggregation;
import static org.springframework.data.mongodb.core.aggregation.Aggregation.sort;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.logimetrics.coordinator.archive.ArchivalService;
import com.logimetrics.coordinator.archive.ArchiveResult;
import com.logimetrics.coordinator.archive.ArchiveSource;
import com.logimetrics.coordinator.archive.MongoArchiveSource;
import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.domain.ReportRepository;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.realtime.LiveLocationPublisher;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Store templates and the bus are shared Spring-managed components")
public class TrackingJobs {

  static final String EVENT_VEHICLE_STALE = "vehicle:stale";
  static final String LIVE_TRACKING = LiveLocationPublisher.LIVE_TRACKING_COLLECTION;
  static final String VEHICLE_TELEMETRY = "vehicle_telemetry";

  private static final Logger logger = LoggerFactory.getLogger(TrackingJobs.class);
  private static final long SCAN_COUNT = 500;

  private final ArchivalService archivalService;
  private final ArchiveSource trackingSource;
  private final ArchiveSource telemetrySource;
  private final MongoTemplate mongoTemplate;
  private final ReportRepository reportRepository;
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final RealtimeBus realtimeBus;
  private final RetentionProperties retention;
  private final ZoneId zone;
  private final Clock clock;

  public TrackingJobs(
      ArchivalService archivalService,
      MongoTemplate mongoTemplate,
      ReportRepository reportRepository,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RealtimeBus realtimeBus,
      RetentionProperties retention,
      SchedulerProperties schedulerProperties,
      Clock clock) {
    this.archivalService = archivalService;
    this.mongoTemplate = mongoTemplate;
    this.trackingSource =
        new MongoArchiveSource(mongoTemplate, LIVE_TRACKING, "timestamp", "live_tracking_archive");
    this.telemetrySource =
        new MongoArchiveSource(
            mongoTemplate, VEHICLE_TELEMETRY, "timestamp", "vehicle_telemetry_archive");
    this.reportRepository = reportRepository;
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.realtimeBus = realtimeBus;
    this.retention = retention;
    this.zone = schedulerProperties.zoneId();
    this.clock = clock;
  }

  public List<ArchiveResult> archiveOldTrackingData(CancellationToken token) {
    final List<ArchiveResult> results = new ArrayList<>(2);
    results.add(
        archivalService.archive(
            trackingSource, retention.tracking(), retention.archiveBatchSize(), token));
    results.add(
        archivalService.archive(
            telemetrySource, retention.telemetry(), retention.archiveBatchSize(), token));
    return results;
  }

  /**
   * Drops cached live positions of vehicles that stopped reporting and tells open vehicle rooms.
   * Returns the affected vehicle ids.
   */
  public List<UUID> cleanupStaleSessions(CancellationToken token) {
    final Instant staleBefore = Instant.now(clock).minus(retention.staleSession());
    final List<UUID> stale = new ArrayList<>();
    final ScanOptions options =
        ScanOptions.scanOptions()
            .match(LiveLocationPublisher.LATEST_KEY_PREFIX + "*")
            .count(SCAN_COUNT)
            .build();
    final List<String> keys = new ArrayList<>();
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        keys.add(cursor.next());
      }
    }
    for (String key : keys) {
      token.throwIfCancelled();
      final String vehicleId = key.substring(LiveLocationPublisher.LATEST_KEY_PREFIX.length());
      final Instant lastSeen = lastSeen(redisTemplate.opsForValue().get(key));
      if (lastSeen != null && !lastSeen.isBefore(staleBefore)) {
        continue;
      }
      redisTemplate.delete(
          List.of(key, LiveLocationPublisher.VEHICLE_KEY_PREFIX + vehicleId));
      final UUID id = parseUuid(vehicleId);
      if (id == null) {
        continue;
      }
      stale.add(id);
      final Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("vehicleId", id);
      payload.put("lastSeen", lastSeen == null ? null : lastSeen.toString());
      realtimeBus.emitToVehicle(id, EVENT_VEHICLE_STALE, payload);
    }
    logger.info(
        "stale tracking sessions cleaned scanned={} stale={} staleBefore={}",
        keys.size(),
        stale.size(),
        staleBefore);
    return stale;
  }

  @VisibleForTesting
  Instant lastSeen(String json) {
    if (json == null) {
      return null;
    }
    try {
      final JsonNode node = objectMapper.readTree(json);
      return node.hasNonNull("timestamp") ? Instant.parse(node.get("timestamp").asText()) : null;
    } catch (JsonProcessingException | DateTimeParseException ex) {
      logger.debug("unreadable live location entry", ex);
      return null;
    }
  }

  /** Per-vehicle movement summary of the previous local day. */
  public int aggregateTrackingMetrics(CancellationToken token) {
    final LocalDate day = LocalDate.now(clock.withZone(zone)).minusDays(1);
    final Date from = Date.from(day.atStartOfDay(zone).toInstant());
    final Date to = Date.from(day.plusDays(1).atStartOfDay(zone).toInstant());
    final Aggregation aggregation =
        newAggregation(
            match(Criteria.where("timestamp").gte(from).lt(to)),
            sort(Sort.by(Sort.Direction.ASC, "vehicleId", "timestamp")),
            group("vehicleId")
                .first("companyId")
                .as("companyId")
                .count()
                .as("totalPoints")
                .avg("speed")
                .as("avgSpeed")
                .max("speed")
                .as("maxSpeed")
                .sum(
                    ConditionalOperators.when(Criteria.where("speed").gt(0))
                        .then(1)
                        .otherwise(0))
                .as("movingPoints")
                .first("location")
                .as("firstLocation")
                .last("location")
                .as("lastLocation"));
    final List<Document> perVehicle =
        mongoTemplate.aggregate(aggregation, LIVE_TRACKING, Document.class).getMappedResults();
    final Date createdAt = Date.from(Instant.now(clock));
    for (Document metric : perVehicle) {
      token.throwIfCancelled();
      final Object vehicleId = metric.get("_id");
      final Number avgSpeed = metric.get("avgSpeed", Number.class);
      final int total = metric.getInteger("totalPoints", 0);
      final int moving = metric.getInteger("movingPoints", 0);
      final Document daily =
          new Document("_id", vehicleId + ":" + day)
              .append("vehicleId", vehicleId)
              .append("companyId", metric.get("companyId"))
              .append("date", from)
              .append("totalPoints", total)
              .append(
                  "avgSpeed",
                  avgSpeed == null ? 0.0 : Math.round(avgSpeed.doubleValue() * 100) / 100.0)
              .append("maxSpeed", metric.get("maxSpeed"))
              .append("movingPoints", moving)
              .append("idlePoints", total - moving)
              .append("firstLocation", metric.get("firstLocation"))
              .append("lastLocation", metric.get("lastLocation"))
              .append("createdAt", createdAt);
      reportRepository.save(ReportRepository.TRACKING_DAILY_METRICS, daily);
    }
    logger.info("tracking metrics aggregated day={} vehicles={}", day, perVehicle.size());
    return perVehicle.size();
  }

  private static UUID parseUuid(String value) {
    try {
      return UUID.fromString(value);
    } catch (IllegalArgumentException ex) {
      logger.debug("live location key without vehicle uuid value={}", value);
      return null;
    }
  }
}
