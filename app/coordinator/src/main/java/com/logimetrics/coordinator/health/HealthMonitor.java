/*
 * Where: Health monitoring
 * What: Probes every configured store, publishes the snapshot and alerts on new outages
 * Why: Operators need one view of backing-store health; a down store is recorded, never thrown
 */
package com.logimetrics.coordinator.health;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import com.logimetrics.coordinator.realtime.RoomScope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Probes, templates and the bus are shared Spring-managed components")
public class HealthMonitor {

  public static final String SNAPSHOT_KEY = "system:health";
  static final String EVENT_HEALTH_ALERT = "alert:new";
  private static final String METRIC_HEALTH_STATE = "coordinator.health.state";

  private static final Logger logger = LoggerFactory.getLogger(HealthMonitor.class);

  private final List<StoreProbe> probes;
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final RealtimeBus realtimeBus;
  private final MeterRegistry meterRegistry;
  private final Duration snapshotTtl;
  private final Clock clock;
  private final AtomicReference<HealthSnapshot> latest = new AtomicReference<>();
  private final ConcurrentMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

  public HealthMonitor(
      List<StoreProbe> probes,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      RealtimeBus realtimeBus,
      MeterRegistry meterRegistry,
      Duration snapshotTtl,
      Clock clock) {
    this.probes = List.copyOf(probes);
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.realtimeBus = realtimeBus;
    this.meterRegistry = meterRegistry;
    this.snapshotTtl = snapshotTtl;
    this.clock = clock;
  }

  public HealthSnapshot check(CancellationToken token) {
    final Map<String, ProbeResult> results = new LinkedHashMap<>();
    final List<String> issues = new ArrayList<>();
    for (StoreProbe probe : probes) {
      token.throwIfCancelled();
      final ProbeResult result = run(probe);
      results.put(probe.name(), result);
      if (result.state() == HealthState.UNHEALTHY) {
        issues.add(probe.name() + ": " + result.detail());
      }
      gauge(probe.name()).set(result.state().gaugeValue());
    }
    final HealthState overall =
        results.values().stream().anyMatch(result -> result.state() == HealthState.UNHEALTHY)
            ? HealthState.UNHEALTHY
            : HealthState.HEALTHY;
    final HealthSnapshot snapshot =
        new HealthSnapshot(Instant.now(clock), overall, results, issues);
    final HealthSnapshot previous = latest.getAndSet(snapshot);
    store(snapshot);
    alertOnNewOutages(previous, snapshot);
    if (overall == HealthState.UNHEALTHY) {
      logger.warn("health check unhealthy issues={}", issues);
    } else {
      logger.info("health check healthy stores={}", results.size());
    }
    return snapshot;
  }

  public Optional<HealthSnapshot> latest() {
    final HealthSnapshot current = latest.get();
    if (current != null) {
      return Optional.of(current);
    }
    try {
      final String raw = redisTemplate.opsForValue().get(SNAPSHOT_KEY);
      return raw == null
          ? Optional.empty()
          : Optional.of(objectMapper.readValue(raw, HealthSnapshot.class));
    } catch (DataAccessException | JsonProcessingException ex) {
      logger.warn("health snapshot unreadable from cache", ex);
      return Optional.empty();
    }
  }

  private ProbeResult run(StoreProbe probe) {
    final long started = System.nanoTime();
    try {
      probe.probe();
      return ProbeResult.healthy(elapsedMs(started));
    } catch (Exception ex) {
      logger.debug("health probe failed store={}", probe.name(), ex);
      return ProbeResult.unhealthy(elapsedMs(started), describe(ex));
    }
  }

  // alerts only fire on the transition into unhealthy, not on every failing probe
  private void alertOnNewOutages(HealthSnapshot previous, HealthSnapshot current) {
    for (Map.Entry<String, ProbeResult> entry : current.stores().entrySet()) {
      final HealthState before =
          previous == null ? HealthState.UNKNOWN : previous.state(entry.getKey());
      if (entry.getValue().state() != HealthState.UNHEALTHY || before == HealthState.UNHEALTHY) {
        continue;
      }
      final Map<String, Object> alert = new LinkedHashMap<>();
      alert.put("severity", "critical");
      alert.put("title", "Store unhealthy");
      alert.put("store", entry.getKey());
      alert.put("message", entry.getValue().detail());
      alert.put("timestamp", current.timestamp().toString());
      logger.error(
          "health transition store={} from={} to=unhealthy detail={}",
          entry.getKey(),
          before.value(),
          entry.getValue().detail());
      realtimeBus.emitToScope(RoomScope.ALERTS, EVENT_HEALTH_ALERT, alert);
    }
  }

  private void store(HealthSnapshot snapshot) {
    try {
      redisTemplate
          .opsForValue()
          .set(SNAPSHOT_KEY, objectMapper.writeValueAsString(snapshot), snapshotTtl);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("health snapshot is not serializable", ex);
    } catch (DataAccessException ex) {
      // redis itself may be the unhealthy store; the in-memory snapshot still serves reads
      logger.warn("health snapshot not cached", ex);
    }
  }

  private AtomicInteger gauge(String store) {
    return gauges.computeIfAbsent(
        store,
        name -> {
          final AtomicInteger value = new AtomicInteger(HealthState.UNKNOWN.gaugeValue());
          Gauge.builder(METRIC_HEALTH_STATE, value, AtomicInteger::get)
              .description("Store health (1 healthy, 0 unhealthy, -1 unknown)")
              .tags(Tags.of("store", name))
              .register(meterRegistry);
          return value;
        });
  }

  private static long elapsedMs(long startedNanos) {
    return Duration.ofNanos(System.nanoTime() - startedNanos).toMillis();
  }

  private static String describe(Exception ex) {
    final String message = ex.getMessage();
    return message == null ? ex.getClass().getSimpleName() : message;
  }
}
