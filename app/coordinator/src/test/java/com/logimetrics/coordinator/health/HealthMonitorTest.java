package com.logimetrics.coordinator.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import com.logimetrics.coordinator.realtime.RoomScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class HealthMonitorTest {

  private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> values = mock(ValueOperations.class);
  private final RealtimeBus bus = mock(RealtimeBus.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final FakeProbe postgres = new FakeProbe("postgres");
  private final FakeProbe redis = new FakeProbe("redis");
  private HealthMonitor monitor;

  @BeforeEach
  void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(values);
    monitor =
        new HealthMonitor(
            List.of(postgres, redis),
            redisTemplate,
            new ObjectMapper().findAndRegisterModules(),
            bus,
            meterRegistry,
            Duration.ofMinutes(10),
            Clock.fixed(Instant.parse("2026-10-18T00:10:00Z"), ZoneOffset.UTC));
  }

  @Test
  void healthyStoresProduceHealthySnapshot() {
    final HealthSnapshot snapshot = monitor.check(CancellationToken.create());

    assertThat(snapshot.overall()).isEqualTo(HealthState.HEALTHY);
    assertThat(snapshot.issues()).isEmpty();
    assertThat(snapshot.stores()).containsOnlyKeys("postgres", "redis");
    verify(values).set(eq(HealthMonitor.SNAPSHOT_KEY), anyString(), eq(Duration.ofMinutes(10)));
    assertThat(
            meterRegistry.get("coordinator.health.state").tag("store", "postgres").gauge().value())
        .isEqualTo(1.0);
    verify(bus, never()).emitToScope(any(), anyString(), any());
  }

  @Test
  void failingProbeIsRecordedAndAlertedOnceUntilRecovery() {
    postgres.failWith("connection refused");

    final HealthSnapshot first = monitor.check(CancellationToken.create());
    monitor.check(CancellationToken.create());

    assertThat(first.overall()).isEqualTo(HealthState.UNHEALTHY);
    assertThat(first.state("postgres")).isEqualTo(HealthState.UNHEALTHY);
    assertThat(first.state("redis")).isEqualTo(HealthState.HEALTHY);
    assertThat(first.issues()).containsExactly("postgres: connection refused");
    final ArgumentCaptor<Object> alert = ArgumentCaptor.forClass(Object.class);
    verify(bus, times(1))
        .emitToScope(eq(RoomScope.ALERTS), eq(HealthMonitor.EVENT_HEALTH_ALERT), alert.capture());
    @SuppressWarnings("unchecked")
    final Map<String, Object> payload = (Map<String, Object>) alert.getValue();
    assertThat(payload)
        .containsEntry("store", "postgres")
        .containsEntry("severity", "critical")
        .containsEntry("message", "connection refused");

    postgres.recover();
    monitor.check(CancellationToken.create());
    postgres.failWith("connection refused");
    monitor.check(CancellationToken.create());

    verify(bus, times(2)).emitToScope(eq(RoomScope.ALERTS), anyString(), any());
  }

  @Test
  void cacheOutageStillServesLatestSnapshotFromMemory() {
    doThrow(new QueryTimeoutException("redis down"))
        .when(values)
        .set(anyString(), anyString(), any(Duration.class));

    final HealthSnapshot snapshot = monitor.check(CancellationToken.create());

    assertThat(monitor.latest()).contains(snapshot);
  }

  @Test
  void latestIsEmptyBeforeFirstCheckAndWithoutCachedSnapshot() {
    assertThat(monitor.latest()).isEmpty();
  }

  @Test
  void unknownStoreReportsUnknownState() {
    final HealthSnapshot snapshot = monitor.check(CancellationToken.create());

    assertThat(snapshot.state("mongo")).isEqualTo(HealthState.UNKNOWN);
  }

  private static final class FakeProbe implements StoreProbe {

    private final String name;
    private String failure;

    FakeProbe(String name) {
      this.name = name;
    }

    void failWith(String message) {
      failure = message;
    }

    void recover() {
      failure = null;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public void probe() throws Exception {
      if (failure != null) {
        throw new IllegalStateException(failure);
      }
    }
  }
}
