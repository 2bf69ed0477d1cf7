package com.logimetrics.coordinator.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.archive.ArchivalService;
import com.logimetrics.coordinator.archive.ArchiveResult;
import com.logimetrics.coordinator.archive.ArchiveSource;
import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.domain.ReportRepository;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.realtime.LiveLocationPublisher;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class TrackingJobsTest {

  private static final Instant NOW = Instant.parse("2026-10-18T06:00:00Z");

  private final ArchivalService archivalService = mock(ArchivalService.class);
  private final StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> values = mock(ValueOperations.class);
  private final RealtimeBus bus = mock(RealtimeBus.class);
  private TrackingJobs jobs;

  @BeforeEach
  void setUp() {
    when(redisTemplate.opsForValue()).thenReturn(values);
    jobs =
        new TrackingJobs(
            archivalService,
            mock(MongoTemplate.class),
            mock(ReportRepository.class),
            redisTemplate,
            new ObjectMapper(),
            bus,
            new RetentionProperties(
                null, null, null, null, null, null, null, null, null, null, null, 500, null,
                null, null),
            new SchedulerProperties(true, "Asia/Kolkata", null, null, 0, 0, null),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void staleAndUnreadableSessionsAreDroppedAndAnnounced() {
    final UUID fresh = UUID.randomUUID();
    final UUID stale = UUID.randomUUID();
    final UUID garbled = UUID.randomUUID();
    scanReturns(latestKey(fresh), latestKey(stale), latestKey(garbled));
    when(values.get(latestKey(fresh))).thenReturn(location(NOW.minus(Duration.ofMinutes(5))));
    when(values.get(latestKey(stale))).thenReturn(location(NOW.minus(Duration.ofHours(2))));
    when(values.get(latestKey(garbled))).thenReturn("{not json");

    final List<UUID> dropped = jobs.cleanupStaleSessions(CancellationToken.create());

    assertThat(dropped).containsExactly(stale, garbled);
    verify(redisTemplate)
        .delete(List.of(latestKey(stale), LiveLocationPublisher.VEHICLE_KEY_PREFIX + stale));
    verify(redisTemplate, never())
        .delete(List.of(latestKey(fresh), LiveLocationPublisher.VEHICLE_KEY_PREFIX + fresh));
    verify(bus).emitToVehicle(eq(stale), eq(TrackingJobs.EVENT_VEHICLE_STALE), any());
    verify(bus, never()).emitToVehicle(eq(fresh), anyString(), any());
  }

  @Test
  void keyWithoutVehicleUuidIsDeletedButNotAnnounced() {
    scanReturns(LiveLocationPublisher.LATEST_KEY_PREFIX + "legacy");

    final List<UUID> dropped = jobs.cleanupStaleSessions(CancellationToken.create());

    assertThat(dropped).isEmpty();
    verify(redisTemplate)
        .delete(
            List.of(
                LiveLocationPublisher.LATEST_KEY_PREFIX + "legacy",
                LiveLocationPublisher.VEHICLE_KEY_PREFIX + "legacy"));
    verify(bus, never()).emitToVehicle(any(), anyString(), any());
  }

  @Test
  void lastSeenReadsTimestampField() {
    assertThat(jobs.lastSeen(location(NOW))).isEqualTo(NOW);
    assertThat(jobs.lastSeen("{\"lat\":12.9}")).isNull();
    assertThat(jobs.lastSeen("{\"timestamp\":\"yesterday\"}")).isNull();
    assertThat(jobs.lastSeen(null)).isNull();
  }

  @Test
  void archivalCoversTrackingThenTelemetry() {
    when(archivalService.archive(any(), any(), eq(500), any()))
        .thenReturn(new ArchiveResult("x", 0, 0, 0, false));

    jobs.archiveOldTrackingData(CancellationToken.create());

    final ArgumentCaptor<ArchiveSource> sources = ArgumentCaptor.forClass(ArchiveSource.class);
    verify(archivalService, times(2))
        .archive(sources.capture(), eq(Duration.ofDays(30)), eq(500), any());
    assertThat(sources.getAllValues())
        .extracting(ArchiveSource::archiveCollection)
        .containsExactly("live_tracking_archive", "vehicle_telemetry_archive");
  }

  @SuppressWarnings("unchecked")
  private void scanReturns(String... keys) {
    final Cursor<String> cursor = mock(Cursor.class);
    final Iterator<String> iterator = List.of(keys).iterator();
    when(cursor.hasNext()).thenAnswer(invocation -> iterator.hasNext());
    when(cursor.next()).thenAnswer(invocation -> iterator.next());
    when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);
  }

  private static String latestKey(UUID vehicleId) {
    return LiveLocationPublisher.LATEST_KEY_PREFIX + vehicleId;
  }

  private static String location(Instant timestamp) {
    return "{\"lat\":12.9,\"lng\":77.5,\"timestamp\":\"" + timestamp + "\"}";
  }
}
