package com.logimetrics.coordinator.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.logimetrics.coordinator.archive.ArchivalService;
import com.logimetrics.coordinator.archive.ArchiveResult;
import com.logimetrics.coordinator.archive.ArchiveSource;
import com.logimetrics.coordinator.archive.LogRotator;
import com.logimetrics.coordinator.archive.OrphanSweeper;
import com.logimetrics.coordinator.archive.TempFileSweeper;
import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.domain.RefreshTokenStore;
import com.logimetrics.coordinator.job.CancellationToken;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

class CleanupJobsTest {

  private static final Instant NOW = Instant.parse("2026-10-18T21:30:00Z");

  private final ArchivalService archivalService = mock(ArchivalService.class);
  private final OrphanSweeper orphanSweeper = mock(OrphanSweeper.class);
  private final RefreshTokenStore refreshTokenStore = mock(RefreshTokenStore.class);
  private CleanupJobs jobs;

  @BeforeEach
  void setUp() {
    jobs =
        new CleanupJobs(
            archivalService,
            mock(NamedParameterJdbcTemplate.class),
            mock(MongoTemplate.class),
            orphanSweeper,
            mock(LogRotator.class),
            mock(TempFileSweeper.class),
            refreshTokenStore,
            new RetentionProperties(
                null, null, null, null, null, null, null, null, null, null, null, 0, null, null,
                null),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void purgesChildTablesBeforeParentsThenArchivesAudit() {
    when(archivalService.archive(any(), any(), anyInt(), any()))
        .thenReturn(new ArchiveResult("shipments", 4, 4, 1, false))
        .thenReturn(new ArchiveResult("documents", 0, 0, 0, true));
    when(orphanSweeper.sweep(any())).thenReturn(new OrphanSweeper.SweepResult(2, 1));

    final CleanupJobs.DatabaseCleanup cleanup =
        jobs.cleanupDatabase(CancellationToken.create());

    final ArgumentCaptor<ArchiveSource> sources = ArgumentCaptor.forClass(ArchiveSource.class);
    final ArgumentCaptor<Duration> windows = ArgumentCaptor.forClass(Duration.class);
    verify(archivalService, times(6))
        .archive(sources.capture(), windows.capture(), anyInt(), any());
    assertThat(sources.getAllValues())
        .extracting(ArchiveSource::name)
        .containsExactly(
            "shipments", "documents", "notifications", "drivers", "vehicles", "audit_logs");
    assertThat(windows.getAllValues().subList(0, 5)).containsOnly(Duration.ofDays(90));
    assertThat(windows.getAllValues().get(5)).isEqualTo(Duration.ofDays(365));
    assertThat(cleanup.archives()).hasSize(6);
    assertThat(cleanup.orphans().orphans()).isEqualTo(2);
  }

  @Test
  void tokenCleanupClearsOldTokensAndTtlLessKeys() {
    final CancellationToken token = CancellationToken.create();
    when(refreshTokenStore.clearIssuedBefore(NOW.minus(Duration.ofDays(30)))).thenReturn(3);
    when(refreshTokenStore.deleteKeysWithoutTtl(token)).thenReturn(5);

    assertThat(jobs.cleanupExpiredTokens(token)).isEqualTo(new CleanupJobs.TokenCleanup(3, 5));
  }
}
