/*
 * Where: Periodic jobs
 * What: Soft-delete purge, audit archival, orphan sweep, log rotation, temp files and tokens
 * Why: Storage hygiene runs on its own cadence so request paths never pay for it
 */
package com.logimetrics.coordinator.jobs;

import com.logimetrics.coordinator.archive.ArchivalService;
import com.logimetrics.coordinator.archive.ArchiveResult;
import com.logimetrics.coordinator.archive.ArchiveSource;
import com.logimetrics.coordinator.archive.JdbcArchiveSource;
import com.logimetrics.coordinator.archive.LogRotator;
import com.logimetrics.coordinator.archive.MongoArchiveSource;
import com.logimetrics.coordinator.archive.OrphanSweeper;
import com.logimetrics.coordinator.archive.TempFileSweeper;
import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.domain.AuditTrail;
import com.logimetrics.coordinator.domain.RefreshTokenStore;
import com.logimetrics.coordinator.job.CancellationToken;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Templates and sweepers are shared Spring-managed components")
public class CleanupJobs {

  /** Children before parents so foreign keys never block a purge. */
  static final List<String> SOFT_DELETED_TABLES =
      List.of("shipments", "documents", "notifications", "drivers", "vehicles");

  private static final Logger logger = LoggerFactory.getLogger(CleanupJobs.class);

  private final ArchivalService archivalService;
  private final List<ArchiveSource> softDeletedSources;
  private final ArchiveSource auditSource;
  private final OrphanSweeper orphanSweeper;
  private final LogRotator logRotator;
  private final TempFileSweeper tempFileSweeper;
  private final RefreshTokenStore refreshTokenStore;
  private final RetentionProperties retention;
  private final Clock clock;

  public record DatabaseCleanup(List<ArchiveResult> archives, OrphanSweeper.SweepResult orphans) {}

  public record TokenCleanup(int databaseTokens, int cacheKeys) {}

  public CleanupJobs(
      ArchivalService archivalService,
      NamedParameterJdbcTemplate jdbcTemplate,
      MongoTemplate mongoTemplate,
      OrphanSweeper orphanSweeper,
      LogRotator logRotator,
      TempFileSweeper tempFileSweeper,
      RefreshTokenStore refreshTokenStore,
      RetentionProperties retention,
      Clock clock) {
    this.archivalService = archivalService;
    this.softDeletedSources =
        SOFT_DELETED_TABLES.stream()
            .map(table -> (ArchiveSource) JdbcArchiveSource.softDeleted(jdbcTemplate, table))
            .toList();
    this.auditSource =
        new MongoArchiveSource(
            mongoTemplate, AuditTrail.AUDIT_LOGS, "timestamp", AuditTrail.AUDIT_LOGS + "_archive");
    this.orphanSweeper = orphanSweeper;
    this.logRotator = logRotator;
    this.tempFileSweeper = tempFileSweeper;
    this.refreshTokenStore = refreshTokenStore;
    this.retention = retention;
    this.clock = clock;
  }

  public DatabaseCleanup cleanupDatabase(CancellationToken token) {
    final List<ArchiveResult> archives = new ArrayList<>(softDeletedSources.size() + 1);
    for (ArchiveSource source : softDeletedSources) {
      token.throwIfCancelled();
      archives.add(
          archivalService.archive(
              source, retention.softDeleted(), retention.archiveBatchSize(), token));
    }
    token.throwIfCancelled();
    archives.add(
        archivalService.archive(
            auditSource, retention.audit(), retention.archiveBatchSize(), token));
    final OrphanSweeper.SweepResult orphans = orphanSweeper.sweep(token);
    final long purged = archives.stream().mapToLong(ArchiveResult::deleted).sum();
    final long abandoned = archives.stream().filter(ArchiveResult::abandoned).count();
    logger.info(
        "database cleanup finished purged={} abandonedSources={} orphans={} stuckUploads={}",
        purged,
        abandoned,
        orphans.orphans(),
        orphans.stuckUploads());
    return new DatabaseCleanup(List.copyOf(archives), orphans);
  }

  public LogRotator.RotationResult rotateLogs(CancellationToken token) throws IOException {
    return logRotator.rotate();
  }

  public TempFileSweeper.SweepResult cleanupTempFiles(CancellationToken token) {
    return tempFileSweeper.sweep();
  }

  public TokenCleanup cleanupExpiredTokens(CancellationToken token) {
    final Instant issuedBefore = Instant.now(clock).minus(retention.refreshTokens());
    final int databaseTokens = refreshTokenStore.clearIssuedBefore(issuedBefore);
    final int cacheKeys = refreshTokenStore.deleteKeysWithoutTtl(token);
    logger.info(
        "expired tokens cleaned databaseTokens={} cacheKeys={} issuedBefore={}",
        databaseTokens,
        cacheKeys,
        issuedBefore);
    return new TokenCleanup(databaseTokens, cacheKeys);
  }
}
