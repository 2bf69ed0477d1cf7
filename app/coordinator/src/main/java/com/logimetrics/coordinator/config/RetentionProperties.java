/*
 * Where: Coordinator configuration binding
 * What: Retention windows for archival, cleanup and rotation jobs
 * Why: Legal and storage requirements change per deployment without a code change
 */
package com.logimetrics.coordinator.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "coordinator.retention")
public record RetentionProperties(
    Duration tracking,
    Duration telemetry,
    Duration audit,
    Duration softDeleted,
    Duration notifications,
    Duration staleSession,
    Duration tempFiles,
    Duration refreshTokens,
    Duration logFiles,
    Duration logArchive,
    Duration orphanUploads,
    @Positive int archiveBatchSize,
    DataSize maxLogFileSize,
    String logDirectory,
    List<String> tempDirectories) {

  public RetentionProperties {
    tracking = tracking == null ? Duration.ofDays(30) : tracking;
    telemetry = telemetry == null ? Duration.ofDays(30) : telemetry;
    audit = audit == null ? Duration.ofDays(365) : audit;
    softDeleted = softDeleted == null ? Duration.ofDays(90) : softDeleted;
    notifications = notifications == null ? Duration.ofDays(30) : notifications;
    staleSession = staleSession == null ? Duration.ofMinutes(30) : staleSession;
    tempFiles = tempFiles == null ? Duration.ofDays(1) : tempFiles;
    refreshTokens = refreshTokens == null ? Duration.ofDays(30) : refreshTokens;
    logFiles = logFiles == null ? Duration.ofDays(30) : logFiles;
    logArchive = logArchive == null ? Duration.ofDays(60) : logArchive;
    orphanUploads = orphanUploads == null ? Duration.ofDays(1) : orphanUploads;
    archiveBatchSize = archiveBatchSize <= 0 ? 10_000 : archiveBatchSize;
    maxLogFileSize = maxLogFileSize == null ? DataSize.ofMegabytes(10) : maxLogFileSize;
    logDirectory = logDirectory == null || logDirectory.isBlank() ? "logs" : logDirectory;
    tempDirectories = tempDirectories == null ? List.of() : List.copyOf(tempDirectories);
  }

  @AssertTrue(message = "coordinator.retention windows must be positive")
  public boolean isWindowsPositive() {
    for (Duration window :
        List.of(
            tracking,
            telemetry,
            audit,
            softDeleted,
            notifications,
            staleSession,
            tempFiles,
            refreshTokens,
            logFiles,
            logArchive,
            orphanUploads)) {
      if (window.isZero() || window.isNegative()) {
        return false;
      }
    }
    return true;
  }

  @AssertTrue(message = "coordinator.retention.archive-batch-size must not exceed 10000")
  public boolean isArchiveBatchBounded() {
    return archiveBatchSize <= 10_000;
  }
}
