/*
 * Where: Archival
 * What: Deletes aged log files, compresses oversized ones into archive/ and expires old archives
 * Why: Log volumes on the coordinator host are small and must not fill up between deployments
 */
package com.logimetrics.coordinator.archive;

import com.logimetrics.coordinator.config.RetentionProperties;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LogRotator {

  static final String ARCHIVE_DIRECTORY = "archive";
  static final String LOG_SUFFIX = ".log";

  private static final Logger logger = LoggerFactory.getLogger(LogRotator.class);

  private final RetentionProperties retention;
  private final Clock clock;

  public LogRotator(RetentionProperties retention, Clock clock) {
    this.retention = retention;
    this.clock = clock;
  }

  public record RotationResult(int archived, int deleted, int archivesDeleted, int failed) {}

  public RotationResult rotate() throws IOException {
    return rotate(Path.of(retention.logDirectory()));
  }

  public RotationResult rotate(Path logDirectory) throws IOException {
    if (!Files.isDirectory(logDirectory)) {
      logger.debug("log directory missing, nothing to rotate path={}", logDirectory);
      return new RotationResult(0, 0, 0, 0);
    }
    final Path archiveDirectory = Files.createDirectories(logDirectory.resolve(ARCHIVE_DIRECTORY));
    final Instant now = Instant.now(clock);
    final Instant deleteBefore = now.minus(retention.logFiles());
    final Instant archiveDeleteBefore = now.minus(retention.logArchive());
    final long maxBytes = retention.maxLogFileSize().toBytes();

    int archived = 0;
    int deleted = 0;
    int failed = 0;
    for (Path file : list(logDirectory)) {
      if (!Files.isRegularFile(file) || !file.getFileName().toString().endsWith(LOG_SUFFIX)) {
        continue;
      }
      try {
        if (Files.getLastModifiedTime(file).toInstant().isBefore(deleteBefore)) {
          Files.deleteIfExists(file);
          deleted++;
        } else if (Files.size(file) > maxBytes) {
          final String archiveName = file.getFileName() + "." + now.toEpochMilli() + ".gz";
          compress(file, archiveDirectory.resolve(archiveName));
          Files.delete(file);
          archived++;
        }
      } catch (IOException ex) {
        failed++;
        logger.warn("log file rotation failed path={}", file, ex);
      }
    }

    int archivesDeleted = 0;
    for (Path file : list(archiveDirectory)) {
      try {
        if (Files.isRegularFile(file)
            && Files.getLastModifiedTime(file).toInstant().isBefore(archiveDeleteBefore)) {
          Files.deleteIfExists(file);
          archivesDeleted++;
        }
      } catch (IOException ex) {
        failed++;
        logger.warn("log archive cleanup failed path={}", file, ex);
      }
    }
    logger.info(
        "log rotation finished dir={} archived={} deleted={} archivesDeleted={} failed={}",
        logDirectory,
        archived,
        deleted,
        archivesDeleted,
        failed);
    return new RotationResult(archived, deleted, archivesDeleted, failed);
  }

  private static List<Path> list(Path directory) throws IOException {
    try (Stream<Path> stream = Files.list(directory)) {
      return stream.toList();
    }
  }

  private static void compress(Path source, Path target) throws IOException {
    try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(target))) {
      Files.copy(source, out);
    }
  }
}
