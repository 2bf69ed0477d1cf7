package com.logimetrics.coordinator.archive;

import com.logimetrics.coordinator.config.RetentionProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Removes entries of the configured scratch directories that have not changed recently. */
@Service
public class TempFileSweeper {

  private static final Logger logger = LoggerFactory.getLogger(TempFileSweeper.class);

  private final RetentionProperties retention;
  private final Clock clock;

  public TempFileSweeper(RetentionProperties retention, Clock clock) {
    this.retention = retention;
    this.clock = clock;
  }

  public record SweepResult(int deleted, long freedBytes, int failed) {}

  public SweepResult sweep() {
    return sweep(retention.tempDirectories().stream().map(Path::of).toList());
  }

  public SweepResult sweep(List<Path> directories) {
    final Instant deleteBefore = Instant.now(clock).minus(retention.tempFiles());
    int deleted = 0;
    long freed = 0;
    int failed = 0;
    for (Path directory : directories) {
      if (!Files.isDirectory(directory)) {
        continue;
      }
      final List<Path> entries;
      try (Stream<Path> stream = Files.list(directory)) {
        entries = stream.toList();
      } catch (IOException ex) {
        failed++;
        logger.warn("temp directory unreadable path={}", directory, ex);
        continue;
      }
      for (Path entry : entries) {
        try {
          if (Files.getLastModifiedTime(entry).toInstant().isBefore(deleteBefore)) {
            freed += deleteRecursively(entry);
            deleted++;
          }
        } catch (IOException ex) {
          failed++;
          logger.warn("temp entry not removed path={}", entry, ex);
        }
      }
    }
    logger.info(
        "temp file cleanup finished directories={} deleted={} freedBytes={} failed={}",
        directories.size(),
        deleted,
        freed,
        failed);
    return new SweepResult(deleted, freed, failed);
  }

  private static long deleteRecursively(Path root) throws IOException {
    if (!Files.isDirectory(root)) {
      final long size = Files.size(root);
      Files.deleteIfExists(root);
      return size;
    }
    final List<Path> tree;
    try (Stream<Path> walk = Files.walk(root)) {
      tree = walk.sorted(Comparator.reverseOrder()).toList();
    }
    long size = 0;
    for (Path path : tree) {
      if (Files.isRegularFile(path)) {
        size += Files.size(path);
      }
      Files.deleteIfExists(path);
    }
    return size;
  }
}
