package com.logimetrics.coordinator.archive;

import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.domain.DocumentRepository;
import com.logimetrics.coordinator.domain.DocumentRepository.StoredFile;
import com.logimetrics.coordinator.job.CancellationToken;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Hard-deletes document rows that lost their owner or never finished uploading. */
@Service
@RequiredArgsConstructor
public class OrphanSweeper {

  static final int SWEEP_BATCH_SIZE = 500;

  private static final Logger logger = LoggerFactory.getLogger(OrphanSweeper.class);

  private final DocumentRepository documentRepository;
  private final RetentionProperties retention;
  private final Clock clock;

  public record SweepResult(long orphans, long stuckUploads) {}

  public SweepResult sweep(CancellationToken token) {
    final Instant now = Instant.now(clock);
    final long orphans =
        drain(documentRepository::findOrphans, now.minus(retention.softDeleted()), token);
    final long stuck =
        drain(documentRepository::findStuckUploads, now.minus(retention.orphanUploads()), token);
    logger.info("orphan sweep finished orphans={} stuckUploads={}", orphans, stuck);
    return new SweepResult(orphans, stuck);
  }

  private long drain(
      BiFunction<Instant, Integer, List<StoredFile>> finder,
      Instant createdBefore,
      CancellationToken token) {
    long total = 0;
    while (true) {
      token.throwIfCancelled();
      final List<StoredFile> page = finder.apply(createdBefore, SWEEP_BATCH_SIZE);
      if (page.isEmpty()) {
        return total;
      }
      final List<UUID> ids = page.stream().map(StoredFile::id).toList();
      final int removed = documentRepository.deleteByIds(ids);
      total += removed;
      if (page.size() < SWEEP_BATCH_SIZE || removed == 0) {
        return total;
      }
    }
  }
}
