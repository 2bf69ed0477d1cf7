/*
 * Where: Archival
 * What: Copies aged rows to their archive collection in bounded batches, then deletes them
 * Why: A row may only leave the live store once its copy is known to be written
 */
package com.logimetrics.coordinator.archive;

import com.logimetrics.coordinator.job.CancellationToken;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MongoTemplate is a shared Spring-managed component")
public class ArchivalService {

  public static final int MAX_BATCH_SIZE = 10_000;

  private static final Logger logger = LoggerFactory.getLogger(ArchivalService.class);

  private final MongoTemplate mongoTemplate;
  private final Clock clock;

  public ArchivalService(MongoTemplate mongoTemplate, Clock clock) {
    this.mongoTemplate = mongoTemplate;
    this.clock = clock;
  }

  public ArchiveResult archive(
      ArchiveSource source, Duration retention, int batchSize, CancellationToken token) {
    final int limit = Math.min(Math.max(1, batchSize), MAX_BATCH_SIZE);
    final Instant cutoff = Instant.now(clock).minus(retention);
    long copied = 0;
    long deleted = 0;
    int batches = 0;
    boolean abandoned = false;
    while (true) {
      token.throwIfCancelled();
      final List<Document> batch;
      try {
        batch = source.fetchBatch(cutoff, limit);
      } catch (DataAccessException ex) {
        logger.warn("archive read failed source={}", source.name(), ex);
        abandoned = true;
        break;
      }
      if (batch.isEmpty()) {
        break;
      }
      try {
        copy(source.archiveCollection(), batch);
      } catch (DataAccessException ex) {
        logger.warn(
            "archive copy failed, batch left in place source={} size={}",
            source.name(),
            batch.size(),
            ex);
        abandoned = true;
        break;
      }
      copied += batch.size();
      final List<Object> ids = batch.stream().map(document -> document.get("_id")).toList();
      final long removed;
      try {
        removed = source.delete(ids);
      } catch (DataAccessException ex) {
        // copies are upserts by _id, so the next cycle rewrites them harmlessly
        logger.warn("archive delete failed source={} size={}", source.name(), ids.size(), ex);
        abandoned = true;
        break;
      }
      deleted += removed;
      batches++;
      if (batch.size() < limit || removed == 0) {
        break;
      }
    }
    logger.info(
        "archive finished source={} target={} cutoff={} copied={} deleted={} batches={}"
            + " abandoned={}",
        source.name(),
        source.archiveCollection(),
        cutoff,
        copied,
        deleted,
        batches,
        abandoned);
    return new ArchiveResult(source.name(), copied, deleted, batches, abandoned);
  }

  private void copy(String archiveCollection, List<Document> batch) {
    final BulkOperations bulk =
        mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, archiveCollection);
    for (Document document : batch) {
      bulk.replaceOne(
          Query.query(Criteria.where("_id").is(document.get("_id"))),
          document,
          FindAndReplaceOptions.options().upsert());
    }
    bulk.execute();
  }
}
