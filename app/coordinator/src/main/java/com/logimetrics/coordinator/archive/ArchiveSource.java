package com.logimetrics.coordinator.archive;

import java.time.Instant;
import java.util.List;
import org.bson.Document;

/**
 * A live store of time-stamped rows that can be copied to an archive collection and then
 * removed. Every fetched document carries the row key in {@code _id}.
 */
public interface ArchiveSource {

  String name();

  String archiveCollection();

  /** Oldest rows strictly before {@code cutoff}, at most {@code limit}. */
  List<Document> fetchBatch(Instant cutoff, int limit);

  /** Deletes the rows with the given {@code _id} values and returns how many went. */
  long delete(List<Object> ids);
}
