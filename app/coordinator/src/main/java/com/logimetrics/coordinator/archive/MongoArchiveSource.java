package com.logimetrics.coordinator.archive;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

/** Collection in the document store, aged by a date field. */
public class MongoArchiveSource implements ArchiveSource {

  private final MongoTemplate mongoTemplate;
  private final String collection;
  private final String timestampField;
  private final String archiveCollection;

  public MongoArchiveSource(
      MongoTemplate mongoTemplate,
      String collection,
      String timestampField,
      String archiveCollection) {
    this.mongoTemplate = mongoTemplate;
    this.collection = collection;
    this.timestampField = timestampField;
    this.archiveCollection = archiveCollection;
  }

  @Override
  public String name() {
    return collection;
  }

  @Override
  public String archiveCollection() {
    return archiveCollection;
  }

  @Override
  public List<Document> fetchBatch(Instant cutoff, int limit) {
    final Query query =
        Query.query(Criteria.where(timestampField).lt(Date.from(cutoff)))
            .with(Sort.by(Sort.Direction.ASC, timestampField))
            .limit(limit);
    return mongoTemplate.find(query, Document.class, collection);
  }

  @Override
  public long delete(List<Object> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    return mongoTemplate
        .remove(Query.query(Criteria.where("_id").in(ids)), collection)
        .getDeletedCount();
  }
}
