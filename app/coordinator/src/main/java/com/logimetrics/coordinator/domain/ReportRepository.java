/*
 * Where: Domain data access
 * What: Report documents in MongoDB keyed by tenant and period
 * Why: Reports are recomputed on every run, so writes are upserts and reruns stay idempotent
 */
package com.logimetrics.coordinator.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MongoTemplate is a shared Spring-managed component")
public class ReportRepository {

  public static final String DAILY_REPORTS = "daily_reports";
  public static final String WEEKLY_REPORTS = "weekly_reports";
  public static final String MONTHLY_REPORTS = "monthly_reports";
  public static final String TRACKING_DAILY_METRICS = "tracking_daily_metrics";

  private final MongoTemplate mongoTemplate;

  public ReportRepository(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  /** Replaces the report with the same {@code _id}, or inserts it. */
  public void save(String collection, Document report) {
    final Object id = report.get("_id");
    if (id == null) {
      throw new IllegalArgumentException("report _id is required");
    }
    mongoTemplate.findAndReplace(
        Query.query(Criteria.where("_id").is(id)),
        report,
        FindAndReplaceOptions.options().upsert(),
        collection);
  }

  /** Daily reports of one tenant with {@code from <= date < to}, oldest first. */
  public List<Document> findDaily(UUID companyId, Date from, Date to) {
    final Query query =
        Query.query(
                Criteria.where("companyId")
                    .is(companyId.toString())
                    .and("date")
                    .gte(from)
                    .lt(to))
            .with(Sort.by(Sort.Direction.ASC, "date"));
    return mongoTemplate.find(query, Document.class, DAILY_REPORTS);
  }

  public Optional<Document> findById(String collection, String id) {
    return Optional.ofNullable(mongoTemplate.findById(id, Document.class, collection));
  }
}
