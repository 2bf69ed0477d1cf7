/*
 * Where: Domain data access
 * What: Appends system actions to the audit_logs collection
 * Why: Dropped notifications and automatic status changes must leave a trace operators can query
 */
package com.logimetrics.coordinator.domain;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MongoTemplate is a shared Spring-managed component")
public class AuditTrail {

  public static final String AUDIT_LOGS = "audit_logs";
  public static final String ACTOR_SYSTEM = "system";

  private static final Logger logger = LoggerFactory.getLogger(AuditTrail.class);

  private final MongoTemplate mongoTemplate;
  private final Clock clock;

  public AuditTrail(MongoTemplate mongoTemplate, Clock clock) {
    this.mongoTemplate = mongoTemplate;
    this.clock = clock;
  }

  /**
   * Best effort: a failed write is logged and reported as false, never thrown, so callers in
   * error paths do not lose their own outcome.
   */
  public boolean record(
      String action,
      String entityType,
      Object entityId,
      UUID companyId,
      Map<String, Object> details) {
    final Document entry =
        new Document("action", action)
            .append("actor", ACTOR_SYSTEM)
            .append("entityType", entityType)
            .append("entityId", entityId == null ? null : entityId.toString())
            .append("companyId", companyId == null ? null : companyId.toString())
            .append("details", new Document(details == null ? Map.of() : details))
            .append("timestamp", Date.from(Instant.now(clock)));
    try {
      mongoTemplate.insert(entry, AUDIT_LOGS);
      return true;
    } catch (DataAccessException ex) {
      logger.warn(
          "audit entry not stored action={} entityType={} entityId={}",
          action,
          entityType,
          entityId,
          ex);
      return false;
    }
  }
}
