package com.logimetrics.coordinator.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@DataMongoTest
@Import(ReportRepository.class)
@Testcontainers(disabledWithoutDocker = true)
class ReportRepositoryTest {

  @Container static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.data.mongodb.uri", () -> MONGO.getReplicaSetUrl("logimetrics"));
  }

  private static final UUID TENANT = UUID.randomUUID();

  @Autowired private ReportRepository reportRepository;
  @Autowired private MongoTemplate mongoTemplate;

  @BeforeEach
  void cleanup() {
    mongoTemplate.dropCollection(ReportRepository.DAILY_REPORTS);
  }

  @Test
  void saveReplacesReportWithSameId() {
    reportRepository.save(ReportRepository.DAILY_REPORTS, daily("2026-10-16", 5));
    reportRepository.save(ReportRepository.DAILY_REPORTS, daily("2026-10-16", 8));

    assertThat(mongoTemplate.getCollection(ReportRepository.DAILY_REPORTS).countDocuments())
        .isEqualTo(1);
    assertThat(
            reportRepository
                .findById(ReportRepository.DAILY_REPORTS, TENANT + ":2026-10-16")
                .map(report -> report.get("shipments", Document.class).get("total")))
        .contains(8L);
  }

  @Test
  void findDailyReturnsHalfOpenRangeOldestFirst() {
    reportRepository.save(ReportRepository.DAILY_REPORTS, daily("2026-10-15", 1));
    reportRepository.save(ReportRepository.DAILY_REPORTS, daily("2026-10-17", 3));
    reportRepository.save(ReportRepository.DAILY_REPORTS, daily("2026-10-16", 2));

    final List<Document> reports =
        reportRepository.findDaily(
            TENANT,
            Date.from(Instant.parse("2026-10-15T00:00:00Z")),
            Date.from(Instant.parse("2026-10-17T00:00:00Z")));

    assertThat(reports)
        .extracting(report -> report.getString("_id"))
        .containsExactly(TENANT + ":2026-10-15", TENANT + ":2026-10-16");
  }

  @Test
  void saveRequiresId() {
    assertThatThrownBy(() -> reportRepository.save(ReportRepository.DAILY_REPORTS, new Document()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("report _id is required");
  }

  private static Document daily(String day, long total) {
    return new Document("_id", TENANT + ":" + day)
        .append("companyId", TENANT.toString())
        .append("date", Date.from(Instant.parse(day + "T00:00:00Z")))
        .append("shipments", new Document("total", total));
  }
}
