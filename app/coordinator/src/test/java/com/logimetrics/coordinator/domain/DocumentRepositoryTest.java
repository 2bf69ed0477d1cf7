package com.logimetrics.coordinator.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.logimetrics.coordinator.AbstractPostgresContainerTest;
import com.logimetrics.coordinator.archive.OrphanSweeper;
import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.job.CancellationToken;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(DocumentRepository.class)
class DocumentRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-10-18T04:30:00Z");

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;
  @Autowired private DocumentRepository documentRepository;

  private UUID companyId;
  private UUID vehicleId;

  @BeforeEach
  void seed() {
    companyId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO companies (id, name) VALUES (:id, :name)",
        new MapSqlParameterSource().addValue("id", companyId).addValue("name", "Acme Freight"));
    vehicleId = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO vehicles (id, company_id, registration_number)
        VALUES (:id, :companyId, 'KA01AB1234')
        """,
        new MapSqlParameterSource().addValue("id", vehicleId).addValue("companyId", companyId));
  }

  @Test
  void orphansAreDocumentsWhoseOwnerIsGoneAndOlderThanTheCutoff() {
    final UUID owned = insertDocument("vehicle", vehicleId, "active", NOW.minus(days(120)));
    final UUID lostVehicle =
        insertDocument("vehicle", UUID.randomUUID(), "active", NOW.minus(days(120)));
    final UUID lostShipment =
        insertDocument("shipment", UUID.randomUUID(), "active", NOW.minus(days(200)));
    final UUID lostRecently =
        insertDocument("driver", UUID.randomUUID(), "active", NOW.minus(days(10)));

    final List<UUID> orphans =
        documentRepository.findOrphans(NOW.minus(days(90)), 10).stream()
            .map(DocumentRepository.StoredFile::id)
            .toList();

    assertThat(orphans).containsExactlyInAnyOrder(lostVehicle, lostShipment);
    assertThat(orphans).doesNotContain(owned, lostRecently);
  }

  @Test
  void stuckUploadsAreOnlyUnfinishedUploadsPastTheWindow() {
    final UUID stuck = insertDocument("vehicle", vehicleId, "uploading", NOW.minus(days(2)));
    insertDocument("vehicle", vehicleId, "uploading", NOW.minusSeconds(2 * 3600));
    insertDocument("vehicle", vehicleId, "active", NOW.minus(days(2)));

    final List<DocumentRepository.StoredFile> found =
        documentRepository.findStuckUploads(NOW.minus(days(1)), 10);

    assertThat(found).extracting(DocumentRepository.StoredFile::id).containsExactly(stuck);
    assertThat(found.get(0).filePath()).isEqualTo("uploads/" + stuck + ".pdf");
  }

  @Test
  void sweepDeletesOrphansAndStuckUploadsAndKeepsEverythingElse() {
    final UUID owned = insertDocument("vehicle", vehicleId, "active", NOW.minus(days(120)));
    insertDocument("vehicle", UUID.randomUUID(), "active", NOW.minus(days(120)));
    final UUID lostRecently =
        insertDocument("driver", UUID.randomUUID(), "active", NOW.minus(days(10)));
    insertDocument("vehicle", vehicleId, "uploading", NOW.minus(days(2)));
    final UUID uploading =
        insertDocument("vehicle", vehicleId, "uploading", NOW.minusSeconds(2 * 3600));
    final OrphanSweeper sweeper =
        new OrphanSweeper(documentRepository, retention(), Clock.fixed(NOW, ZoneOffset.UTC));

    final OrphanSweeper.SweepResult result = sweeper.sweep(CancellationToken.create());

    assertThat(result).isEqualTo(new OrphanSweeper.SweepResult(1, 1));
    assertThat(remainingIds()).containsExactlyInAnyOrder(owned, lostRecently, uploading);
  }

  private static RetentionProperties retention() {
    return new RetentionProperties(
        null, null, null, days(90), null, null, null, null, null, null, days(1), 0, null, null,
        null);
  }

  private static Duration days(long count) {
    return Duration.ofDays(count);
  }

  private UUID insertDocument(String entityType, UUID entityId, String status, Instant createdAt) {
    final UUID id = UUID.randomUUID();
    jdbcTemplate.update(
        """
        INSERT INTO documents (
          id, company_id, entity_type, entity_id, document_type, file_path, status, created_at
        ) VALUES (
          :id, :companyId, :entityType, :entityId, 'registration', :filePath, :status, :createdAt
        )
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("companyId", companyId)
            .addValue("entityType", entityType)
            .addValue("entityId", entityId)
            .addValue("filePath", "uploads/" + id + ".pdf")
            .addValue("status", status)
            .addValue("createdAt", Timestamp.from(createdAt)));
    return id;
  }

  private List<UUID> remainingIds() {
    return jdbcTemplate.queryForList(
        "SELECT id FROM documents WHERE company_id = :companyId",
        new MapSqlParameterSource("companyId", companyId),
        UUID.class);
  }
}
