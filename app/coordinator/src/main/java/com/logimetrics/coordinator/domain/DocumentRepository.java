/*
 * Where: Domain data access
 * What: Vehicle document expiry reads plus orphan and stuck-upload lookups
 * Why: Expiry alerts and storage cleanup both work off the documents table
 */
package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toLocalDate;
import static com.logimetrics.common.JdbcTimestampUtils.toSqlDate;
import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DocumentRepository {

  public record StoredFile(UUID id, String filePath) {}

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<VehicleDocument> findVehicleDocumentsExpiringBy(UUID companyId, LocalDate until) {
    final String sql =
        """
        SELECT d.id, d.company_id, d.entity_id AS vehicle_id, v.registration_number,
               d.document_type, d.is_mandatory, d.expiry_date
        FROM documents d
        JOIN vehicles v ON v.id = d.entity_id
        WHERE d.company_id = :companyId
          AND d.entity_type = 'vehicle'
          AND d.document_type IN (:types)
          AND d.status = 'active'
          AND d.expiry_date <= :until
          AND d.deleted_at IS NULL
          AND v.status <> 'retired'
          AND v.deleted_at IS NULL
        ORDER BY d.expiry_date, d.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("types", VehicleDocument.TRACKED_TYPES)
            .addValue("until", toSqlDate(until));
    return jdbcTemplate.query(sql, params, this::mapDocument);
  }

  public int markExpired(UUID documentId, Instant now) {
    final String sql =
        """
        UPDATE documents
        SET status = 'expired',
            updated_at = :now
        WHERE id = :id
          AND status <> 'expired'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", documentId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Documents whose owning vehicle, driver or shipment row no longer exists. */
  public List<StoredFile> findOrphans(Instant createdBefore, int limit) {
    final String sql =
        """
        SELECT d.id, d.file_path
        FROM documents d
        WHERE d.created_at < :createdBefore
          AND (
            (d.entity_type = 'vehicle'
              AND NOT EXISTS (SELECT 1 FROM vehicles v WHERE v.id = d.entity_id))
            OR (d.entity_type = 'driver'
              AND NOT EXISTS (SELECT 1 FROM drivers r WHERE r.id = d.entity_id))
            OR (d.entity_type = 'shipment'
              AND NOT EXISTS (SELECT 1 FROM shipments s WHERE s.id = d.entity_id))
          )
        ORDER BY d.id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("createdBefore", toTimestamp(createdBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapFile);
  }

  /** Uploads that never completed. */
  public List<StoredFile> findStuckUploads(Instant createdBefore, int limit) {
    final String sql =
        """
        SELECT id, file_path
        FROM documents
        WHERE status = 'uploading'
          AND created_at < :createdBefore
        ORDER BY id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("createdBefore", toTimestamp(createdBefore))
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapFile);
  }

  public int deleteByIds(Collection<UUID> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    return jdbcTemplate.update(
        "DELETE FROM documents WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids));
  }

  private VehicleDocument mapDocument(ResultSet rs, int rowNum) throws SQLException {
    return new VehicleDocument(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getObject("vehicle_id", UUID.class),
        rs.getString("registration_number"),
        rs.getString("document_type"),
        rs.getBoolean("is_mandatory"),
        toLocalDate(rs.getDate("expiry_date")));
  }

  private StoredFile mapFile(ResultSet rs, int rowNum) throws SQLException {
    return new StoredFile(rs.getObject("id", UUID.class), rs.getString("file_path"));
  }
}
