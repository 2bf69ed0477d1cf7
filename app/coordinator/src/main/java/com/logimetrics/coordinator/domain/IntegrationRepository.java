package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toInstant;
import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class IntegrationRepository {

  private static final int LAST_ERROR_MAX_LENGTH = 500;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Integration> findEnabled(UUID companyId) {
    final String sql =
        """
        SELECT id, company_id, type, name, base_url, api_key, last_synced_at
        FROM integrations
        WHERE company_id = :companyId
          AND enabled = TRUE
          AND type IN ('erp', 'tms', 'wms')
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource("companyId", companyId), this::mapRow);
  }

  public int markSynced(UUID integrationId, Instant syncedAt) {
    final String sql =
        """
        UPDATE integrations
        SET last_synced_at = :syncedAt,
            last_error = NULL
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", integrationId)
            .addValue("syncedAt", toTimestamp(syncedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID integrationId, String error) {
    final String message =
        error == null || error.length() <= LAST_ERROR_MAX_LENGTH
            ? error
            : error.substring(0, LAST_ERROR_MAX_LENGTH);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", integrationId).addValue("error", message);
    return jdbcTemplate.update(
        "UPDATE integrations SET last_error = :error WHERE id = :id", params);
  }

  private Integration mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Integration(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getString("type"),
        rs.getString("name"),
        rs.getString("base_url"),
        rs.getString("api_key"),
        toInstant(rs.getTimestamp("last_synced_at")));
  }
}
