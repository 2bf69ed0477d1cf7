package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toLocalDate;
import static com.logimetrics.common.JdbcTimestampUtils.toSqlDate;
import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DriverRepository {

  public static final String STATUS_INACTIVE = "inactive";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Driver> findLicensesExpiringBy(UUID companyId, LocalDate until) {
    final String sql =
        """
        SELECT d.id, d.company_id, d.user_id, d.license_number, d.license_expiry, d.status,
               TRIM(CONCAT(u.first_name, ' ', u.last_name)) AS name
        FROM drivers d
        LEFT JOIN users u ON u.id = d.user_id
        WHERE d.company_id = :companyId
          AND d.status <> 'inactive'
          AND d.license_expiry <= :until
          AND d.deleted_at IS NULL
        ORDER BY d.license_expiry, d.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("until", toSqlDate(until));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Returns 1 when the driver was active and is now inactive. */
  public int deactivate(UUID driverId, Instant now) {
    final String sql =
        """
        UPDATE drivers
        SET status = 'inactive',
            updated_at = :now
        WHERE id = :id
          AND status <> 'inactive'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", driverId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private Driver mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Driver(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getString("name"),
        rs.getString("license_number"),
        toLocalDate(rs.getDate("license_expiry")),
        rs.getString("status"));
  }
}
