package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toLocalDate;
import static com.logimetrics.common.JdbcTimestampUtils.toSqlDate;
import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class VehicleRepository {

  public static final String STATUS_INACTIVE = "inactive";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Vehicle> findServiceDueBy(UUID companyId, LocalDate until) {
    final String sql =
        """
        SELECT id, company_id, registration_number, make, model, status, next_service_date
        FROM vehicles
        WHERE company_id = :companyId
          AND status <> 'retired'
          AND next_service_date <= :until
          AND deleted_at IS NULL
        ORDER BY next_service_date, id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("until", toSqlDate(until));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Moves the vehicle to {@code status}; returns the previous status when it changed. */
  public Optional<String> changeStatus(UUID vehicleId, String status, Instant now) {
    final String sql =
        """
        UPDATE vehicles v
        SET status = :status,
            updated_at = :now
        FROM vehicles old
        WHERE v.id = :id
          AND old.id = v.id
          AND v.status <> :status
          AND v.status <> 'retired'
        RETURNING old.status AS previous_status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", vehicleId)
            .addValue("status", status)
            .addValue("now", toTimestamp(now));
    final List<String> previous =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("previous_status"));
    return previous.stream().findFirst();
  }

  private Vehicle mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Vehicle(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getString("registration_number"),
        rs.getString("make"),
        rs.getString("model"),
        rs.getString("status"),
        toLocalDate(rs.getDate("next_service_date")));
  }
}
