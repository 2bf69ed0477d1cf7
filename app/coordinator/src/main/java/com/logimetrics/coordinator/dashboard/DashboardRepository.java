/*
 * Where: Dashboard projection
 * What: Per-status counts and today's totals read from the relational store
 * Why: The dashboard is a pure aggregate; an empty tenant yields empty maps and zero totals
 */
package com.logimetrics.coordinator.dashboard;

import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DashboardRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Map<String, Long> shipmentsByStatus(UUID companyId) {
    return countByStatus("shipments", companyId);
  }

  public Map<String, Long> vehiclesByStatus(UUID companyId) {
    return countByStatus("vehicles", companyId);
  }

  public Map<String, Long> driversByStatus(UUID companyId) {
    return countByStatus("drivers", companyId);
  }

  public DashboardSnapshot.TodayCounts todayCounts(UUID companyId, Instant from, Instant to) {
    final String sql =
        """
        SELECT
          (SELECT COUNT(*) FROM shipments
             WHERE company_id = :companyId AND deleted_at IS NULL
               AND created_at >= :from AND created_at < :to) AS created,
          (SELECT COUNT(*) FROM shipments
             WHERE company_id = :companyId AND deleted_at IS NULL AND status = 'delivered'
               AND delivered_at >= :from AND delivered_at < :to) AS delivered,
          (SELECT COALESCE(SUM(total_amount), 0) FROM invoices
             WHERE company_id = :companyId AND status = 'paid'
               AND paid_at >= :from AND paid_at < :to) AS revenue
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("from", toTimestamp(from))
            .addValue("to", toTimestamp(to));
    return jdbcTemplate.queryForObject(
        sql,
        params,
        (rs, rowNum) -> {
          final BigDecimal revenue = rs.getBigDecimal("revenue");
          return new DashboardSnapshot.TodayCounts(
              rs.getLong("created"), rs.getLong("delivered"), revenue);
        });
  }

  // table names come from the fixed set above, never from input
  private Map<String, Long> countByStatus(String table, UUID companyId) {
    final String sql =
        "SELECT status, COUNT(*) AS total FROM "
            + table
            + " WHERE company_id = :companyId AND deleted_at IS NULL"
            + " GROUP BY status ORDER BY status";
    final Map<String, Long> counts = new LinkedHashMap<>();
    final RowCallbackHandler collector =
        rs -> counts.put(rs.getString("status"), rs.getLong("total"));
    jdbcTemplate.query(sql, new MapSqlParameterSource("companyId", companyId), collector);
    return counts;
  }
}
