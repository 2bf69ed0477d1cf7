/*
 * Where: Domain data access
 * What: Shipment reads for ETA prediction and per-day report figures
 * Why: Analytics and ML sync need aggregates, not whole shipment rows
 */
package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ShipmentRepository {

  public record EtaCandidate(
      UUID id,
      Double originLat,
      Double originLng,
      Double destinationLat,
      Double destinationLng,
      String vehicleType,
      Double distanceKm,
      Double weightKg) {}

  public record ShipmentStats(long total, long completed, long cancelled) {}

  public record RevenueStats(BigDecimal total, long invoiceCount) {}

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Most recent active shipments first. */
  public List<EtaCandidate> findActiveForEta(int limit) {
    final String sql =
        """
        SELECT s.id, s.origin_lat, s.origin_lng, s.destination_lat, s.destination_lng,
               v.vehicle_type, s.distance_km, s.weight_kg
        FROM shipments s
        LEFT JOIN vehicles v ON v.id = s.vehicle_id
        WHERE s.status IN ('pending', 'picked_up', 'in_transit')
          AND s.deleted_at IS NULL
        ORDER BY s.created_at DESC
        LIMIT :limit
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource("limit", limit),
        (rs, rowNum) ->
            new EtaCandidate(
                rs.getObject("id", UUID.class),
                (Double) rs.getObject("origin_lat"),
                (Double) rs.getObject("origin_lng"),
                (Double) rs.getObject("destination_lat"),
                (Double) rs.getObject("destination_lng"),
                rs.getString("vehicle_type"),
                (Double) rs.getObject("distance_km"),
                (Double) rs.getObject("weight_kg")));
  }

  public int updateEstimatedDelivery(
      UUID shipmentId, Instant eta, String predictionJson, Instant now) {
    final String sql =
        """
        UPDATE shipments
        SET estimated_delivery = :eta,
            ml_prediction = CAST(:prediction AS jsonb),
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", shipmentId)
            .addValue("eta", toTimestamp(eta))
            .addValue("prediction", predictionJson)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public ShipmentStats statsCreatedBetween(UUID companyId, Instant from, Instant to) {
    final String sql =
        """
        SELECT COUNT(*) AS total,
               COUNT(*) FILTER (WHERE status = 'delivered') AS completed,
               COUNT(*) FILTER (WHERE status = 'cancelled') AS cancelled
        FROM shipments
        WHERE company_id = :companyId
          AND created_at >= :from
          AND created_at < :to
          AND deleted_at IS NULL
        """;
    return jdbcTemplate.queryForObject(
        sql,
        window(companyId, from, to),
        (rs, rowNum) ->
            new ShipmentStats(
                rs.getLong("total"), rs.getLong("completed"), rs.getLong("cancelled")));
  }

  public RevenueStats revenuePaidBetween(UUID companyId, Instant from, Instant to) {
    final String sql =
        """
        SELECT COALESCE(SUM(total_amount), 0) AS total, COUNT(*) AS invoice_count
        FROM invoices
        WHERE company_id = :companyId
          AND status = 'paid'
          AND paid_at >= :from
          AND paid_at < :to
        """;
    return jdbcTemplate.queryForObject(
        sql,
        window(companyId, from, to),
        (rs, rowNum) -> new RevenueStats(rs.getBigDecimal("total"), rs.getLong("invoice_count")));
  }

  private static MapSqlParameterSource window(UUID companyId, Instant from, Instant to) {
    return new MapSqlParameterSource()
        .addValue("companyId", companyId)
        .addValue("from", toTimestamp(from))
        .addValue("to", toTimestamp(to));
  }
}
