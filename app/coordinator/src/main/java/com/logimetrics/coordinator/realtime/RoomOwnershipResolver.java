package com.logimetrics.coordinator.realtime;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/** Resolves the owning company of rooms keyed by a domain row. */
@Repository
@RequiredArgsConstructor
public class RoomOwnershipResolver {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UUID> companyOfVehicle(UUID vehicleId) {
    return companyOf(
        "SELECT company_id FROM vehicles WHERE id = :id AND deleted_at IS NULL", vehicleId);
  }

  public Optional<UUID> companyOfShipment(UUID shipmentId) {
    return companyOf(
        "SELECT company_id FROM shipments WHERE id = :id AND deleted_at IS NULL", shipmentId);
  }

  public Optional<UUID> companyOfDriver(UUID driverId) {
    return companyOf(
        "SELECT company_id FROM drivers WHERE id = :id AND deleted_at IS NULL", driverId);
  }

  private Optional<UUID> companyOf(String sql, UUID id) {
    final List<UUID> rows =
        jdbcTemplate.query(
            sql,
            new MapSqlParameterSource("id", id),
            (rs, rowNum) -> rs.getObject("company_id", UUID.class));
    return rows.stream().findFirst();
  }
}
