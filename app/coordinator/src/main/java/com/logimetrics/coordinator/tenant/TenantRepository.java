/*
 * Where: Tenant iteration
 * What: Reads the companies that periodic jobs iterate over
 * Why: Tenants are listed once per job invocation in a stable order
 */
package com.logimetrics.coordinator.tenant;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TenantRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Tenant> findActive() {
    final String sql =
        """
        SELECT id, name, status
        FROM companies
        WHERE status = 'active'
          AND deleted_at IS NULL
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<Tenant> findById(UUID tenantId) {
    final String sql =
        """
        SELECT id, name, status
        FROM companies
        WHERE id = :id
        """;
    final List<Tenant> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("id", tenantId), this::mapRow);
    return rows.stream().findFirst();
  }

  private Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Tenant(rs.getObject("id", UUID.class), rs.getString("name"), rs.getString("status"));
  }
}
