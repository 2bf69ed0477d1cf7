/*
 * Where: Notification data access
 * What: Looks up users as notification recipients
 * Why: Channels resolve contact details at delivery time and jobs address users by role
 */
package com.logimetrics.coordinator.notification;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientDirectory {

  public static final String ROLE_ADMIN = "admin";
  public static final String ROLE_FLEET_MANAGER = "fleet_manager";
  public static final String ROLE_FINANCE = "finance";
  public static final String ROLE_DRIVER = "driver";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Recipient> find(UUID userId) {
    final String sql =
        """
        SELECT id, company_id, first_name, last_name, email, phone, role
        FROM users
        WHERE id = :id
          AND deleted_at IS NULL
        """;
    final List<Recipient> rows =
        jdbcTemplate.query(sql, new MapSqlParameterSource("id", userId), this::mapRow);
    return rows.stream().findFirst();
  }

  public List<Recipient> findByCompanyAndRoles(UUID companyId, Collection<String> roles) {
    final String sql =
        """
        SELECT id, company_id, first_name, last_name, email, phone, role
        FROM users
        WHERE company_id = :companyId
          AND role IN (:roles)
          AND status = 'active'
          AND deleted_at IS NULL
        ORDER BY id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("companyId", companyId).addValue("roles", roles);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Active users who opted into the daily digest and have an email on file. */
  public List<Recipient> findDigestSubscribers() {
    final String sql =
        """
        SELECT id, company_id, first_name, last_name, email, phone, role
        FROM users
        WHERE digest_enabled = TRUE
          AND status = 'active'
          AND deleted_at IS NULL
          AND email IS NOT NULL
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private Recipient mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String firstName = rs.getString("first_name");
    final String lastName = rs.getString("last_name");
    final String name = lastName == null ? firstName : firstName + " " + lastName;
    return new Recipient(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        name,
        rs.getString("email"),
        rs.getString("phone"),
        rs.getString("role"));
  }
}
