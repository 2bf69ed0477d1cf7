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
public class TransactionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Pending or processing transactions created at or after {@code since}, paged by id. */
  public List<PaymentTransaction> findUnsettledSince(
      UUID companyId, Instant since, UUID afterId, int limit) {
    final String sql =
        """
        SELECT id, company_id, invoice_id, gateway_reference, amount, status, created_at
        FROM transactions
        WHERE company_id = :companyId
          AND status IN ('pending', 'processing')
          AND created_at >= :since
          AND (CAST(:afterId AS uuid) IS NULL OR id > :afterId)
        ORDER BY id
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("since", toTimestamp(since))
            .addValue("afterId", afterId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int updateStatus(UUID transactionId, String status, String gatewayResponse, Instant now) {
    final String sql =
        """
        UPDATE transactions
        SET status = :status,
            gateway_response = :gatewayResponse,
            reconciled_at = :now,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", transactionId)
            .addValue("status", status)
            .addValue("gatewayResponse", gatewayResponse)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Transactions the gateway never settled within the lookback window. */
  public int failUnsettledBefore(UUID companyId, Instant cutoff, Instant now) {
    final String sql =
        """
        UPDATE transactions
        SET status = 'failed',
            gateway_response = 'no gateway response within reconciliation window',
            reconciled_at = :now,
            updated_at = :now
        WHERE company_id = :companyId
          AND status IN ('pending', 'processing')
          AND created_at < :cutoff
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int countProcessingBefore(UUID companyId, Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM transactions
        WHERE company_id = :companyId
          AND status = 'processing'
          AND created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private PaymentTransaction mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PaymentTransaction(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getObject("invoice_id", UUID.class),
        rs.getString("gateway_reference"),
        rs.getBigDecimal("amount"),
        rs.getString("status"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
