/*
 * Where: Domain data access
 * What: Invoice reads and state changes driven by the billing jobs
 * Why: Recurring copies, reminders and overdue flips are set-based updates on the invoices table
 */
package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toInstant;
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
public class InvoiceRepository {

  private static final String COLUMNS =
      """
      id, company_id, customer_id, invoice_number, status, total_amount, currency,
      issue_date, due_date, recurring_frequency, next_recurring_date, last_reminder_sent_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Recurring templates whose next date has come, paged by id. */
  public List<Invoice> findRecurringDue(UUID companyId, LocalDate today, UUID afterId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM invoices
            WHERE company_id = :companyId
              AND is_recurring = TRUE
              AND status IN ('paid', 'sent')
              AND next_recurring_date <= :today
              AND deleted_at IS NULL
              AND (CAST(:afterId AS uuid) IS NULL OR id > :afterId)
            ORDER BY id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("today", toSqlDate(today))
            .addValue("afterId", afterId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** Inserts a sent, non-recurring copy of the template and returns its id. */
  public UUID insertRecurringCopy(
      Invoice template, String invoiceNumber, LocalDate issueDate, LocalDate dueDate, Instant now) {
    final UUID id = UUID.randomUUID();
    final String sql =
        """
        INSERT INTO invoices (
          id, company_id, customer_id, invoice_number, status, total_amount, currency,
          issue_date, due_date, is_recurring, parent_invoice_id, sent_at, created_at, updated_at
        ) VALUES (
          :id, :companyId, :customerId, :invoiceNumber, 'sent', :totalAmount, :currency,
          :issueDate, :dueDate, FALSE, :parentId, :now, :now, :now
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("companyId", template.companyId())
            .addValue("customerId", template.customerId())
            .addValue("invoiceNumber", invoiceNumber)
            .addValue("totalAmount", template.totalAmount())
            .addValue("currency", template.currency())
            .addValue("issueDate", toSqlDate(issueDate))
            .addValue("dueDate", toSqlDate(dueDate))
            .addValue("parentId", template.id())
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    return id;
  }

  public int updateNextRecurringDate(UUID invoiceId, LocalDate nextDate, Instant now) {
    final String sql =
        """
        UPDATE invoices
        SET next_recurring_date = :nextDate,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", invoiceId)
            .addValue("nextDate", toSqlDate(nextDate))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** Overdue invoices with no reminder since {@code remindedBefore}. */
  public List<Invoice> findReminderCandidates(
      UUID companyId, Instant remindedBefore, UUID afterId, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM invoices
            WHERE company_id = :companyId
              AND status = 'overdue'
              AND customer_id IS NOT NULL
              AND deleted_at IS NULL
              AND (last_reminder_sent_at IS NULL OR last_reminder_sent_at < :remindedBefore)
              AND (CAST(:afterId AS uuid) IS NULL OR id > :afterId)
            ORDER BY id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("remindedBefore", toTimestamp(remindedBefore))
            .addValue("afterId", afterId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markReminderSent(UUID invoiceId, Instant sentAt) {
    final String sql =
        """
        UPDATE invoices
        SET last_reminder_sent_at = :sentAt,
            updated_at = :sentAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", invoiceId)
            .addValue("sentAt", toTimestamp(sentAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Flips sent, viewed and partial invoices past their due date and returns the flipped rows. */
  public List<Invoice> markOverdue(UUID companyId, LocalDate today, Instant now) {
    final String sql =
        """
        UPDATE invoices
        SET status = 'overdue',
            updated_at = :now
        WHERE company_id = :companyId
          AND status IN ('sent', 'viewed', 'partial')
          AND due_date < :today
          AND deleted_at IS NULL
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("companyId", companyId)
            .addValue("today", toSqlDate(today))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markPaid(UUID invoiceId, Instant paidAt) {
    final String sql =
        """
        UPDATE invoices
        SET status = 'paid',
            paid_at = :paidAt,
            updated_at = :paidAt
        WHERE id = :id
          AND status <> 'paid'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", invoiceId)
            .addValue("paidAt", toTimestamp(paidAt));
    return jdbcTemplate.update(sql, params);
  }

  private Invoice mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new Invoice(
        rs.getObject("id", UUID.class),
        rs.getObject("company_id", UUID.class),
        rs.getObject("customer_id", UUID.class),
        rs.getString("invoice_number"),
        rs.getString("status"),
        rs.getBigDecimal("total_amount"),
        rs.getString("currency"),
        toLocalDate(rs.getDate("issue_date")),
        toLocalDate(rs.getDate("due_date")),
        rs.getString("recurring_frequency"),
        toLocalDate(rs.getDate("next_recurring_date")),
        toInstant(rs.getTimestamp("last_reminder_sent_at")));
  }
}
