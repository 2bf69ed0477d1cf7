/*
 * Where: Archival
 * What: Relational table rows, serialised as JSON documents, aged by a timestamp column
 * Why: Soft-deleted domain rows are kept in the document store after they leave Postgres
 */
package com.logimetrics.coordinator.archive;

import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import org.bson.Document;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class JdbcArchiveSource implements ArchiveSource {

  private static final Pattern IDENTIFIER = Pattern.compile("[a-z_]+");

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final String table;
  private final String timestampColumn;
  private final String archiveCollection;

  public JdbcArchiveSource(
      NamedParameterJdbcTemplate jdbcTemplate,
      String table,
      String timestampColumn,
      String archiveCollection) {
    for (String identifier : Set.of(table, timestampColumn)) {
      if (!IDENTIFIER.matcher(identifier).matches()) {
        throw new IllegalArgumentException("invalid identifier: " + identifier);
      }
    }
    this.jdbcTemplate = jdbcTemplate;
    this.table = table;
    this.timestampColumn = timestampColumn;
    this.archiveCollection = archiveCollection;
  }

  /** Rows soft-deleted before the cutoff, archived to {@code deleted_<table>_archive}. */
  public static JdbcArchiveSource softDeleted(
      NamedParameterJdbcTemplate jdbcTemplate, String table) {
    return new JdbcArchiveSource(
        jdbcTemplate, table, "deleted_at", "deleted_" + table + "_archive");
  }

  @Override
  public String name() {
    return table;
  }

  @Override
  public String archiveCollection() {
    return archiveCollection;
  }

  @Override
  public List<Document> fetchBatch(Instant cutoff, int limit) {
    final String sql =
        "SELECT t.id, to_jsonb(t)::text AS payload FROM "
            + table
            + " t WHERE t."
            + timestampColumn
            + " < :cutoff ORDER BY t."
            + timestampColumn
            + ", t.id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("cutoff", toTimestamp(cutoff))
            .addValue("limit", limit);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            Document.parse(rs.getString("payload"))
                .append("_id", rs.getObject("id", UUID.class).toString())
                .append("sourceTable", table));
  }

  @Override
  public long delete(List<Object> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    final List<UUID> keys = ids.stream().map(id -> UUID.fromString(id.toString())).toList();
    return jdbcTemplate.update(
        "DELETE FROM " + table + " WHERE id IN (:ids)", new MapSqlParameterSource("ids", keys));
  }
}
