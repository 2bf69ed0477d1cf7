/*
 * Where: Notification data access
 * What: Stores in-app notifications and serves the inbox reads jobs rely on
 * Why: In-app delivery is a row in the relational store that the clients page through
 */
package com.logimetrics.coordinator.notification;

import static com.logimetrics.common.JdbcTimestampUtils.toInstant;
import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public void insert(Notification notification) {
    final String sql =
        """
        INSERT INTO notifications (
          id, user_id, company_id, type, title, message, data, channels, priority,
          is_read, read_at, created_at
        ) VALUES (
          :id, :userId, :companyId, :type, :title, :message, :data::jsonb, :channels, :priority,
          FALSE, NULL, :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", notification.id())
            .addValue("userId", notification.recipientId())
            .addValue("companyId", notification.companyId())
            .addValue("type", notification.type().value())
            .addValue("title", notification.title())
            .addValue("message", notification.message())
            .addValue("data", writeData(notification.data()))
            .addValue(
                "channels",
                notification.channels().stream()
                    .map(NotificationChannel::value)
                    .collect(Collectors.joining(",")))
            .addValue("priority", notification.priority().value())
            .addValue("createdAt", toTimestamp(notification.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public int countUnread(UUID userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE user_id = :userId
          AND is_read = FALSE
          AND deleted_at IS NULL
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("userId", userId), Integer.class);
    return count == null ? 0 : count;
  }

  public List<Notification> findRecentUnread(UUID userId, int limit) {
    final String sql =
        """
        SELECT id, user_id, company_id, type, title, message, data::text AS data_text, channels,
               priority, created_at, read_at
        FROM notifications
        WHERE user_id = :userId
          AND is_read = FALSE
          AND deleted_at IS NULL
        ORDER BY created_at DESC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markRead(UUID notificationId, UUID userId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE,
            read_at = :readAt
        WHERE id = :id
          AND user_id = :userId
          AND is_read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", notificationId)
            .addValue("userId", userId)
            .addValue("readAt", toTimestamp(readAt));
    return jdbcTemplate.update(sql, params);
  }

  /** Only read notifications are removed; unread ones stay until the user reads them. */
  public int deleteReadBefore(Instant cutoff) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE is_read = TRUE
          AND created_at < :cutoff
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("cutoff", toTimestamp(cutoff)));
  }

  private String writeData(Map<String, Object> data) {
    try {
      return objectMapper.writeValueAsString(data);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification data is not serializable", ex);
    }
  }

  private Map<String, Object> readData(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, DATA_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification data column is not valid json", ex);
    }
  }

  private Notification mapRow(ResultSet rs, int rowNum) throws SQLException {
    final Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
    final String rawChannels = rs.getString("channels");
    if (rawChannels != null && !rawChannels.isBlank()) {
      Arrays.stream(rawChannels.split(","))
          .map(String::trim)
          .map(NotificationChannel::fromValue)
          .forEach(channels::add);
    }
    return new Notification(
        rs.getObject("id", UUID.class),
        rs.getObject("user_id", UUID.class),
        rs.getObject("company_id", UUID.class),
        NotificationType.fromValue(rs.getString("type")),
        rs.getString("title"),
        rs.getString("message"),
        readData(rs.getString("data_text")),
        channels,
        NotificationPriority.fromValue(rs.getString("priority")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("read_at")));
  }
}
