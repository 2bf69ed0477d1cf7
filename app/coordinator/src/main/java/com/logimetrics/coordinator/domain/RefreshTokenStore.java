/*
 * Where: Domain data access
 * What: Removes refresh tokens and blacklist entries that can no longer be used
 * Why: Tokens are written by the auth service in Postgres and Redis; neither expires them reliably
 */
package com.logimetrics.coordinator.domain;

import static com.logimetrics.common.JdbcTimestampUtils.toTimestamp;

import com.logimetrics.coordinator.job.CancellationToken;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Store templates are shared Spring-managed components")
public class RefreshTokenStore {

  static final List<String> REDIS_PATTERNS = List.of("refresh_token:*", "blacklist:*");
  private static final long SCAN_COUNT = 500;
  private static final long NO_EXPIRY = -1L;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final StringRedisTemplate redisTemplate;

  public RefreshTokenStore(
      NamedParameterJdbcTemplate jdbcTemplate, StringRedisTemplate redisTemplate) {
    this.jdbcTemplate = jdbcTemplate;
    this.redisTemplate = redisTemplate;
  }

  /** Clears refresh tokens issued before {@code issuedBefore}. Returns affected users. */
  public int clearIssuedBefore(Instant issuedBefore) {
    final String sql =
        """
        UPDATE users
        SET refresh_token = NULL,
            refresh_token_issued_at = NULL
        WHERE refresh_token IS NOT NULL
          AND refresh_token_issued_at < :issuedBefore
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("issuedBefore", toTimestamp(issuedBefore)));
  }

  /** Deletes token keys that were written without a TTL. */
  public int deleteKeysWithoutTtl(CancellationToken token) {
    int deleted = 0;
    for (String pattern : REDIS_PATTERNS) {
      final List<String> stale = new ArrayList<>();
      final ScanOptions options =
          ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
      try (Cursor<String> cursor = redisTemplate.scan(options)) {
        while (cursor.hasNext()) {
          token.throwIfCancelled();
          final String key = cursor.next();
          final Long ttl = redisTemplate.getExpire(key);
          if (ttl != null && ttl == NO_EXPIRY) {
            stale.add(key);
          }
        }
      }
      if (!stale.isEmpty()) {
        final Long removed = redisTemplate.delete(stale);
        deleted += removed == null ? 0 : removed.intValue();
      }
    }
    return deleted;
  }
}
