/*
 * Where: Cron evaluation
 * What: Parses a five-field cron expression bound to an IANA zone and yields next-fire instants
 * Why: Every job cadence is expressed in local wall-clock time of the operating region
 */
package com.logimetrics.coordinator.cron;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import org.springframework.scheduling.support.CronExpression;

/**
 * Immutable cron schedule.
 *
 * <p>Candidates are searched in local date-time and then resolved against the zone rules. A local
 * time that falls into a DST gap is shifted forward by the length of the gap. A local time that
 * occurs twice in an overlap resolves to the earlier offset only, so it fires once.
 */
public final class CronSchedule {

  private static final int FIELD_COUNT = 5;

  private final String expression;
  private final ZoneId zone;
  private final CronExpression cron;

  private CronSchedule(String expression, ZoneId zone, CronExpression cron) {
    this.expression = expression;
    this.zone = zone;
    this.cron = cron;
  }

  public static CronSchedule parse(String expression, String zoneId) {
    final ZoneId zone;
    try {
      zone = ZoneId.of(zoneId == null ? "" : zoneId.trim());
    } catch (DateTimeException ex) {
      throw new InvalidScheduleException(
          InvalidScheduleException.Reason.UNKNOWN_TIMEZONE,
          expression,
          "unknown timezone: " + zoneId,
          ex);
    }
    return parse(expression, zone);
  }

  public static CronSchedule parse(String expression, ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    if (expression == null || expression.isBlank()) {
      throw new InvalidScheduleException(
          InvalidScheduleException.Reason.BLANK_EXPRESSION, expression, "cron expression is blank");
    }
    final String normalized = expression.trim().replaceAll("\\s+", " ");
    final int fields = normalized.split(" ").length;
    if (fields != FIELD_COUNT) {
      throw new InvalidScheduleException(
          InvalidScheduleException.Reason.FIELD_COUNT,
          expression,
          "cron expression must have 5 fields but had " + fields + ": " + expression);
    }
    try {
      // CronExpression expects a leading seconds field
      return new CronSchedule(normalized, zone, CronExpression.parse("0 " + normalized));
    } catch (IllegalArgumentException ex) {
      throw new InvalidScheduleException(
          InvalidScheduleException.Reason.MALFORMED_FIELD,
          expression,
          "cron expression is malformed: " + expression,
          ex);
    }
  }

  /** Returns the first fire instant strictly after {@code after}, or null if none exists. */
  public Instant next(Instant after) {
    Objects.requireNonNull(after, "after");
    LocalDateTime cursor = after.atZone(zone).toLocalDateTime();
    while (true) {
      final LocalDateTime candidate = cron.next(cursor);
      if (candidate == null) {
        return null;
      }
      final Instant resolved = ZonedDateTime.ofLocal(candidate, zone, null).toInstant();
      if (resolved.isAfter(after)) {
        return resolved;
      }
      cursor = candidate;
    }
  }

  public String expression() {
    return expression;
  }

  public ZoneId zone() {
    return zone;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CronSchedule that)) {
      return false;
    }
    return expression.equals(that.expression) && zone.equals(that.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, zone);
  }

  @Override
  public String toString() {
    return expression + " [" + zone + "]";
  }
}
