package com.logimetrics.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void nullValuesStayNull() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
    assertThat(JdbcTimestampUtils.toLocalDate(null)).isNull();
  }

  @Test
  void instantSurvivesTimestampConversion() {
    final Instant instant = Instant.parse("2026-03-01T10:15:30.123Z");

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
  }

  @Test
  void localDateSurvivesSqlDateConversion() {
    final LocalDate date = LocalDate.of(2026, 2, 28);

    assertThat(JdbcTimestampUtils.toLocalDate(JdbcTimestampUtils.toSqlDate(date))).isEqualTo(date);
  }

  @Test
  void traceIdsAreCompactAndUnique() {
    final String first = TraceIds.newTraceId();
    final String second = TraceIds.newTraceId();

    assertThat(first).hasSize(32).doesNotContain("-");
    assertThat(first).isNotEqualTo(second);
  }
}
