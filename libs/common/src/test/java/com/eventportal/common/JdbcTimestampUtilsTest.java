package com.eventportal.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:30:00.123456Z");

  @Test
  void convertsBothWaysWithoutLosingPrecision() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(BASE_TIME);

    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(BASE_TIME);
  }

  @Test
  void keepsNullForOptionalColumns() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }
}
