package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  private static final Instant INSTANT = Instant.parse("2026-03-01T12:34:56.123456Z");

  @Test
  void nullsPassThroughBothWays() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
  }

  @Test
  void conversionKeepsMicrosecondPrecision() {
    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(INSTANT);

    assertThat(timestamp.getNanos()).isEqualTo(123_456_000);
    assertThat(JdbcTimestampUtils.toInstant(timestamp)).isEqualTo(INSTANT);
  }
}
