package com.nomen.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void toTimestampKeepsInstantAndPassesNullThrough() {
    final Instant instant = Instant.parse("2026-01-01T00:00:00.123456Z");

    final Timestamp timestamp = JdbcTimestampUtils.toTimestamp(instant);

    assertThat(timestamp.toInstant()).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
  }

  @Test
  void toInstantReadsColumnAndToleratesNull() throws SQLException {
    final Instant instant = Instant.parse("2026-01-01T00:00:00Z");
    final ResultSet rs = mock(ResultSet.class);
    when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(instant));
    when(rs.getTimestamp("updated_at")).thenReturn(null);

    assertThat(JdbcTimestampUtils.toInstant(rs, "created_at")).isEqualTo(instant);
    assertThat(JdbcTimestampUtils.toInstant(rs, "updated_at")).isNull();
  }
}
