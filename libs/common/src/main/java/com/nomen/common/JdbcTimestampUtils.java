/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant を Timestamp に明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避するため
 */
package com.nomen.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  // NULL 許容カラムにもそのまま使える。
  public static Instant toInstant(ResultSet rs, String column) throws SQLException {
    final Timestamp timestamp = rs.getTimestamp(column);
    return timestamp == null ? null : timestamp.toInstant();
  }
}
