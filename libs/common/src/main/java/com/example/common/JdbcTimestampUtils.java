/*
 * どこで: 共通ユーティリティ
 * 何を: JDBC で扱う Instant と Timestamp を明示変換する
 * なぜ: PostgreSQL JDBC が Instant の型推論に失敗するケースを回避するため
 */
package com.example.common;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // 前提: Instant は UTC を表現するため Timestamp.from で UTC のまま渡す
  // トレードオフ: DB 側のタイムゾーン設定が UTC 以外でも、アプリは UTC で統一する
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  // NULL 許容カラムを RowMapper から読むための短縮形
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    return toInstant(rs.getTimestamp(column));
  }
}
