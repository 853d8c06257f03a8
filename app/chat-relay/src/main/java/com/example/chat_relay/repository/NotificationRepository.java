/*
 * どこで: Chat Relay データアクセス
 * 何を: notifications テーブルの登録/一覧/既読化を担う
 * なぜ: マッチ成立とオフライン受信の通知を永続化するため
 */
package com.example.chat_relay.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.chat_relay.model.NotificationRecord;
import com.example.chat_relay.model.NotificationType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id, user_id, type, content, created_at, is_read
        ) VALUES (
          :notificationId, :userId, :type, :content, :createdAt, :read
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("type", record.type().name())
            .addValue("content", record.content())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("read", record.read());
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public List<NotificationRecord> findByUserId(String userId) {
    final String sql =
        """
        SELECT notification_id, user_id, type, content, created_at, is_read
        FROM notifications
        WHERE user_id = :userId
        ORDER BY created_at DESC, notification_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /** 既読済みでも 1 を返す。0 は存在しないか他ユーザの通知。 */
  public int markRead(UUID notificationId, String userId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET is_read = TRUE,
            read_at = COALESCE(read_at, :readAt)
        WHERE notification_id = :notificationId
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("userId", userId)
            .addValue("readAt", toTimestamp(readAt));
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        NotificationType.valueOf(rs.getString("type")),
        rs.getString("content"),
        getInstant(rs, "created_at"),
        rs.getBoolean("is_read"));
  }
}
