/*
 * どこで: Chat Relay データアクセス
 * 何を: messages テーブルへの所有者別ログの追記と会話の取得を担う
 * なぜ: 送信者/受信者それぞれの履歴を独立に保持するため
 */
package com.example.chat_relay.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.chat_relay.model.MessageRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(String ownerUserId, MessageRecord record) {
    final String sql =
        """
        INSERT INTO messages (
          message_id, owner_user_id, from_user_id, to_user_id, content, sent_at
        ) VALUES (
          :messageId, :ownerUserId, :fromUserId, :toUserId, :content, :sentAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("messageId", record.messageId())
            .addValue("ownerUserId", ownerUserId)
            .addValue("fromUserId", record.fromUserId())
            .addValue("toUserId", record.toUserId())
            .addValue("content", record.content())
            .addValue("sentAt", toTimestamp(record.sentAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** 役割: owner のログから peer との会話を送信時刻の昇順で返す(同時刻は追記順)。 */
  public List<MessageRecord> findConversation(String ownerUserId, String peerUserId) {
    final String sql =
        """
        SELECT message_id, from_user_id, to_user_id, content, sent_at
        FROM messages
        WHERE owner_user_id = :ownerUserId
          AND (
            (from_user_id = :ownerUserId AND to_user_id = :peerUserId)
            OR (from_user_id = :peerUserId AND to_user_id = :ownerUserId)
          )
        ORDER BY sent_at, seq
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("ownerUserId", ownerUserId)
            .addValue("peerUserId", peerUserId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MessageRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageRecord(
        UUID.fromString(rs.getString("message_id")),
        rs.getString("from_user_id"),
        rs.getString("to_user_id"),
        rs.getString("content"),
        getInstant(rs, "sent_at"));
  }
}
