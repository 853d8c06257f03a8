/*
 * どこで: Chat Relay データアクセス
 * 何を: user_sessions の登録/参照/削除を行う
 * なぜ: ハンドシェイク時の資格情報解決を DB の最新状態で行うため
 */
package com.example.chat_relay.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.chat_relay.model.SessionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class SessionRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public void insert(SessionRecord record) {
        String sql = """
                INSERT INTO user_sessions (session_id, user_id, created_at, expires_at)
                VALUES (:sessionId, :userId, :createdAt, :expiresAt)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("sessionId", record.sessionId())
                .addValue("userId", record.userId())
                .addValue("createdAt", toTimestamp(record.createdAt()))
                .addValue("expiresAt", toTimestamp(record.expiresAt()));
        jdbcTemplate.update(sql, params);
    }

    public Optional<SessionRecord> findById(UUID sessionId) {
        String sql = """
                SELECT session_id, user_id, created_at, expires_at
                FROM user_sessions
                WHERE session_id = :sessionId
                """;
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("sessionId", sessionId);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    public int deleteById(UUID sessionId) {
        String sql = "DELETE FROM user_sessions WHERE session_id = :sessionId";
        return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("sessionId", sessionId));
    }

    public int deleteExpired(Instant now) {
        String sql = """
                DELETE FROM user_sessions
                WHERE expires_at <= :now
                """;
        return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
    }

    private SessionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new SessionRecord(
                UUID.fromString(rs.getString("session_id")),
                rs.getString("user_id"),
                getInstant(rs, "created_at"),
                getInstant(rs, "expires_at"));
    }
}
