/*
 * どこで: Chat Relay データアクセス
 * 何を: users テーブルの登録/取得を担う
 * なぜ: 存在確認と表示名の解決を一箇所に集約するため
 */
package com.example.chat_relay.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.chat_relay.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(UserRecord record) {
    final String sql =
        """
        INSERT INTO users (user_id, display_name, created_at)
        VALUES (:userId, :displayName, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("displayName", record.displayName())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<UserRecord> findById(String userId) {
    final String sql =
        """
        SELECT user_id, display_name, created_at
        FROM users
        WHERE user_id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<UserRecord> findByIds(Collection<String> userIds) {
    if (userIds.isEmpty()) {
      return List.of();
    }
    final String sql =
        """
        SELECT user_id, display_name, created_at
        FROM users
        WHERE user_id IN (:userIds)
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userIds", userIds);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getString("user_id"),
        rs.getString("display_name"),
        getInstant(rs, "created_at"));
  }
}
