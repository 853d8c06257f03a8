/*
 * どこで: Chat Relay データアクセス
 * 何を: relationships テーブルの参照/遷移と対単位のロックを担う
 * なぜ: like/unmatch の状態遷移を対ごとに直列化し、マッチ判定を 1 行で行うため
 */
package com.example.chat_relay.repository;

import static com.example.common.JdbcTimestampUtils.getInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.chat_relay.model.RelationshipRecord;
import com.example.chat_relay.model.RelationshipStatus;
import com.example.chat_relay.model.UserPair;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class RelationshipRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void lockPair(long lockKey) {
    // 同じ対への like/unmatch をトランザクション単位で直列化する
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("lockKey", lockKey);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public Optional<RelationshipRecord> findByPair(UserPair pair) {
    final String sql =
        """
        SELECT user_low, user_high, status, liked_by, version, created_at, updated_at
        FROM relationships
        WHERE user_low = :userLow
          AND user_high = :userHigh
        """;
    return jdbcTemplate.query(sql, pairParams(pair), this::mapRow).stream().findFirst();
  }

  public int insertLiked(UserPair pair, String likedBy, Instant now) {
    final String sql =
        """
        INSERT INTO relationships (
          user_low, user_high, status, liked_by, version, created_at, updated_at
        ) VALUES (
          :userLow, :userHigh, 'LIKED', :likedBy, 0, :now, :now
        )
        ON CONFLICT (user_low, user_high) DO NOTHING
        """;
    final MapSqlParameterSource params =
        pairParams(pair).addValue("likedBy", likedBy).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markMatched(UserPair pair, long expectedVersion, Instant now) {
    // 片方向の like を消して MATCHED の 1 行へ置き換える
    final String sql =
        """
        UPDATE relationships
        SET status = 'MATCHED',
            liked_by = NULL,
            version = version + 1,
            updated_at = :now
        WHERE user_low = :userLow
          AND user_high = :userHigh
          AND status = 'LIKED'
          AND version = :expectedVersion
        """;
    final MapSqlParameterSource params =
        pairParams(pair)
            .addValue("expectedVersion", expectedVersion)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteMatched(UserPair pair, long expectedVersion) {
    final String sql =
        """
        DELETE FROM relationships
        WHERE user_low = :userLow
          AND user_high = :userHigh
          AND status = 'MATCHED'
          AND version = :expectedVersion
        """;
    return jdbcTemplate.update(sql, pairParams(pair).addValue("expectedVersion", expectedVersion));
  }

  public boolean isMatched(UserPair pair) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM relationships
          WHERE user_low = :userLow
            AND user_high = :userHigh
            AND status = 'MATCHED'
        )
        """;
    final Boolean matched = jdbcTemplate.queryForObject(sql, pairParams(pair), Boolean.class);
    return Boolean.TRUE.equals(matched);
  }

  /** userId が一方的に like している相手(マッチ済みは含まない)。 */
  public List<String> findLikedUserIds(String userId) {
    final String sql =
        """
        SELECT CASE WHEN user_low = :userId THEN user_high ELSE user_low END AS peer_id
        FROM relationships
        WHERE status = 'LIKED'
          AND liked_by = :userId
        ORDER BY updated_at DESC, peer_id
        """;
    return queryPeerIds(sql, userId);
  }

  /** userId を一方的に like している相手。 */
  public List<String> findLikedByUserIds(String userId) {
    final String sql =
        """
        SELECT CASE WHEN user_low = :userId THEN user_high ELSE user_low END AS peer_id
        FROM relationships
        WHERE status = 'LIKED'
          AND (user_low = :userId OR user_high = :userId)
          AND liked_by <> :userId
        ORDER BY updated_at DESC, peer_id
        """;
    return queryPeerIds(sql, userId);
  }

  public List<String> findMatchedUserIds(String userId) {
    final String sql =
        """
        SELECT CASE WHEN user_low = :userId THEN user_high ELSE user_low END AS peer_id
        FROM relationships
        WHERE status = 'MATCHED'
          AND (user_low = :userId OR user_high = :userId)
        ORDER BY updated_at DESC, peer_id
        """;
    return queryPeerIds(sql, userId);
  }

  private List<String> queryPeerIds(String sql, String userId) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("peer_id"));
  }

  private MapSqlParameterSource pairParams(UserPair pair) {
    return new MapSqlParameterSource()
        .addValue("userLow", pair.low())
        .addValue("userHigh", pair.high());
  }

  private RelationshipRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new RelationshipRecord(
        rs.getString("user_low"),
        rs.getString("user_high"),
        RelationshipStatus.valueOf(rs.getString("status")),
        rs.getString("liked_by"),
        rs.getLong("version"),
        getInstant(rs, "created_at"),
        getInstant(rs, "updated_at"));
  }
}
