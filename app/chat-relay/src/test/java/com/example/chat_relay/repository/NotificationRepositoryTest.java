package com.example.chat_relay.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.chat_relay.AbstractPostgresContainerTest;
import com.example.chat_relay.model.NotificationRecord;
import com.example.chat_relay.model.NotificationType;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void findByUserIdReturnsNewestFirst() {
    notificationRepository.insert(
        NotificationRecord.unread("bob", NotificationType.MATCH, "You matched", BASE_TIME));
    notificationRepository.insert(
        NotificationRecord.unread(
            "bob", NotificationType.MESSAGE, "New message from Alice", BASE_TIME.plusSeconds(5)));
    notificationRepository.insert(
        NotificationRecord.unread("alice", NotificationType.MATCH, "You matched", BASE_TIME));

    assertThat(notificationRepository.findByUserId("bob"))
        .extracting(NotificationRecord::content)
        .containsExactly("New message from Alice", "You matched");
  }

  @Test
  void markReadIsIdempotentAndKeepsFirstReadTime() {
    final UUID id =
        notificationRepository.insert(
            NotificationRecord.unread("bob", NotificationType.MATCH, "You matched", BASE_TIME));
    final Instant firstRead = BASE_TIME.plusSeconds(60);

    assertThat(notificationRepository.markRead(id, "bob", firstRead)).isEqualTo(1);
    assertThat(notificationRepository.markRead(id, "bob", firstRead.plusSeconds(60))).isEqualTo(1);

    final Map<String, Object> row =
        jdbcTemplate.queryForMap(
            "SELECT is_read, read_at FROM notifications WHERE notification_id = :id",
            new MapSqlParameterSource("id", id));
    assertThat(row.get("is_read")).isEqualTo(Boolean.TRUE);
    assertThat(((Timestamp) row.get("read_at")).toInstant()).isEqualTo(firstRead);
    assertThat(notificationRepository.findByUserId("bob").get(0).read()).isTrue();
  }

  @Test
  void markReadOfOtherUsersNotificationChangesNothing() {
    final UUID id =
        notificationRepository.insert(
            NotificationRecord.unread("bob", NotificationType.MATCH, "You matched", BASE_TIME));

    assertThat(notificationRepository.markRead(id, "mallory", BASE_TIME)).isZero();
    assertThat(notificationRepository.markRead(UUID.randomUUID(), "bob", BASE_TIME)).isZero();
    assertThat(notificationRepository.findByUserId("bob").get(0).read()).isFalse();
  }
}
