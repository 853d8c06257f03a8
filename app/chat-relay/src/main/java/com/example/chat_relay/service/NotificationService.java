/*
 * どこで: Chat Relay サービス層
 * 何を: 通知一覧の取得と既読化を担う
 * なぜ: 本人の通知だけを参照/更新させるため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.api.NotificationNotFoundException;
import com.example.chat_relay.model.NotificationRecord;
import com.example.chat_relay.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationService {

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  public List<NotificationRecord> list(String userId) {
    return notificationRepository.findByUserId(userId);
  }

  /** 既読への遷移のみ。何度呼んでも結果は同じ。 */
  public void markRead(String userId, UUID notificationId) {
    final int updated = notificationRepository.markRead(notificationId, userId, Instant.now(clock));
    if (updated == 0) {
      throw new NotificationNotFoundException("notification not found: " + notificationId);
    }
  }
}
