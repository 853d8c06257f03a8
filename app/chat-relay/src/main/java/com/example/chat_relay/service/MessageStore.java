/*
 * どこで: Chat Relay サービス層
 * 何を: メッセージの両ログへの追記と通知の追記を担う
 * なぜ: 送信者と受信者の履歴を同一トランザクションで揃えるため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.model.MessageRecord;
import com.example.chat_relay.model.NotificationRecord;
import com.example.chat_relay.model.NotificationType;
import com.example.chat_relay.repository.MessageRepository;
import com.example.chat_relay.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class MessageStore {

  private final MessageRepository messageRepository;
  private final NotificationRepository notificationRepository;
  private final Clock clock;

  /**
   * 役割: メッセージを送信者/受信者の両ログへ保存する。
   * 動作: 送信時刻はサーバの Clock でマイクロ秒に丸めて確定し、どちらかの書き込みが失敗すれば全体をロールバックする。
   */
  @Transactional
  public MessageRecord appendMessage(String fromUserId, String toUserId, String content) {
    final MessageRecord record =
        new MessageRecord(UUID.randomUUID(), fromUserId, toUserId, content, now());
    messageRepository.insert(fromUserId, record);
    messageRepository.insert(toUserId, record);
    return record;
  }

  /** 呼び出し元のトランザクションがあれば参加する。 */
  @Transactional
  public NotificationRecord appendNotification(
      String userId, NotificationType type, String content) {
    final NotificationRecord record =
        NotificationRecord.unread(userId, type, content, now());
    notificationRepository.insert(record);
    return record;
  }

  public List<MessageRecord> conversation(String ownerUserId, String peerUserId) {
    return messageRepository.findConversation(ownerUserId, peerUserId);
  }

  // TIMESTAMPTZ の精度に合わせる
  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
