/*
 * どこで: Chat Relay ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: マッチ成立/オフライン受信の通知を一覧と既読化で共通化するため
 */
package com.example.chat_relay.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    NotificationType type,
    String content,
    Instant createdAt,
    boolean read) {

  public static NotificationRecord unread(
      String userId, NotificationType type, String content, Instant createdAt) {
    return new NotificationRecord(UUID.randomUUID(), userId, type, content, createdAt, false);
  }
}
