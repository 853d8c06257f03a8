/*
 * どこで: Chat Relay API モデル
 * 何を: 通知一覧の要素
 * なぜ: 種別と既読状態をクライアントで出し分けられるようにするため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.model.NotificationRecord;
import com.example.chat_relay.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId, NotificationType type, String content, Instant createdAt, boolean read) {

  public static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.type(),
        record.content(),
        record.createdAt(),
        record.read());
  }
}
