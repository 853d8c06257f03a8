/*
 * どこで: Chat Relay API モデル
 * 何を: 会話履歴の 1 件
 * なぜ: WebSocket の配信フレームと同じ from/content/date で返すため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.model.MessageRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageSummary(UUID messageId, String from, String to, String content, Instant date) {

  public static MessageSummary from(MessageRecord record) {
    return new MessageSummary(
        record.messageId(),
        record.fromUserId(),
        record.toUserId(),
        record.content(),
        record.sentAt());
  }
}
