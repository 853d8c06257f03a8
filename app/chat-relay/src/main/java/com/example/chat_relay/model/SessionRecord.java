/*
 * どこで: Chat Relay ドメインモデル
 * 何を: user_sessions テーブルのスナップショット
 * なぜ: Cookie の資格情報からユーザを解決するため
 */
package com.example.chat_relay.model;

import java.time.Instant;
import java.util.UUID;

public record SessionRecord(UUID sessionId, String userId, Instant createdAt, Instant expiresAt) {

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }
}
