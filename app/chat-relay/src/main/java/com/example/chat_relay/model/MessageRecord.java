/*
 * どこで: Chat Relay ドメインモデル
 * 何を: messages テーブルの 1 件(作成後は不変)
 * なぜ: 永続化結果をルータと履歴 API で共通化するため
 */
package com.example.chat_relay.model;

import java.time.Instant;
import java.util.UUID;

public record MessageRecord(
    UUID messageId, String fromUserId, String toUserId, String content, Instant sentAt) {}
