/*
 * どこで: Chat Relay ドメインモデル
 * 何を: users テーブルのスナップショット
 * なぜ: 通知文言と一覧 API で表示名を共有するため
 */
package com.example.chat_relay.model;

import java.time.Instant;

public record UserRecord(String userId, String displayName, Instant createdAt) {}
