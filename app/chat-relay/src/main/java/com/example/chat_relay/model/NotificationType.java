/*
 * どこで: Chat Relay ドメインモデル
 * 何を: 通知の種別を表す列挙
 * なぜ: DB と API の値を一致させるため
 */
package com.example.chat_relay.model;

public enum NotificationType {
  MATCH,
  MESSAGE
}
