/*
 * どこで: Chat Relay ドメインモデル
 * 何を: マッチ解除操作の結果種別
 * なぜ: 未マッチ時の解除を no-op として返すため
 */
package com.example.chat_relay.model;

public enum UnmatchOutcome {
  UNMATCHED,
  NOT_MATCHED
}
