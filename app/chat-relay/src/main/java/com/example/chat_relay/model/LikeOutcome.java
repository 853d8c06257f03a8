/*
 * どこで: Chat Relay ドメインモデル
 * 何を: like 操作の結果種別
 * なぜ: 冪等な no-op をエラーではなく結果として返すため
 */
package com.example.chat_relay.model;

public enum LikeOutcome {
  LIKED,
  ALREADY_LIKED,
  MATCHED,
  ALREADY_MATCHED;

  public boolean matched() {
    return this == MATCHED || this == ALREADY_MATCHED;
  }
}
