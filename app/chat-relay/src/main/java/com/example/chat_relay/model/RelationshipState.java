/*
 * どこで: Chat Relay ドメインモデル
 * 何を: (actor, target) 視点の関係状態
 * なぜ: 遷移判定を配列の包含チェックではなく明示的な状態で行うため
 */
package com.example.chat_relay.model;

public enum RelationshipState {
  UNRELATED,
  ACTOR_LIKED,
  TARGET_LIKED,
  MATCHED
}
