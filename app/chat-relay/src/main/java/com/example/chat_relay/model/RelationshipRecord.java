/*
 * どこで: Chat Relay ドメインモデル
 * 何を: ユーザ対 1 組につき 1 行の関係レコード
 * なぜ: 片方向の like と相互マッチを同じ行で表し、対称性を構造的に保つため
 */
package com.example.chat_relay.model;

import java.time.Instant;

public record RelationshipRecord(
    String userLow,
    String userHigh,
    RelationshipStatus status,
    String likedBy,
    long version,
    Instant createdAt,
    Instant updatedAt) {

  /**
   * 役割: 行の保存状態を actor 視点の状態へ変換する。
   * 前提: actorId は userLow/userHigh のどちらかであること。
   */
  public RelationshipState stateFor(String actorId) {
    if (!actorId.equals(userLow) && !actorId.equals(userHigh)) {
      throw new IllegalArgumentException("actor is not part of relationship: " + actorId);
    }
    return switch (status) {
      case MATCHED -> RelationshipState.MATCHED;
      case LIKED ->
          actorId.equals(likedBy) ? RelationshipState.ACTOR_LIKED : RelationshipState.TARGET_LIKED;
    };
  }
}
