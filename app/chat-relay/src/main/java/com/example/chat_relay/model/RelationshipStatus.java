/*
 * どこで: Chat Relay ドメインモデル
 * 何を: relationships テーブルの status カラム値
 * なぜ: 行が存在しない状態(無関係)と区別して保存状態を固定するため
 */
package com.example.chat_relay.model;

public enum RelationshipStatus {
  LIKED,
  MATCHED
}
