/*
 * どこで: Chat Relay ドメインモデル
 * 何を: 順序なしのユーザ対を辞書順で正規化したキー
 * なぜ: A→B と B→A の操作が必ず同じ行とロックを使うようにするため
 */
package com.example.chat_relay.model;

public record UserPair(String low, String high) {

  public UserPair {
    if (low == null || high == null) {
      throw new IllegalArgumentException("user ids are required");
    }
    if (low.compareTo(high) >= 0) {
      throw new IllegalArgumentException("pair must be ordered and distinct");
    }
  }

  public static UserPair of(String a, String b) {
    return a.compareTo(b) < 0 ? new UserPair(a, b) : new UserPair(b, a);
  }

  public String lockKey() {
    return low + ":" + high;
  }
}
