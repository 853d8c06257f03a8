/*
 * どこで: Chat Relay ドメインモデル
 * 何を: like/unmatch による関係状態の遷移表
 * なぜ: 新しい状態を追加した際に全遷移の見直しをコンパイル時に強制するため
 */
package com.example.chat_relay.model;

public final class RelationshipTransitions {

  private RelationshipTransitions() {}

  public record Transition<O>(RelationshipState from, RelationshipState to, O outcome) {

    public boolean changesState() {
      return from != to;
    }
  }

  public static Transition<LikeOutcome> onLike(RelationshipState current) {
    return switch (current) {
      case UNRELATED ->
          new Transition<>(current, RelationshipState.ACTOR_LIKED, LikeOutcome.LIKED);
      case ACTOR_LIKED -> new Transition<>(current, current, LikeOutcome.ALREADY_LIKED);
      // 相手が先に like 済みなら片方向の記録を消して相互マッチへ
      case TARGET_LIKED -> new Transition<>(current, RelationshipState.MATCHED, LikeOutcome.MATCHED);
      case MATCHED -> new Transition<>(current, current, LikeOutcome.ALREADY_MATCHED);
    };
  }

  public static Transition<UnmatchOutcome> onUnmatch(RelationshipState current) {
    return switch (current) {
      case MATCHED ->
          new Transition<>(current, RelationshipState.UNRELATED, UnmatchOutcome.UNMATCHED);
      case UNRELATED, ACTOR_LIKED, TARGET_LIKED ->
          new Transition<>(current, current, UnmatchOutcome.NOT_MATCHED);
    };
  }
}
