/*
 * どこで: Chat Relay API モデル
 * 何を: マッチ一覧のレスポンスを表す
 * なぜ: オンライン状態と合わせて返すため
 */
package com.example.chat_relay.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MatchListResponse(List<MatchSummary> matches) {
  public MatchListResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    matches = matches == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(matches));
  }

  @Override
  public List<MatchSummary> matches() {
    return Collections.unmodifiableList(new ArrayList<>(matches));
  }
}
