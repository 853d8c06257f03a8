/*
 * どこで: Chat Relay API モデル
 * 何を: ユーザ一覧(liked / liked-by)のレスポンスを表す
 * なぜ: 関係の向きごとに同じ形で返すため
 */
package com.example.chat_relay.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserListResponse(List<UserSummary> users) {
  public UserListResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    users = users == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(users));
  }

  @Override
  public List<UserSummary> users() {
    return Collections.unmodifiableList(new ArrayList<>(users));
  }
}
