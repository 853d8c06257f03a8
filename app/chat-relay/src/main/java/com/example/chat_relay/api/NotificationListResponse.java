/*
 * どこで: Chat Relay API モデル
 * 何を: 通知一覧のレスポンスを表す
 * なぜ: 新しい順の一覧をそのまま返すため
 */
package com.example.chat_relay.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(List<NotificationSummary> notifications) {
  public NotificationListResponse {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    notifications = notifications == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(notifications));
  }

  @Override
  public List<NotificationSummary> notifications() {
    return Collections.unmodifiableList(new ArrayList<>(notifications));
  }
}
