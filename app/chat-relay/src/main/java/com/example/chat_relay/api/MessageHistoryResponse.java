/*
 * どこで: Chat Relay API モデル
 * 何を: 会話履歴のレスポンスを表す
 * なぜ: 相手 ID と昇順のメッセージ列を明示的に返すため
 */
package com.example.chat_relay.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageHistoryResponse(String peerId, List<MessageSummary> messages) {
  public MessageHistoryResponse {
    messages = messages == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(messages));
  }

  @Override
  public List<MessageSummary> messages() {
    return Collections.unmodifiableList(new ArrayList<>(messages));
  }
}
