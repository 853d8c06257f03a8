/*
 * どこで: Chat Relay WebSocket 受信
 * 何を: 受信テキストを送信フレームへ変換する
 * なぜ: 旧 Web クライアントの {"data":[...]} 形式も同じ経路で受け付けるため
 */
package com.example.chat_relay.ws;

import com.example.common.wire.ClientMessageFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class InboundFrameParser {

  private static final String FIELD_LEGACY_ENVELOPE = "data";

  private final ObjectMapper objectMapper;

  public InboundFrameParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * 役割: payload を message フレームとして解釈する。
   * 動作: JSON でない、オブジェクトでない、type が "message" でない場合は empty を返す。
   *      to/content の中身の検証はルータで行う。
   */
  public Optional<ClientMessageFrame> parse(String payload) {
    if (payload == null || payload.isBlank()) {
      return Optional.empty();
    }
    final JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      return Optional.empty();
    }
    final JsonNode frame = unwrap(root);
    if (frame == null || !frame.isObject()) {
      return Optional.empty();
    }
    if (!ClientMessageFrame.TYPE_MESSAGE.equals(textOrNull(frame, "type"))) {
      return Optional.empty();
    }
    return Optional.of(
        new ClientMessageFrame(
            ClientMessageFrame.TYPE_MESSAGE,
            textOrNull(frame, "to"),
            textOrNull(frame, "content")));
  }

  private JsonNode unwrap(JsonNode root) {
    if (root == null || !root.isObject()) {
      return null;
    }
    final JsonNode envelope = root.get(FIELD_LEGACY_ENVELOPE);
    if (envelope == null) {
      return root;
    }
    // 旧形式は先頭要素のみを使う
    if (!envelope.isArray() || envelope.isEmpty()) {
      return null;
    }
    return envelope.get(0);
  }

  private String textOrNull(JsonNode node, String field) {
    final JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.asText() : null;
  }
}
