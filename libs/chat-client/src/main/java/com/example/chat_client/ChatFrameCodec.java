/*
 * どこで: chat-client フレーム変換
 * 何を: 送信フレームの JSON 化と、受信フレームの種別判定を行う
 * なぜ: サーバと同じワイヤ定義(common)を使って形状のずれを防ぐため
 */
package com.example.chat_client;

import com.example.common.wire.AckFrame;
import com.example.common.wire.ChatErrorCode;
import com.example.common.wire.ClientMessageFrame;
import com.example.common.wire.DeliveredMessageFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ChatFrameCodec {

  private static final Logger logger = LoggerFactory.getLogger(ChatFrameCodec.class);

  private final ObjectMapper objectMapper;

  public ChatFrameCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String encodeMessage(String to, String content) {
    try {
      return objectMapper.writeValueAsString(ClientMessageFrame.message(to, content));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize message frame", ex);
    }
  }

  /**
   * 役割: サーバからのフレームを種別ごとに listener へ渡す。
   * 動作: 解釈できないフレームは読み捨てて false を返す。
   */
  public boolean dispatch(String payload, ChatClientListener listener) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      logger.warn("unreadable server frame", ex);
      return false;
    }
    if (node == null || !node.isObject()) {
      return false;
    }
    try {
      if (node.hasNonNull("error")) {
        listener.onError(ChatErrorCode.fromWireValue(node.get("error").asText()));
        return true;
      }
      final String type = node.path("type").asText("");
      if (AckFrame.TYPE_ACK.equals(type)) {
        listener.onAck(objectMapper.treeToValue(node, AckFrame.class));
        return true;
      }
      if (DeliveredMessageFrame.TYPE_MESSAGE.equals(type)) {
        listener.onMessage(objectMapper.treeToValue(node, DeliveredMessageFrame.class));
        return true;
      }
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      logger.warn("unsupported server frame", ex);
      return false;
    }
    logger.debug("unknown server frame type={}", node.path("type").asText(""));
    return false;
  }
}
