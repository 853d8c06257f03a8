/*
 * どこで: Chat Relay アプリの設定バインド
 * 何を: WebSocket エンドポイントとメッセージ検証の設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.example.chat_relay.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat-relay")
public record ChatRelayProperties(
    String websocketPath, List<String> allowedOrigins, int maxContentLength) {

  public ChatRelayProperties {
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
  }
}
