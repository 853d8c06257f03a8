/*
 * どこで: Chat Relay WebSocket 設定
 * 何を: チャットのエンドポイントとハンドシェイク認証を登録する
 * なぜ: パスと許可 Origin を設定値で切り替えられるようにするため
 */
package com.example.chat_relay.ws;

import com.example.chat_relay.config.ChatRelayProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

  private final ChatWebSocketHandler chatWebSocketHandler;
  private final SessionHandshakeInterceptor sessionHandshakeInterceptor;
  private final ChatRelayProperties properties;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    final WebSocketHandlerRegistration registration =
        registry
            .addHandler(chatWebSocketHandler, properties.websocketPath())
            .addInterceptors(sessionHandshakeInterceptor);
    if (!properties.allowedOrigins().isEmpty()) {
      registration.setAllowedOriginPatterns(properties.allowedOrigins().toArray(String[]::new));
    }
  }
}
