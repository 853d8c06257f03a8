/*
 * どこで: Chat Relay WebSocket 接続
 * 何を: Spring の WebSocketSession を ChatConnection として扱う
 * なぜ: 複数スレッドからの送信を直列化し、遅いクライアントで送信側を止めないため
 */
package com.example.chat_relay.ws;

import com.example.chat_relay.connection.ChatConnection;
import com.example.chat_relay.connection.ConnectionCloseReason;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

public class WebSocketChatConnection implements ChatConnection {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketChatConnection.class);
  static final int SEND_TIME_LIMIT_MS = 10_000;
  static final int BUFFER_SIZE_LIMIT_BYTES = 512 * 1024;

  private final WebSocketSession session;
  private final String userId;

  public WebSocketChatConnection(WebSocketSession session, String userId) {
    this.session =
        new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT_BYTES);
    this.userId = userId;
  }

  @Override
  public String connectionId() {
    return session.getId();
  }

  @Override
  public String userId() {
    return userId;
  }

  @Override
  public void send(String payload) throws IOException {
    if (!session.isOpen()) {
      throw new IOException("connection is closed connection_id=" + session.getId());
    }
    try {
      session.sendMessage(new TextMessage(payload));
    } catch (SessionLimitExceededException ex) {
      // 送信バッファ超過。デコレータ側でセッションは閉じられる
      throw new IOException("send limit exceeded connection_id=" + session.getId(), ex);
    }
  }

  @Override
  public void close(ConnectionCloseReason reason) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(new CloseStatus(reason.code(), reason.reason()));
    } catch (IOException ex) {
      logger.warn(
          "connection close failed connection_id={} user_id={} reason={}",
          session.getId(),
          userId,
          reason,
          ex);
    }
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }
}
