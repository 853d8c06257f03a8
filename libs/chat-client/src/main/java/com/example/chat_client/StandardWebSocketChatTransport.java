/*
 * どこで: chat-client トランスポート
 * 何を: Spring の StandardWebSocketClient でセッション Cookie 付きの接続を張る
 * なぜ: サーバはハンドシェイク時の Cookie だけで利用者を識別するため
 */
package com.example.chat_client;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

public class StandardWebSocketChatTransport implements ChatTransport {

  private static final Logger logger =
      LoggerFactory.getLogger(StandardWebSocketChatTransport.class);
  public static final String DEFAULT_COOKIE_NAME = "SESSION";

  private final WebSocketClient client;
  private final URI endpoint;
  private final String cookieHeader;

  public StandardWebSocketChatTransport(URI endpoint, String sessionId) {
    this(new StandardWebSocketClient(), endpoint, DEFAULT_COOKIE_NAME, sessionId);
  }

  public StandardWebSocketChatTransport(
      WebSocketClient client, URI endpoint, String cookieName, String sessionId) {
    this.client = client;
    this.endpoint = endpoint;
    this.cookieHeader = cookieName + "=" + sessionId;
  }

  @Override
  public CompletableFuture<ChatSession> connect(ChatSessionHandler handler) {
    final WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
    headers.add(HttpHeaders.COOKIE, cookieHeader);
    final SessionAdapter adapter = new SessionAdapter(handler);
    return client.execute(adapter, headers, endpoint).thenApply(adapter::sessionFor);
  }

  private static final class SessionAdapter extends TextWebSocketHandler {

    private final ChatSessionHandler handler;
    private final AtomicReference<SpringChatSession> current = new AtomicReference<>();

    private SessionAdapter(ChatSessionHandler handler) {
      this.handler = handler;
    }

    ChatSession sessionFor(WebSocketSession session) {
      return wrap(session);
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
      wrap(session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
      handler.onText(wrap(session), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
      handler.onTransportError(wrap(session), exception);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
      handler.onClosed(wrap(session), status.getCode());
    }

    private SpringChatSession wrap(WebSocketSession session) {
      // 同じ WebSocketSession には常に同じラッパーを返す
      return current.updateAndGet(
          existing ->
              existing != null && existing.delegate == session
                  ? existing
                  : new SpringChatSession(session));
    }
  }

  private static final class SpringChatSession implements ChatSession {

    private final WebSocketSession delegate;

    private SpringChatSession(WebSocketSession delegate) {
      this.delegate = delegate;
    }

    @Override
    public boolean isOpen() {
      return delegate.isOpen();
    }

    @Override
    public synchronized void sendText(String payload) throws IOException {
      // WebSocketSession は同時送信不可
      delegate.sendMessage(new TextMessage(payload));
    }

    @Override
    public void close() {
      try {
        delegate.close(CloseStatus.NORMAL);
      } catch (IOException ex) {
        logger.debug("close failed session_id={}", delegate.getId(), ex);
      }
    }
  }
}
