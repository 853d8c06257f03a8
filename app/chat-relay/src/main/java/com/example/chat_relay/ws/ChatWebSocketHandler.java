/*
 * どこで: Chat Relay WebSocket 受信
 * 何を: 接続の登録/解除と受信フレームのルータへの受け渡しを行う
 * なぜ: トランスポートの事情(順序、飽和、切断)をルータから切り離すため
 */
package com.example.chat_relay.ws;

import com.example.chat_relay.connection.ConnectionRegistry;
import com.example.chat_relay.service.MessageRouter;
import com.example.chat_relay.service.SendResult;
import com.example.common.wire.AckFrame;
import com.example.common.wire.ChatErrorCode;
import com.example.common.wire.ClientMessageFrame;
import com.example.common.wire.ErrorFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Registry/Router/Executor は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ChatWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(ChatWebSocketHandler.class);
  private static final String ATTRIBUTE_CONTEXT = ChatWebSocketHandler.class.getName() + ".CONTEXT";

  private final ConnectionRegistry connectionRegistry;
  private final MessageRouter messageRouter;
  private final InboundFrameParser frameParser;
  private final ObjectMapper objectMapper;
  private final Executor dispatchExecutor;

  public ChatWebSocketHandler(
      ConnectionRegistry connectionRegistry,
      MessageRouter messageRouter,
      InboundFrameParser frameParser,
      ObjectMapper objectMapper,
      @Qualifier("chatDispatchExecutor") Executor dispatchExecutor) {
    this.connectionRegistry = connectionRegistry;
    this.messageRouter = messageRouter;
    this.frameParser = frameParser;
    this.objectMapper = objectMapper;
    this.dispatchExecutor = dispatchExecutor;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    final Object userId = session.getAttributes().get(SessionHandshakeInterceptor.ATTRIBUTE_USER_ID);
    if (!(userId instanceof String resolvedUserId)) {
      // ハンドシェイクを経ずに来た接続は受け付けない
      logger.warn("connection without identity closed connection_id={}", session.getId());
      closeQuietly(session, CloseStatus.POLICY_VIOLATION);
      return;
    }
    final ConnectionContext context =
        new ConnectionContext(
            new WebSocketChatConnection(session, resolvedUserId),
            new ConnectionDispatcher(dispatchExecutor));
    session.getAttributes().put(ATTRIBUTE_CONTEXT, context);
    connectionRegistry.register(resolvedUserId, context.connection());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    final ConnectionContext context = contextOf(session);
    if (context == null) {
      return;
    }
    final String payload = message.getPayload();
    final String requestId = UUID.randomUUID().toString();
    try {
      context.dispatcher().submit(() -> process(context, payload, requestId));
    } catch (RejectedExecutionException ex) {
      logger.warn(
          "frame rejected, dispatcher saturated connection_id={} user_id={}",
          session.getId(),
          context.connection().userId());
      reply(context, ErrorFrame.of(ChatErrorCode.SERVER_BUSY));
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("transport error connection_id={}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    final ConnectionContext context = contextOf(session);
    if (context == null) {
      return;
    }
    context.dispatcher().close();
    connectionRegistry.unregister(context.connection().userId(), context.connection());
    logger.info(
        "connection closed connection_id={} user_id={} code={}",
        session.getId(),
        context.connection().userId(),
        status.getCode());
  }

  private void process(ConnectionContext context, String payload, String requestId) {
    MDC.put("connection_id", context.connection().connectionId());
    MDC.put("user_id", context.connection().userId());
    MDC.put("request_id", requestId);
    try {
      final Optional<ClientMessageFrame> frame = frameParser.parse(payload);
      if (frame.isEmpty()) {
        logger.info("frame rejected error={}", ChatErrorCode.INVALID_FORMAT.wireValue());
        reply(context, ErrorFrame.of(ChatErrorCode.INVALID_FORMAT));
        return;
      }
      final SendResult result =
          messageRouter.send(
              context.connection().userId(),
              frame.get().to(),
              frame.get().content(),
              context.dispatcher()::isClosed);
      switch (result.status()) {
        case ACK ->
            reply(
                context,
                AckFrame.of(result.message().toUserId(), result.message().sentAt().toString()));
        case REJECTED -> reply(context, ErrorFrame.of(result.error()));
        case DROPPED -> {
          // 送信元は既に切断済み
        }
      }
    } catch (RuntimeException ex) {
      logger.error("frame processing failed", ex);
      // 結果を返せなかった送信にも必ず応答する
      try {
        reply(context, ErrorFrame.of(ChatErrorCode.INTERNAL_ERROR));
      } catch (RuntimeException replyEx) {
        logger.warn("error reply failed", replyEx);
      }
    } finally {
      MDC.remove("connection_id");
      MDC.remove("user_id");
      MDC.remove("request_id");
    }
  }

  private void reply(ConnectionContext context, Object frame) {
    try {
      context.connection().send(objectMapper.writeValueAsString(frame));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize frame", ex);
    } catch (IOException ex) {
      logger.warn(
          "reply failed connection_id={} user_id={}",
          context.connection().connectionId(),
          context.connection().userId(),
          ex);
    }
  }

  private ConnectionContext contextOf(WebSocketSession session) {
    final Object context = session.getAttributes().get(ATTRIBUTE_CONTEXT);
    return context instanceof ConnectionContext connectionContext ? connectionContext : null;
  }

  private void closeQuietly(WebSocketSession session, CloseStatus status) {
    try {
      session.close(status);
    } catch (IOException ex) {
      logger.debug("close failed connection_id={}", session.getId(), ex);
    }
  }

  private record ConnectionContext(
      WebSocketChatConnection connection, ConnectionDispatcher dispatcher) {}
}
