package com.example.chat_relay.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.chat_relay.connection.ConnectionRegistry;
import com.example.chat_relay.model.MessageRecord;
import com.example.chat_relay.service.MessageRouter;
import com.example.chat_relay.service.SendResult;
import com.example.common.wire.ChatErrorCode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@ExtendWith(MockitoExtension.class)
class ChatWebSocketHandlerTest {

  private static final Instant SENT_AT = Instant.parse("2026-01-17T00:00:00Z");

  @Mock private ConnectionRegistry connectionRegistry;
  @Mock private MessageRouter messageRouter;
  @Mock private WebSocketSession session;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Map<String, Object> attributes = new HashMap<>();

  @BeforeEach
  void setUp() {
    lenient().when(session.getId()).thenReturn("conn-1");
    lenient().when(session.isOpen()).thenReturn(true);
    lenient().when(session.getAttributes()).thenReturn(attributes);
  }

  @Test
  void connectionWithoutIdentityIsClosed() throws Exception {
    handler(Runnable::run).afterConnectionEstablished(session);

    verify(session).close(CloseStatus.POLICY_VIOLATION);
    verifyNoInteractions(connectionRegistry);
  }

  @Test
  void acceptedMessageIsAcknowledged() throws Exception {
    when(messageRouter.send(eq("alice"), eq("bob"), eq("hi"), any(BooleanSupplier.class)))
        .thenReturn(
            SendResult.ack(new MessageRecord(UUID.randomUUID(), "alice", "bob", "hi", SENT_AT)));
    final ChatWebSocketHandler handler = connectedHandler(Runnable::run);

    handler.handleMessage(
        session, new TextMessage("{\"type\":\"message\",\"to\":\"bob\",\"content\":\"hi\"}"));

    assertThat(lastSent())
        .isEqualTo("{\"type\":\"ack\",\"to\":\"bob\",\"date\":\"2026-01-17T00:00:00Z\"}");
  }

  @Test
  void malformedFrameIsAnsweredWithInvalidFormat() throws Exception {
    final ChatWebSocketHandler handler = connectedHandler(Runnable::run);

    handler.handleMessage(session, new TextMessage("not json"));

    assertThat(lastSent()).isEqualTo("{\"error\":\"InvalidFormat\"}");
    verifyNoInteractions(messageRouter);
  }

  @Test
  void rejectedMessageCarriesRouterError() throws Exception {
    when(messageRouter.send(eq("alice"), eq("carol"), eq("hi"), any(BooleanSupplier.class)))
        .thenReturn(SendResult.rejected(ChatErrorCode.NOT_MATCHED));
    final ChatWebSocketHandler handler = connectedHandler(Runnable::run);

    handler.handleMessage(
        session, new TextMessage("{\"type\":\"message\",\"to\":\"carol\",\"content\":\"hi\"}"));

    assertThat(lastSent()).isEqualTo("{\"error\":\"NotMatched\"}");
  }

  @Test
  void unexpectedRouterFailureIsAnsweredWithInternalError() throws Exception {
    when(messageRouter.send(eq("alice"), eq("bob"), eq("hi"), any(BooleanSupplier.class)))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    final ChatWebSocketHandler handler = connectedHandler(Runnable::run);

    handler.handleMessage(
        session, new TextMessage("{\"type\":\"message\",\"to\":\"bob\",\"content\":\"hi\"}"));

    assertThat(lastSent()).isEqualTo("{\"error\":\"InternalError\"}");
  }

  @Test
  void saturatedPoolAnswersServerBusy() throws Exception {
    final Executor saturated =
        task -> {
          throw new RejectedExecutionException("queue full");
        };
    final ChatWebSocketHandler handler = connectedHandler(saturated);

    handler.handleMessage(
        session, new TextMessage("{\"type\":\"message\",\"to\":\"bob\",\"content\":\"hi\"}"));

    assertThat(lastSent()).isEqualTo("{\"error\":\"ServerBusy\"}");
    verifyNoInteractions(messageRouter);
  }

  @Test
  void closeUnregistersOwnConnectionAndStopsDispatch() throws Exception {
    final ChatWebSocketHandler handler = connectedHandler(Runnable::run);

    handler.afterConnectionClosed(session, CloseStatus.NORMAL);
    handler.handleMessage(
        session, new TextMessage("{\"type\":\"message\",\"to\":\"bob\",\"content\":\"hi\"}"));

    final ArgumentCaptor<WebSocketChatConnection> captor =
        ArgumentCaptor.forClass(WebSocketChatConnection.class);
    verify(connectionRegistry).register(eq("alice"), captor.capture());
    verify(connectionRegistry).unregister("alice", captor.getValue());
    // 閉じた後の受信は ServerBusy で返し、ルータには渡さない
    verify(messageRouter, never()).send(any(), any(), any(), any());
  }

  private ChatWebSocketHandler connectedHandler(Executor executor) throws Exception {
    attributes.put(SessionHandshakeInterceptor.ATTRIBUTE_USER_ID, "alice");
    final ChatWebSocketHandler handler = handler(executor);
    handler.afterConnectionEstablished(session);
    return handler;
  }

  private ChatWebSocketHandler handler(Executor executor) {
    return new ChatWebSocketHandler(
        connectionRegistry,
        messageRouter,
        new InboundFrameParser(objectMapper),
        objectMapper,
        executor);
  }

  private String lastSent() throws Exception {
    final ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
    verify(session, atLeastOnce()).sendMessage(captor.capture());
    return captor.getValue().getPayload();
  }
}
