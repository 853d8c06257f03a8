/*
 * どこで: Chat Relay サービス層
 * 何を: マッチ判定、永続化、ライブ配信またはオフライン通知の順で 1 件の送信を処理する
 * なぜ: 「保存済みなら必ず受信者に届く経路がある」ことを送信経路の一箇所で保証するため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.config.ChatRelayProperties;
import com.example.chat_relay.connection.ChatConnection;
import com.example.chat_relay.connection.ConnectionRegistry;
import com.example.chat_relay.model.MessageRecord;
import com.example.chat_relay.model.NotificationType;
import com.example.chat_relay.model.UserRecord;
import com.example.chat_relay.repository.UserRepository;
import com.example.common.wire.ChatErrorCode;
import com.example.common.wire.DeliveredMessageFrame;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper と Registry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class MessageRouter {

  private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);
  static final String MESSAGE_NOTIFICATION_PREFIX = "New message from ";
  static final String RESULT_ACK = "ack";
  static final String RESULT_DROPPED = "dropped";

  private final RelationshipGate relationshipGate;
  private final MessageStore messageStore;
  private final ConnectionRegistry connectionRegistry;
  private final UserRepository userRepository;
  private final ChatRelayProperties properties;
  private final ChatRelayMetrics metrics;
  private final ObjectMapper objectMapper;

  public MessageRouter(
      RelationshipGate relationshipGate,
      MessageStore messageStore,
      ConnectionRegistry connectionRegistry,
      UserRepository userRepository,
      ChatRelayProperties properties,
      ChatRelayMetrics metrics,
      ObjectMapper objectMapper) {
    this.relationshipGate = relationshipGate;
    this.messageStore = messageStore;
    this.connectionRegistry = connectionRegistry;
    this.userRepository = userRepository;
    this.properties = properties;
    this.metrics = metrics;
    this.objectMapper = objectMapper;
  }

  public SendResult send(String senderId, String recipientId, String content) {
    return send(senderId, recipientId, content, () -> false);
  }

  /**
   * 役割: senderId から recipientId への 1 件の送信を処理する。
   * 動作: 拒否時はメッセージも通知も作らない。永続化後に cancelled を見ることはない。
   * 前提: senderId は認証済みのユーザ ID。cancelled は送信元接続が閉じたら true を返す。
   */
  public SendResult send(
      String senderId, String recipientId, String content, BooleanSupplier cancelled) {
    if (!isValid(recipientId, content)) {
      return reject(ChatErrorCode.INVALID_FORMAT, senderId, recipientId);
    }
    final boolean matched;
    try {
      matched = relationshipGate.isMatched(senderId, recipientId);
    } catch (DataAccessException | TransactionException ex) {
      logger.error(
          "match lookup failed sender_id={} recipient_id={}", senderId, recipientId, ex);
      return reject(ChatErrorCode.PERSISTENCE_FAILED, senderId, recipientId);
    }
    if (!matched) {
      return reject(ChatErrorCode.NOT_MATCHED, senderId, recipientId);
    }
    if (cancelled.getAsBoolean()) {
      metrics.recordMessage(RESULT_DROPPED);
      logger.info("message dropped sender_id={} recipient_id={}", senderId, recipientId);
      return SendResult.dropped();
    }

    final MessageRecord message;
    try {
      message = messageStore.appendMessage(senderId, recipientId, content);
    } catch (DataAccessException | TransactionException ex) {
      logger.error(
          "message persist failed sender_id={} recipient_id={}", senderId, recipientId, ex);
      return reject(ChatErrorCode.PERSISTENCE_FAILED, senderId, recipientId);
    }

    deliver(message);
    metrics.recordMessage(RESULT_ACK);
    return SendResult.ack(message);
  }

  private void deliver(MessageRecord message) {
    final Optional<ChatConnection> recipient = connectionRegistry.lookup(message.toUserId());
    if (recipient.isPresent()) {
      try {
        recipient.get().send(toDeliveredFrame(message));
        metrics.recordDelivery(DeliveryPath.LIVE);
        return;
      } catch (IOException | RuntimeException ex) {
        // 閉じかけのセッションは IllegalStateException を投げる
        logger.warn(
            "live delivery failed, falling back to notification message_id={} recipient_id={} connection_id={}",
            message.messageId(),
            message.toUserId(),
            recipient.get().connectionId(),
            ex);
        notifyOffline(message, DeliveryPath.LIVE_FAILED);
        return;
      }
    }
    notifyOffline(message, DeliveryPath.OFFLINE);
  }

  private void notifyOffline(MessageRecord message, DeliveryPath path) {
    try {
      final String senderName =
          userRepository
              .findById(message.fromUserId())
              .map(UserRecord::displayName)
              .orElse(message.fromUserId());
      messageStore.appendNotification(
          message.toUserId(), NotificationType.MESSAGE, MESSAGE_NOTIFICATION_PREFIX + senderName);
      metrics.recordDelivery(path);
    } catch (DataAccessException | TransactionException ex) {
      // メッセージ本体は保存済みのため送信者へは返さない
      metrics.recordNotificationFailure();
      logger.error(
          "offline notification persist failed message_id={} recipient_id={}",
          message.messageId(),
          message.toUserId(),
          ex);
    }
  }

  private String toDeliveredFrame(MessageRecord message) {
    try {
      return objectMapper.writeValueAsString(
          DeliveredMessageFrame.of(
              message.fromUserId(), message.content(), message.sentAt().toString()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize delivered message", ex);
    }
  }

  private boolean isValid(String recipientId, String content) {
    return recipientId != null
        && !recipientId.isBlank()
        && content != null
        && !content.isBlank()
        && content.length() <= properties.maxContentLength();
  }

  private SendResult reject(ChatErrorCode code, String senderId, String recipientId) {
    metrics.recordMessage(code.wireValue());
    logger.info(
        "message rejected sender_id={} recipient_id={} error={}",
        senderId,
        recipientId,
        code.wireValue());
    return SendResult.rejected(code);
  }
}
