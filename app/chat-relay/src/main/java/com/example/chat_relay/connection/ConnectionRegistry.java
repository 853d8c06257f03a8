/*
 * どこで: Chat Relay 接続管理
 * 何を: ユーザ ID ごとに現在のライブ接続を 1 本だけ保持する
 * なぜ: 配信先の解決を非ブロッキングにし、再接続時の二重配信を防ぐため
 */
package com.example.chat_relay.connection;

import com.example.chat_relay.service.ChatRelayMetrics;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ConnectionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

  private final ConcurrentMap<String, ChatConnection> connections = new ConcurrentHashMap<>();
  private final ChatRelayMetrics metrics;

  /**
   * 役割: userId の接続を登録し、既存の接続があれば置き換える。
   * 動作: 差し替えはキー単位で原子的に行い、旧接続は差し替え後に 4000 "replaced" で閉じる。
   * 前提: connection.userId() と userId が一致すること。
   */
  public void register(String userId, ChatConnection connection) {
    if (!userId.equals(connection.userId())) {
      throw new IllegalArgumentException("connection belongs to another user");
    }
    final AtomicReference<ChatConnection> replaced = new AtomicReference<>();
    connections.compute(
        userId,
        (key, existing) -> {
          if (existing != null && existing != connection) {
            replaced.set(existing);
          }
          return connection;
        });
    metrics.updateActiveConnections(connections.size());
    final ChatConnection previous = replaced.get();
    if (previous != null) {
      // close のコールバックが unregister を呼んでも compute の外なので再入しない
      logger.info(
          "connection replaced user_id={} old_connection_id={} new_connection_id={}",
          userId,
          previous.connectionId(),
          connection.connectionId());
      previous.close(ConnectionCloseReason.REPLACED);
    } else {
      logger.info(
          "connection registered user_id={} connection_id={}", userId, connection.connectionId());
    }
  }

  /** 登録中の接続が同一インスタンスのときだけ外す。古い接続の切断で新しい接続は消えない。 */
  public boolean unregister(String userId, ChatConnection connection) {
    final boolean removed = connections.remove(userId, connection);
    if (removed) {
      metrics.updateActiveConnections(connections.size());
      logger.info(
          "connection unregistered user_id={} connection_id={}",
          userId,
          connection.connectionId());
    }
    return removed;
  }

  public Optional<ChatConnection> lookup(String userId) {
    return Optional.ofNullable(connections.get(userId));
  }

  public boolean isOnline(String userId) {
    return connections.containsKey(userId);
  }

  public int activeCount() {
    return connections.size();
  }

  @PreDestroy
  public void closeAll() {
    final List<ChatConnection> snapshot = new ArrayList<>(connections.values());
    connections.clear();
    metrics.updateActiveConnections(0);
    for (ChatConnection connection : snapshot) {
      connection.close(ConnectionCloseReason.SERVER_SHUTDOWN);
    }
    if (!snapshot.isEmpty()) {
      logger.info("connections closed on shutdown count={}", snapshot.size());
    }
  }
}
