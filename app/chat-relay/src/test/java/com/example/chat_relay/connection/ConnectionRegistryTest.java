/*
 * どこで: Chat Relay 接続管理のテスト
 * 何を: 置き換え、古い接続の解除、並行登録を検証する
 * なぜ: ユーザごとのライブ接続が常に 1 本に収束することを保証するため
 */
package com.example.chat_relay.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.example.chat_relay.service.ChatRelayMetrics;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ConnectionRegistryTest {

  @Mock private ChatRelayMetrics metrics;

  private ConnectionRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ConnectionRegistry(metrics);
  }

  @Test
  void newConnectionReplacesAndClosesPrevious() {
    final FakeChatConnection first = new FakeChatConnection("alice");
    final FakeChatConnection second = new FakeChatConnection("alice");

    registry.register("alice", first);
    registry.register("alice", second);

    assertThat(registry.lookup("alice")).containsSame(second);
    assertThat(first.closedWith()).isEqualTo(ConnectionCloseReason.REPLACED);
    assertThat(second.closedWith()).isNull();
    assertThat(registry.activeCount()).isEqualTo(1);
  }

  @Test
  void staleUnregisterKeepsNewerConnection() {
    final FakeChatConnection first = new FakeChatConnection("alice");
    final FakeChatConnection second = new FakeChatConnection("alice");
    registry.register("alice", first);
    registry.register("alice", second);

    assertThat(registry.unregister("alice", first)).isFalse();
    assertThat(registry.lookup("alice")).containsSame(second);

    assertThat(registry.unregister("alice", second)).isTrue();
    assertThat(registry.lookup("alice")).isEmpty();
    assertThat(registry.isOnline("alice")).isFalse();
  }

  @Test
  void reRegisteringSameConnectionDoesNotCloseIt() {
    final FakeChatConnection connection = new FakeChatConnection("alice");

    registry.register("alice", connection);
    registry.register("alice", connection);

    assertThat(connection.closedWith()).isNull();
  }

  @Test
  void concurrentRegistrationsLeaveExactlyOneOpenConnection() throws InterruptedException {
    final int threads = 16;
    final List<FakeChatConnection> connections = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      connections.add(new FakeChatConnection("alice"));
    }
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    try {
      for (FakeChatConnection connection : connections) {
        executor.submit(
            () -> {
              start.await();
              registry.register("alice", connection);
              return null;
            });
      }
      start.countDown();
    } finally {
      executor.shutdown();
    }
    assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

    final ChatConnection winner = registry.lookup("alice").orElseThrow();
    assertThat(connections.stream().filter(FakeChatConnection::isOpen).toList())
        .containsExactly((FakeChatConnection) winner);
  }

  @Test
  void closeAllClosesEveryConnection() {
    final FakeChatConnection alice = new FakeChatConnection("alice");
    final FakeChatConnection bob = new FakeChatConnection("bob");
    registry.register("alice", alice);
    registry.register("bob", bob);

    registry.closeAll();

    assertThat(alice.closedWith()).isEqualTo(ConnectionCloseReason.SERVER_SHUTDOWN);
    assertThat(bob.closedWith()).isEqualTo(ConnectionCloseReason.SERVER_SHUTDOWN);
    assertThat(registry.activeCount()).isZero();
    verify(metrics).updateActiveConnections(0);
  }
}
