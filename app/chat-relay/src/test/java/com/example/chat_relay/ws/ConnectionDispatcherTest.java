package com.example.chat_relay.ws;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ConnectionDispatcherTest {

  @Test
  void runsTasksInSubmissionOrder() throws InterruptedException {
    final ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
    pool.setCorePoolSize(4);
    pool.initialize();
    try {
      final ConnectionDispatcher dispatcher = new ConnectionDispatcher(pool);
      final List<Integer> order = new ArrayList<>();
      final CountDownLatch done = new CountDownLatch(50);
      for (int i = 0; i < 50; i++) {
        final int value = i;
        dispatcher.submit(
            () -> {
              synchronized (order) {
                order.add(value);
              }
              done.countDown();
            });
      }

      assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
      synchronized (order) {
        assertThat(order).isSorted().hasSize(50);
      }
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void saturatedPoolRejectsSubmission() {
    final Executor rejecting =
        task -> {
          throw new TaskRejectedException("queue full");
        };
    final ConnectionDispatcher dispatcher = new ConnectionDispatcher(rejecting);

    assertThatThrownBy(() -> dispatcher.submit(() -> {}))
        .isInstanceOf(RejectedExecutionException.class);
  }

  @Test
  void closedDispatcherRejectsNewTasks() {
    final ConnectionDispatcher dispatcher = new ConnectionDispatcher(Runnable::run);

    dispatcher.close();

    assertThat(dispatcher.isClosed()).isTrue();
    assertThatThrownBy(() -> dispatcher.submit(() -> {}))
        .isInstanceOf(RejectedExecutionException.class);
  }
}
