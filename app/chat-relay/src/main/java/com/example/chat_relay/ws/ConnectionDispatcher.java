/*
 * どこで: Chat Relay WebSocket 受信
 * 何を: 1 接続分の受信フレームを共有プール上で順番に処理する
 * なぜ: 接続内の順序を保ちつつ、遅い永続化が他の接続を止めないようにするため
 */
package com.example.chat_relay.ws;

import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

public class ConnectionDispatcher {

  private final Executor sequentialExecutor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public ConnectionDispatcher(Executor sharedExecutor) {
    this.sequentialExecutor = MoreExecutors.newSequentialExecutor(sharedExecutor);
  }

  /**
   * 役割: タスクを接続内の順番で実行する。
   * 動作: 共有プールが飽和している場合は RejectedExecutionException を投げる。
   */
  public void submit(Runnable task) {
    if (closed.get()) {
      throw new RejectedExecutionException("dispatcher is closed");
    }
    sequentialExecutor.execute(task);
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** 以降のタスクは永続化前に破棄される。実行中のタスクは止めない。 */
  public void close() {
    closed.set(true);
  }
}
