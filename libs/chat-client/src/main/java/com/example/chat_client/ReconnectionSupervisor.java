/*
 * どこで: chat-client 再接続
 * 何を: 接続が切れたら一定時間後に 1 回だけ再接続を予約する
 * なぜ: 同時に 2 本の接続を張らず、サーバ側の登録が常に 1 本に収束するようにするため
 */
package com.example.chat_client;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

public class ReconnectionSupervisor {

  private static final Logger logger = LoggerFactory.getLogger(ReconnectionSupervisor.class);
  // サーバが同じユーザの新しい接続に置き換えたときのクローズコード
  static final int CLOSE_CODE_REPLACED = 4000;

  private final ChatTransport transport;
  private final TaskScheduler scheduler;
  private final ReconnectPolicy policy;
  private final Clock clock;
  private final Consumer<String> inboundListener;
  private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

  // 以下は this のロック下でのみ読み書きする
  private ConnectivityState state = ConnectivityState.DISCONNECTED;
  private ChatSession currentSession;
  private ScheduledFuture<?> pendingAttempt;
  private int failedAttempts;
  private long generation;
  // 状態変化はロック下で積み、リスナーへはロック解放後に順に通知する
  private final Queue<StateChange> pendingChanges = new ArrayDeque<>();
  private boolean notifying;

  public ReconnectionSupervisor(
      ChatTransport transport,
      TaskScheduler scheduler,
      ReconnectPolicy policy,
      Clock clock,
      Consumer<String> inboundListener) {
    this.transport = transport;
    this.scheduler = scheduler;
    this.policy = policy;
    this.clock = clock;
    this.inboundListener = inboundListener;
  }

  public void addListener(ConnectivityListener listener) {
    listeners.add(listener);
  }

  public synchronized ConnectivityState state() {
    return state;
  }

  /** DISCONNECTED のときだけ接続を開始する。 */
  public void start() {
    synchronized (this) {
      if (state != ConnectivityState.DISCONNECTED) {
        return;
      }
      connect();
    }
    fireStateChanges();
  }

  /**
   * 役割: 接続中なら 1 フレーム送る。
   * 動作: 未接続時は送らずに false を返す(バッファや再送はしない)。
   */
  public boolean send(String payload) {
    final ChatSession session;
    synchronized (this) {
      if (state != ConnectivityState.CONNECTED || currentSession == null) {
        return false;
      }
      session = currentSession;
    }
    if (!session.isOpen()) {
      return false;
    }
    try {
      session.sendText(payload);
      return true;
    } catch (IOException ex) {
      logger.warn("send failed", ex);
      return false;
    }
  }

  public void stop() {
    final ChatSession session;
    synchronized (this) {
      if (state == ConnectivityState.STOPPED) {
        return;
      }
      generation++;
      cancelPending();
      session = currentSession;
      currentSession = null;
      transition(ConnectivityState.STOPPED);
    }
    fireStateChanges();
    if (session != null) {
      session.close();
    }
  }

  @VisibleForTesting
  synchronized boolean hasPendingAttempt() {
    return pendingAttempt != null && !pendingAttempt.isDone();
  }

  private void connect() {
    final long attemptGeneration = ++generation;
    transition(ConnectivityState.CONNECTING);
    transport
        .connect(new SupervisedHandler(attemptGeneration))
        .whenComplete((session, error) -> onConnectCompleted(attemptGeneration, session, error));
  }

  private void onConnectCompleted(long attemptGeneration, ChatSession session, Throwable error) {
    boolean discard = false;
    synchronized (this) {
      if (attemptGeneration != generation || state != ConnectivityState.CONNECTING) {
        // stop 済みか、より新しい試行に置き換わった
        discard = session != null;
      } else if (error != null) {
        logger.info("connect failed attempt={}", failedAttempts + 1, error);
        transition(ConnectivityState.DISCONNECTED);
        scheduleReconnect();
      } else {
        currentSession = session;
        failedAttempts = 0;
        transition(ConnectivityState.CONNECTED);
      }
    }
    fireStateChanges();
    if (discard) {
      session.close();
    }
  }

  private void onSessionClosed(long sessionGeneration, int closeCode) {
    synchronized (this) {
      if (sessionGeneration != generation || state == ConnectivityState.STOPPED) {
        return;
      }
      logger.info("connection closed code={}", closeCode);
      currentSession = null;
      transition(ConnectivityState.DISCONNECTED);
      // 置き換えられた側は自動では再接続しない
      if (closeCode != CLOSE_CODE_REPLACED) {
        scheduleReconnect();
      }
    }
    fireStateChanges();
  }

  private void scheduleReconnect() {
    if (pendingAttempt != null && !pendingAttempt.isDone()) {
      return;
    }
    final Duration delay = policy.delayForAttempt(failedAttempts++);
    logger.info("reconnect scheduled delay_ms={}", delay.toMillis());
    pendingAttempt = scheduler.schedule(this::attemptReconnect, Instant.now(clock).plus(delay));
  }

  private void attemptReconnect() {
    synchronized (this) {
      pendingAttempt = null;
      // 既に接続済み/接続中/停止済みなら何もしない
      if (state != ConnectivityState.DISCONNECTED) {
        return;
      }
      connect();
    }
    fireStateChanges();
  }

  private void cancelPending() {
    if (pendingAttempt != null) {
      pendingAttempt.cancel(false);
      pendingAttempt = null;
    }
  }

  private void transition(ConnectivityState next) {
    final ConnectivityState previous = state;
    if (previous == next) {
      return;
    }
    state = next;
    pendingChanges.add(new StateChange(previous, next));
  }

  /**
   * 役割: 積まれた状態変化をリスナーへ通知する。
   * 動作: 通知は 1 スレッドずつ行い、通知中に積まれた変化も同じスレッドが順に流す。
   * 前提: this のロックを保持したまま呼ばれた場合は何もせず、外側の呼び出しに任せる。
   */
  private void fireStateChanges() {
    if (Thread.holdsLock(this)) {
      return;
    }
    synchronized (this) {
      if (notifying) {
        return;
      }
      notifying = true;
    }
    boolean drained = false;
    try {
      while (true) {
        final StateChange change;
        synchronized (this) {
          change = pendingChanges.poll();
          if (change == null) {
            // 空を確認したのと同じロック内で解除し、直後に積まれた変化を取りこぼさない
            notifying = false;
            drained = true;
            return;
          }
        }
        for (ConnectivityListener listener : listeners) {
          listener.onStateChanged(change.previous(), change.next());
        }
      }
    } finally {
      if (!drained) {
        synchronized (this) {
          notifying = false;
        }
      }
    }
  }

  private record StateChange(ConnectivityState previous, ConnectivityState next) {}

  private final class SupervisedHandler implements ChatSessionHandler {

    private final long sessionGeneration;

    private SupervisedHandler(long sessionGeneration) {
      this.sessionGeneration = sessionGeneration;
    }

    @Override
    public void onText(ChatSession session, String payload) {
      inboundListener.accept(payload);
    }

    @Override
    public void onClosed(ChatSession session, int closeCode) {
      onSessionClosed(sessionGeneration, closeCode);
    }

    @Override
    public void onTransportError(ChatSession session, Throwable error) {
      logger.warn("transport error", error);
    }
  }
}
