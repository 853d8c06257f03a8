/*
 * どこで: chat-client 再接続
 * 何を: 再接続までの待ち時間を決める
 * なぜ: 既定の固定 3 秒に加え、上限付きの指数バックオフへ切り替えられるようにするため
 */
package com.example.chat_client;

import java.time.Duration;

public record ReconnectPolicy(Duration initialDelay, double multiplier, Duration maxDelay) {

  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(3);

  public ReconnectPolicy {
    if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
      throw new IllegalArgumentException("initialDelay must be positive");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
    if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= initialDelay");
    }
  }

  public static ReconnectPolicy fixed(Duration delay) {
    return new ReconnectPolicy(delay, 1.0, delay);
  }

  public static ReconnectPolicy defaults() {
    return fixed(DEFAULT_DELAY);
  }

  /** attempt は直前の接続成功からの失敗回数(0 始まり)。 */
  public Duration delayForAttempt(int attempt) {
    if (multiplier == 1.0 || attempt <= 0) {
      return initialDelay;
    }
    final double scaled = initialDelay.toMillis() * Math.pow(multiplier, attempt);
    if (scaled >= maxDelay.toMillis()) {
      return maxDelay;
    }
    return Duration.ofMillis((long) scaled);
  }
}
