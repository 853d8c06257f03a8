/*
 * どこで: Chat Relay サービス層
 * 何を: 送信結果/配信経路/接続数/like 結果/認証失敗のメトリクス記録を集約する
 * なぜ: 配信の健全性とマッチ遷移の頻度を運用で継続監視できるようにするため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.model.LikeOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ChatRelayMetrics {

  private static final String METRIC_MESSAGE_TOTAL = "chat.message.total";
  private static final String METRIC_DELIVERY_TOTAL = "chat.delivery.total";
  private static final String METRIC_CONNECTIONS_ACTIVE = "chat.connections.active";
  private static final String METRIC_LIKE_TOTAL = "chat.like.total";
  private static final String METRIC_AUTH_FAILURE_TOTAL = "chat.auth.failure.total";
  private static final String METRIC_NOTIFICATION_FAILURE_TOTAL = "chat.notification.failure.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeConnections = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter notificationFailureCounter;

  public ChatRelayMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CONNECTIONS_ACTIVE, activeConnections, AtomicInteger::get)
        .description("Currently registered live connections")
        .register(meterRegistry);
    this.notificationFailureCounter =
        Counter.builder(METRIC_NOTIFICATION_FAILURE_TOTAL)
            .description("Offline notifications that could not be stored")
            .register(meterRegistry);
  }

  /** result は ack または拒否理由のワイヤ値(NotMatched など)。 */
  public void recordMessage(String result) {
    increment(METRIC_MESSAGE_TOTAL, "Inbound chat messages by result", "result", result);
  }

  public void recordDelivery(DeliveryPath path) {
    increment(
        METRIC_DELIVERY_TOTAL, "Persisted messages by delivery path", "path", path.tagValue());
  }

  public void recordLike(LikeOutcome outcome) {
    increment(
        METRIC_LIKE_TOTAL,
        "Like operations by outcome",
        "outcome",
        outcome.name().toLowerCase(Locale.ROOT));
  }

  public void recordAuthFailure(AuthFailureException.Reason reason) {
    increment(
        METRIC_AUTH_FAILURE_TOTAL,
        "Rejected credentials by reason",
        "reason",
        reason.name().toLowerCase(Locale.ROOT));
  }

  public void recordNotificationFailure() {
    notificationFailureCounter.increment();
  }

  public void updateActiveConnections(int count) {
    activeConnections.set(Math.max(count, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + ":" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
