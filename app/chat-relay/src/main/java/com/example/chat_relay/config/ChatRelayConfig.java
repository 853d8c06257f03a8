/*
 * どこで: Chat Relay 共通設定
 * 何を: Clock と受信フレーム処理用 Executor を DI 可能にする
 * なぜ: 時刻とスレッド資源を一箇所で差し替えられるようにするため
 */
package com.example.chat_relay.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ChatRelayConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(name = "chatDispatchExecutor")
  public ThreadPoolTaskExecutor chatDispatchExecutor(ChatDispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.corePoolSize());
    executor.setMaxPoolSize(properties.maxPoolSize());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix(properties.threadNamePrefix());
    // 停止時は処理中のフレームを待ってから閉じる
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
