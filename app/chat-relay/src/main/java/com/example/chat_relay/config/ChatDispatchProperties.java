/*
 * どこで: Chat Relay アプリの設定バインド
 * 何を: 受信フレーム処理用スレッドプールの設定を保持する
 * なぜ: 永続化の遅延が他接続へ波及しないよう容量を調整可能にするため
 */
package com.example.chat_relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat-relay.dispatch")
public record ChatDispatchProperties(
    int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {}
