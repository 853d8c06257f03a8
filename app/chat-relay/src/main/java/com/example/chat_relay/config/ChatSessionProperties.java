/*
 * どこで: Chat Relay アプリの設定バインド
 * 何を: セッション Cookie 名と TTL/掃除間隔を保持する
 * なぜ: Cookie 形式や期限を環境ごとに切替可能にするため
 */
package com.example.chat_relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat-relay.session")
public record ChatSessionProperties(
    String cookieName, Duration ttl, boolean cleanupEnabled, Duration cleanupInterval) {}
