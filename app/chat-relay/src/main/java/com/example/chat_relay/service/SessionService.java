/*
 * どこで: Chat Relay サービス層
 * 何を: セッションの発行/失効/期限切れ掃除を担う
 * なぜ: 接続認証が参照するセッション台帳を一箇所で管理するため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.config.ChatSessionProperties;
import com.example.chat_relay.model.SessionRecord;
import com.example.chat_relay.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionService {

  private static final Logger logger = LoggerFactory.getLogger(SessionService.class);

  private final SessionRepository sessionRepository;
  private final ChatSessionProperties sessionProperties;
  private final Clock clock;

  /**
   * 役割: ログイン処理がユーザに発行するセッションを作成する。
   * 動作: 有効期限は設定の TTL から決まる。
   * 前提: ログイン処理はこのサービスの外にあり、このメソッドがその呼び出し口になる。userId は users に存在すること。
   */
  public SessionRecord createSession(String userId) {
    final Instant now = Instant.now(clock);
    final SessionRecord record =
        new SessionRecord(UUID.randomUUID(), userId, now, now.plus(sessionProperties.ttl()));
    sessionRepository.insert(record);
    logger.info("session created user_id={} expires_at={}", userId, record.expiresAt());
    return record;
  }

  /**
   * 役割: ログアウト時にセッションを失効させる。
   * 動作: 削除できた場合のみ true を返す。確立済みの WebSocket 接続は切断しない。
   * 前提: ログイン処理側のログアウトから呼ばれる。
   */
  public boolean deleteSession(UUID sessionId) {
    return sessionRepository.deleteById(sessionId) > 0;
  }

  public int purgeExpired() {
    final int deleted = sessionRepository.deleteExpired(Instant.now(clock));
    if (deleted > 0) {
      logger.info("expired sessions purged count={}", deleted);
    }
    return deleted;
  }
}
