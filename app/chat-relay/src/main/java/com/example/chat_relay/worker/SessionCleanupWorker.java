/*
 * どこで: Chat Relay ワーカー
 * 何を: 期限切れセッションを定期的に削除する
 * なぜ: user_sessions の肥大化を防ぐため
 */
package com.example.chat_relay.worker;

import com.example.chat_relay.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    prefix = "chat-relay.session",
    name = "cleanup-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SessionCleanupWorker {

  private static final Logger logger = LoggerFactory.getLogger(SessionCleanupWorker.class);

  private final SessionService sessionService;

  @Scheduled(fixedDelayString = "${chat-relay.session.cleanup-interval:PT10M}")
  public void purgeExpired() {
    try {
      sessionService.purgeExpired();
    } catch (DataAccessException ex) {
      // 次回の実行で再試行する
      logger.warn("session cleanup failed", ex);
    }
  }
}
