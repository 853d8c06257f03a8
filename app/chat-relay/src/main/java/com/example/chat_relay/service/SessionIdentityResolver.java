/*
 * どこで: Chat Relay 認証
 * 何を: セッション Cookie の値を user_sessions から解決する
 * なぜ: 失効/削除されたセッションを接続のたびに確実に拒否するため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.model.SessionRecord;
import com.example.chat_relay.repository.SessionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionIdentityResolver implements IdentityResolver {

  private final SessionRepository sessionRepository;
  private final ChatRelayMetrics metrics;
  private final Clock clock;

  @Override
  public String resolve(String credential) {
    if (credential == null || credential.isBlank()) {
      throw fail(AuthFailureException.Reason.MISSING, "session credential is missing", null);
    }
    final UUID sessionId;
    try {
      sessionId = UUID.fromString(credential.trim());
    } catch (IllegalArgumentException ex) {
      throw fail(AuthFailureException.Reason.MALFORMED, "session credential is malformed", ex);
    }
    // キャッシュせず毎回 DB を読む
    final SessionRecord session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(
                () -> fail(AuthFailureException.Reason.UNKNOWN_SESSION, "session is unknown", null));
    if (session.isExpiredAt(Instant.now(clock))) {
      throw fail(AuthFailureException.Reason.EXPIRED, "session is expired", null);
    }
    return session.userId();
  }

  private AuthFailureException fail(
      AuthFailureException.Reason reason, String message, Throwable cause) {
    metrics.recordAuthFailure(reason);
    return cause == null
        ? new AuthFailureException(reason, message)
        : new AuthFailureException(reason, message, cause);
  }
}
