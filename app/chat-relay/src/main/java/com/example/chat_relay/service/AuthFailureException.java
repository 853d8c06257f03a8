/*
 * どこで: Chat Relay 認証
 * 何を: 資格情報からユーザを解決できなかったことを表す例外
 * なぜ: ハンドシェイクと REST の両方で同じ拒否理由を扱うため
 */
package com.example.chat_relay.service;

public class AuthFailureException extends RuntimeException {

  public enum Reason {
    MISSING,
    MALFORMED,
    UNKNOWN_SESSION,
    EXPIRED
  }

  private final Reason reason;

  public AuthFailureException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthFailureException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
