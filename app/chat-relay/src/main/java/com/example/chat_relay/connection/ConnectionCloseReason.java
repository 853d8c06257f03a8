package com.example.chat_relay.connection;

/** サーバ側から接続を閉じる理由と WebSocket クローズコード。 */
public enum ConnectionCloseReason {
  REPLACED(4000, "replaced"),
  SERVER_SHUTDOWN(1001, "server shutdown");

  private final int code;
  private final String reason;

  ConnectionCloseReason(int code, String reason) {
    this.code = code;
    this.reason = reason;
  }

  public int code() {
    return code;
  }

  public String reason() {
    return reason;
  }
}
