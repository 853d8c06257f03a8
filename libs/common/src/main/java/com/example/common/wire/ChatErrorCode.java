/*
 * どこで: common のワイヤ定義
 * 何を: WebSocket エラーフレームで返すエラーコードを定義する
 * なぜ: サーバとクライアントで同一の文字列表現を共有するため
 */
package com.example.common.wire;

public enum ChatErrorCode {
  INVALID_FORMAT("InvalidFormat"),
  NOT_MATCHED("NotMatched"),
  PERSISTENCE_FAILED("PersistenceFailed"),
  SERVER_BUSY("ServerBusy"),
  INTERNAL_ERROR("InternalError");

  private final String wireValue;

  ChatErrorCode(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }

  /**
   * 役割: 受信したエラー文字列を列挙型へ変換する。
   * 動作: 完全一致で判定し、未知の値は IllegalArgumentException を送出する。
   */
  public static ChatErrorCode fromWireValue(String value) {
    for (ChatErrorCode code : values()) {
      if (code.wireValue.equals(value)) {
        return code;
      }
    }
    throw new IllegalArgumentException("unsupported chat error code: " + value);
  }
}
