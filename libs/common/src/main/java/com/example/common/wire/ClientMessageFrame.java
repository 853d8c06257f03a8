/*
 * どこで: common のワイヤ定義
 * 何を: クライアントからサーバへ送るメッセージ送信フレーム
 * なぜ: 送信側と受信側で同一のペイロード形状を共有するため
 */
package com.example.common.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientMessageFrame(String type, String to, String content) {

  public static final String TYPE_MESSAGE = "message";

  public static ClientMessageFrame message(String to, String content) {
    return new ClientMessageFrame(TYPE_MESSAGE, to, content);
  }
}
