/*
 * どこで: common のワイヤ定義
 * 何を: サーバから受信者へライブ配信するメッセージフレーム
 * なぜ: date を ISO-8601 文字列で固定し、クライアント実装の差を吸収するため
 */
package com.example.common.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DeliveredMessageFrame(String type, String from, String content, String date) {

  public static final String TYPE_MESSAGE = "message";

  public static DeliveredMessageFrame of(String from, String content, String date) {
    return new DeliveredMessageFrame(TYPE_MESSAGE, from, content, date);
  }
}
