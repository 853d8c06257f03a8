/*
 * どこで: common のワイヤ定義
 * 何を: 永続化完了を送信者へ知らせる受領フレーム
 * なぜ: 送信者が「保存済み」を確定的に判断できるようにするため
 */
package com.example.common.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AckFrame(String type, String to, String date) {

  public static final String TYPE_ACK = "ack";

  public static AckFrame of(String to, String date) {
    return new AckFrame(TYPE_ACK, to, date);
  }
}
