/*
 * どこで: common のワイヤ定義
 * 何を: メッセージ単位のエラーフレーム
 * なぜ: 接続を維持したまま失敗理由だけを返すため
 */
package com.example.common.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorFrame(String error) {

  public static ErrorFrame of(ChatErrorCode code) {
    return new ErrorFrame(code.wireValue());
  }
}
