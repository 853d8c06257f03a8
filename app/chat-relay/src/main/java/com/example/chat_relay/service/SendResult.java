/*
 * どこで: Chat Relay サービス層
 * 何を: 1 件の送信要求に対するルータの判定結果
 * なぜ: 受領/拒否/破棄をトランスポートに依存しない形で返すため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.model.MessageRecord;
import com.example.common.wire.ChatErrorCode;

public record SendResult(Status status, ChatErrorCode error, MessageRecord message) {

  public enum Status {
    ACK,
    REJECTED,
    // 送信元の接続が永続化前に閉じた
    DROPPED
  }

  public static SendResult ack(MessageRecord message) {
    return new SendResult(Status.ACK, null, message);
  }

  public static SendResult rejected(ChatErrorCode error) {
    return new SendResult(Status.REJECTED, error, null);
  }

  public static SendResult dropped() {
    return new SendResult(Status.DROPPED, null, null);
  }

  public boolean acknowledged() {
    return status == Status.ACK;
  }
}
