package com.example.chat_relay.service;

/** 永続化済みメッセージが受信者へ届いた経路。 */
public enum DeliveryPath {
  LIVE("live"),
  OFFLINE("offline"),
  // ライブ送信に失敗して通知へ切り替えた
  LIVE_FAILED("live_failed");

  private final String tagValue;

  DeliveryPath(String tagValue) {
    this.tagValue = tagValue;
  }

  public String tagValue() {
    return tagValue;
  }
}
