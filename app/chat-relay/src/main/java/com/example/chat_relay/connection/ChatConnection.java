/*
 * どこで: Chat Relay 接続管理
 * 何を: 認証済みユーザの 1 本の双方向接続を表す
 * なぜ: 登録/配信のロジックをトランスポート実装から切り離すため
 */
package com.example.chat_relay.connection;

import java.io.IOException;

public interface ChatConnection {

  String connectionId();

  String userId();

  /**
   * 役割: テキストフレームを 1 件送る。
   * 動作: 送信できなかった場合は IOException を投げる(再送はしない)。
   */
  void send(String payload) throws IOException;

  /** 既に閉じていれば何もしない。 */
  void close(ConnectionCloseReason reason);

  boolean isOpen();
}
