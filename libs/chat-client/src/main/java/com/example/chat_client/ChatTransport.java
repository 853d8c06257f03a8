/*
 * どこで: chat-client トランスポート
 * 何を: サーバへの接続を 1 本張る
 * なぜ: 再接続の判断を WebSocket 実装から切り離してテスト可能にするため
 */
package com.example.chat_client;

import java.util.concurrent.CompletableFuture;

public interface ChatTransport {

  /**
   * 役割: 新しい接続を開始する。
   * 動作: 確立すれば ChatSession で完了し、ハンドシェイク拒否や到達不能なら例外で完了する。
   */
  CompletableFuture<ChatSession> connect(ChatSessionHandler handler);
}
