package com.example.chat_client;

/** トランスポートから受け取るイベント。呼び出しスレッドはトランスポート実装に依存する。 */
public interface ChatSessionHandler {

  void onText(ChatSession session, String payload);

  void onClosed(ChatSession session, int closeCode);

  void onTransportError(ChatSession session, Throwable error);
}
