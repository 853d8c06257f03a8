package com.example.chat_client;

import java.io.IOException;

/** 確立済みの 1 本の接続。 */
public interface ChatSession {

  boolean isOpen();

  void sendText(String payload) throws IOException;

  void close();
}
