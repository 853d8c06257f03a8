package com.example.chat_relay.connection;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/** 送信内容とクローズ理由を記録するテスト用の接続。 */
public class FakeChatConnection implements ChatConnection {

  private final String connectionId = UUID.randomUUID().toString();
  private final String userId;
  private final List<String> sent = new CopyOnWriteArrayList<>();
  private volatile ConnectionCloseReason closedWith;
  private volatile boolean failOnSend;
  private volatile RuntimeException sendFailure;

  public FakeChatConnection(String userId) {
    this.userId = userId;
  }

  @Override
  public String connectionId() {
    return connectionId;
  }

  @Override
  public String userId() {
    return userId;
  }

  @Override
  public void send(String payload) throws IOException {
    if (failOnSend) {
      throw new IOException("broken pipe");
    }
    if (sendFailure != null) {
      throw sendFailure;
    }
    sent.add(payload);
  }

  @Override
  public void close(ConnectionCloseReason reason) {
    closedWith = reason;
  }

  @Override
  public boolean isOpen() {
    return closedWith == null;
  }

  public List<String> sent() {
    return List.copyOf(sent);
  }

  public ConnectionCloseReason closedWith() {
    return closedWith;
  }

  public void failOnSend() {
    this.failOnSend = true;
  }

  public void failOnSend(RuntimeException failure) {
    this.sendFailure = failure;
  }
}
