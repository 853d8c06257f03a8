/*
 * どこで: chat-client 公開 API
 * 何を: 再接続付きの接続とフレーム変換をまとめて提供する
 * なぜ: 利用側が送信先と本文だけを扱えばよいようにするため
 */
package com.example.chat_client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.net.URI;
import java.time.Clock;
import org.springframework.scheduling.TaskScheduler;

public class ChatClient {

  private final ReconnectionSupervisor supervisor;
  private final ChatFrameCodec codec;

  public ChatClient(
      ChatTransport transport,
      TaskScheduler scheduler,
      ReconnectPolicy policy,
      ChatClientListener listener,
      ObjectMapper objectMapper) {
    this.codec = new ChatFrameCodec(objectMapper);
    this.supervisor =
        new ReconnectionSupervisor(
            transport,
            scheduler,
            policy,
            Clock.systemUTC(),
            payload -> codec.dispatch(payload, listener));
    this.supervisor.addListener(listener::onStateChanged);
  }

  /** Cookie 名は既定(SESSION)、再接続は固定 3 秒で組み立てる。 */
  public static ChatClient create(
      URI endpoint, String sessionId, TaskScheduler scheduler, ChatClientListener listener) {
    final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    return new ChatClient(
        new StandardWebSocketChatTransport(endpoint, sessionId),
        scheduler,
        ReconnectPolicy.defaults(),
        listener,
        objectMapper);
  }

  public void start() {
    supervisor.start();
  }

  public void stop() {
    supervisor.stop();
  }

  /** 未接続なら送らずに false。 */
  public boolean send(String to, String content) {
    return supervisor.send(codec.encodeMessage(to, content));
  }

  public ConnectivityState state() {
    return supervisor.state();
  }
}
