/*
 * どこで: Chat Relay API
 * 何を: ルートの簡易ヘルスレスポンスを返す
 * なぜ: 認証なしで生存確認できるようにするため
 */
package com.example.chat_relay.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  @GetMapping("/")
  public String home() {
    return "chat-relay: ok";
  }
}
