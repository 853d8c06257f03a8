/*
 * どこで: Chat Relay API
 * 何を: マッチ相手との会話履歴を返すエンドポイントを提供する
 * なぜ: 再接続後にオフライン中のメッセージを取り直せるようにするため
 */
package com.example.chat_relay.api;

import com.example.chat_relay.config.SessionAuthenticationInterceptor;
import com.example.chat_relay.service.MessageHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
public class MessageHistoryController {

  private final MessageHistoryService messageHistoryService;

  @GetMapping("/{peer_id}/messages")
  public MessageHistoryResponse history(
      @RequestAttribute(SessionAuthenticationInterceptor.ATTRIBUTE_USER_ID) String userId,
      @PathVariable("peer_id") String peerId) {
    return new MessageHistoryResponse(
        peerId,
        messageHistoryService.history(userId, peerId).stream().map(MessageSummary::from).toList());
  }
}
