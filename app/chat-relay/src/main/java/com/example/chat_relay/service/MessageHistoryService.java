/*
 * どこで: Chat Relay サービス層
 * 何を: マッチ済みの相手との会話履歴を返す
 * なぜ: 履歴の公開条件を送信時と同じマッチ判定に揃えるため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.api.NotMatchedException;
import com.example.chat_relay.model.MessageRecord;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageHistoryService {

  private final RelationshipGate relationshipGate;
  private final MessageStore messageStore;

  public List<MessageRecord> history(String ownerUserId, String peerUserId) {
    if (!relationshipGate.isMatched(ownerUserId, peerUserId)) {
      throw new NotMatchedException("not matched with " + peerUserId);
    }
    return messageStore.conversation(ownerUserId, peerUserId);
  }
}
