/*
 * どこで: Chat Relay サービス補助
 * 何を: 正規化したユーザ対から 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.example.chat_relay.service;

import com.example.chat_relay.model.UserPair;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class PairLockKeyGenerator {

  static final int LOCK_KEY_BYTES = 8;
  private static final String LOCK_NAMESPACE = "relationship:";

  public long generate(UserPair pair) {
    // A→B と B→A は UserPair の正規化で同じキーになる
    final byte[] hashed = hash(LOCK_NAMESPACE + pair.lockKey());
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}
