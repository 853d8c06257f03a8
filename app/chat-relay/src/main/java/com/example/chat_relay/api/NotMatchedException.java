/*
 * どこで: Chat Relay API
 * 何を: マッチしていない相手との会話参照(403)を表す例外を定義する
 * なぜ: マッチ済みの相手にだけ履歴を公開するため
 */
package com.example.chat_relay.api;

public class NotMatchedException extends RuntimeException {

    public NotMatchedException(String message) {
        super(message);
    }
}
