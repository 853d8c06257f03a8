/*
 * どこで: Chat Relay API
 * 何を: 対象ユーザが存在しないこと(404)を表す例外を定義する
 * なぜ: 存在しない相手への like を明確に拒否するため
 */
package com.example.chat_relay.api;

public class UserNotFoundException extends RuntimeException {

    public UserNotFoundException(String message) {
        super(message);
    }
}
