/*
 * どこで: Chat Relay API
 * 何を: 自分自身への like など不正な関係操作(400)を表す例外を定義する
 * なぜ: 状態遷移に入る前の入力誤りを区別するため
 */
package com.example.chat_relay.api;

public class InvalidRelationshipRequestException extends RuntimeException {

    public InvalidRelationshipRequestException(String message) {
        super(message);
    }
}
