/*
 * どこで: Chat Relay API
 * 何を: 存在しない/他人の通知の既読化(404)を表す例外を定義する
 * なぜ: 他ユーザの通知の有無を漏らさないため
 */
package com.example.chat_relay.api;

public class NotificationNotFoundException extends RuntimeException {

    public NotificationNotFoundException(String message) {
        super(message);
    }
}
