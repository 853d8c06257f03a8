/*
 * どこで: Chat Relay API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.chat_relay.api;

public enum ApiErrorCode {
    INVALID_REQUEST,
    UNAUTHORIZED,
    NOT_MATCHED,
    USER_NOT_FOUND,
    NOTIFICATION_NOT_FOUND,
    INTERNAL_ERROR
}
