/*
 * どこで: Chat Relay サービス層
 * 何を: 2 ユーザが相互マッチしているかを判定する
 * なぜ: 送信経路がマッチ判定の保存方式に依存しないようにするため
 */
package com.example.chat_relay.service;

public interface RelationshipGate {

  /**
   * 役割: a と b が現在マッチしているかを返す。
   * 動作: 呼び出しごとに最新の状態を読む。同一ユーザ同士は常に false。
   */
  boolean isMatched(String a, String b);
}
