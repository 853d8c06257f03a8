/*
 * どこで: Chat Relay 認証
 * 何を: 接続時の資格情報をユーザ ID へ解決する
 * なぜ: Cookie セッション以外の方式へ差し替えられるようにするため
 */
package com.example.chat_relay.service;

public interface IdentityResolver {

  /**
   * 役割: 資格情報を検証し、対応するユーザ ID を返す。
   * 動作: 解決できない場合は理由付きの {@link AuthFailureException} を投げる。
   * 前提: credential は null 可(未提示として扱う)。
   */
  String resolve(String credential);
}
