package com.example.chat_client;

/** クライアント側から見た接続状態。 */
public enum ConnectivityState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  // stop 後は再接続しない
  STOPPED
}
