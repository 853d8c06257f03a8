package com.example.chat_client;

import com.example.common.wire.AckFrame;
import com.example.common.wire.ChatErrorCode;
import com.example.common.wire.DeliveredMessageFrame;

/** ChatClient のコールバック。必要なものだけ実装すればよい。 */
public interface ChatClientListener {

  default void onMessage(DeliveredMessageFrame message) {}

  default void onAck(AckFrame ack) {}

  default void onError(ChatErrorCode error) {}

  default void onStateChanged(ConnectivityState previous, ConnectivityState current) {}
}
