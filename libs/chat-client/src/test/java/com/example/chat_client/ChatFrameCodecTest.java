package com.example.chat_client;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.wire.AckFrame;
import com.example.common.wire.ChatErrorCode;
import com.example.common.wire.DeliveredMessageFrame;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChatFrameCodecTest {

  private final ChatFrameCodec codec = new ChatFrameCodec(new ObjectMapper());
  private final RecordingListener listener = new RecordingListener();

  @Test
  void encodesOutboundMessageFrame() {
    assertThat(codec.encodeMessage("bob", "hi"))
        .isEqualTo("{\"type\":\"message\",\"to\":\"bob\",\"content\":\"hi\"}");
  }

  @Test
  void dispatchesServerFramesByKind() {
    assertThat(
            codec.dispatch(
                "{\"type\":\"message\",\"from\":\"alice\",\"content\":\"hi\",\"date\":\"2026-01-17T00:00:00Z\"}",
                listener))
        .isTrue();
    assertThat(codec.dispatch("{\"type\":\"ack\",\"to\":\"bob\",\"date\":\"2026-01-17T00:00:00Z\"}", listener))
        .isTrue();
    assertThat(codec.dispatch("{\"error\":\"NotMatched\"}", listener)).isTrue();

    assertThat(listener.messages)
        .containsExactly(DeliveredMessageFrame.of("alice", "hi", "2026-01-17T00:00:00Z"));
    assertThat(listener.acks).containsExactly(AckFrame.of("bob", "2026-01-17T00:00:00Z"));
    assertThat(listener.errors).containsExactly(ChatErrorCode.NOT_MATCHED);
  }

  @Test
  void ignoresUnknownOrBrokenFrames() {
    assertThat(codec.dispatch("not json", listener)).isFalse();
    assertThat(codec.dispatch("[1,2]", listener)).isFalse();
    assertThat(codec.dispatch("{\"type\":\"presence\"}", listener)).isFalse();
    assertThat(codec.dispatch("{\"error\":\"Teapot\"}", listener)).isFalse();

    assertThat(listener.messages).isEmpty();
    assertThat(listener.acks).isEmpty();
    assertThat(listener.errors).isEmpty();
  }

  private static final class RecordingListener implements ChatClientListener {
    private final List<DeliveredMessageFrame> messages = new ArrayList<>();
    private final List<AckFrame> acks = new ArrayList<>();
    private final List<ChatErrorCode> errors = new ArrayList<>();

    @Override
    public void onMessage(DeliveredMessageFrame message) {
      messages.add(message);
    }

    @Override
    public void onAck(AckFrame ack) {
      acks.add(ack);
    }

    @Override
    public void onError(ChatErrorCode error) {
      errors.add(error);
    }
  }
}
