package com.example.chat_client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ReconnectPolicyTest {

  @Test
  void defaultsUseFixedThreeSecondDelay() {
    final ReconnectPolicy policy = ReconnectPolicy.defaults();

    assertThat(policy.delayForAttempt(0)).isEqualTo(Duration.ofSeconds(3));
    assertThat(policy.delayForAttempt(5)).isEqualTo(Duration.ofSeconds(3));
  }

  @Test
  void backoffGrowsUntilCap() {
    final ReconnectPolicy policy =
        new ReconnectPolicy(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5));

    assertThat(policy.delayForAttempt(0)).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.delayForAttempt(1)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.delayForAttempt(2)).isEqualTo(Duration.ofSeconds(4));
    assertThat(policy.delayForAttempt(3)).isEqualTo(Duration.ofSeconds(5));
    assertThat(policy.delayForAttempt(30)).isEqualTo(Duration.ofSeconds(5));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThatThrownBy(() -> ReconnectPolicy.fixed(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new ReconnectPolicy(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(2)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(
            () -> new ReconnectPolicy(Duration.ofSeconds(3), 2.0, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
