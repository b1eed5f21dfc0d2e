/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReconnectPolicy")
class ReconnectPolicyTest {

  @Test
  @DisplayName("defaults are 10 attempts, 1s base, 1m cap")
  void defaults() {
    var policy = ReconnectPolicy.defaults();

    assertThat(policy.getMaxAttempts()).isEqualTo(10);
    assertThat(policy.getBaseSleep()).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.getMaxSleep()).isEqualTo(Duration.ofMinutes(1));
  }

  @Nested
  @DisplayName("Backoff")
  class Backoff {

    @Test
    @DisplayName("doubles per attempt")
    void doubles() {
      var policy = ReconnectPolicy.defaults();

      assertThat(policy.delayFor(0)).isEqualTo(Duration.ofSeconds(1));
      assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
      assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("is capped at the maximum sleep")
    void capped() {
      var policy = ReconnectPolicy.defaults();

      assertThat(policy.delayFor(6)).isEqualTo(Duration.ofMinutes(1));
      assertThat(policy.delayFor(61)).isEqualTo(Duration.ofMinutes(1));
      assertThat(policy.delayFor(1_000)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("zero base sleep means no delay")
    void zeroBase() {
      var policy = ReconnectPolicy.builder().baseSleep(Duration.ZERO).build();

      assertThat(policy.delayFor(5)).isEqualTo(Duration.ZERO);
    }
  }

  @Test
  @DisplayName("is exhausted at the maximum attempt count")
  void exhausted() {
    var policy = ReconnectPolicy.builder().maxAttempts(3).build();

    assertThat(policy.isExhausted(2)).isFalse();
    assertThat(policy.isExhausted(3)).isTrue();
  }
}
