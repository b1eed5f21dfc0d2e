/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.ratelimit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.ConnectionPool;
import com.macstab.oss.redis.coordination.testkit.InMemoryStore;
import com.macstab.oss.redis.coordination.testkit.MutableClock;

@DisplayName("RateLimiter")
class RateLimiterTest {

  private static final Duration MINUTE = Duration.ofMinutes(1);

  private MutableClock clock;
  private InMemoryStore store;
  private CoordinationMetrics metrics;
  private RateLimiter limiter;

  @BeforeEach
  void setUp() {
    // start of a window
    clock = new MutableClock(Instant.parse("2026-04-01T09:00:00Z"));
    store = new InMemoryStore(clock);
    metrics = mock(CoordinationMetrics.class);
    limiter = new RateLimiter(new ConnectionPool(store, 4), metrics, clock);
  }

  @Nested
  @DisplayName("Within a window")
  class WithinWindow {

    @Test
    @DisplayName("allows exactly limit calls, rejects the next")
    void allowsUpToLimit() {
      for (int i = 0; i < 3; i++) {
        limiter.allow("api", 3, MINUTE);
      }

      assertThatThrownBy(() -> limiter.allow("api", 3, MINUTE))
          .isInstanceOf(RateLimitExceededException.class)
          .hasMessageContaining("api")
          .hasMessageContaining("more than 3");
      verify(metrics, times(3)).recordRateLimitDecision(CoordinationMetrics.OUTCOME_ALLOWED);
      verify(metrics).recordRateLimitDecision(CoordinationMetrics.OUTCOME_REJECTED);
    }

    @Test
    @DisplayName("limit 0 rejects every call")
    void zeroLimit() {
      assertThat(limiter.tryAllow("closed", 0, MINUTE)).isFalse();
    }

    @Test
    @DisplayName("keys are independent")
    void independentKeys() {
      limiter.allow("user-1", 1, MINUTE);

      assertThat(limiter.tryAllow("user-2", 1, MINUTE)).isTrue();
      assertThat(limiter.tryAllow("user-1", 1, MINUTE)).isFalse();
    }

    @Test
    @DisplayName("counter key is rate.limit.<key>.<window> and expires with the window")
    void counterKey() {
      limiter.allow("api", 10, MINUTE);

      var window = clock.millis() / MINUTE.toMillis();
      var key = "rate.limit.api." + window;
      assertThat(store.peek(key)).contains("1");
      assertThat(store.ttlMillis(key)).isEqualTo(MINUTE.toMillis());
      assertThat(RateLimiter.keyFor("api", window)).isEqualTo(key);
    }
  }

  @Nested
  @DisplayName("Across windows")
  class AcrossWindows {

    @Test
    @DisplayName("a new window starts a fresh count")
    void freshWindow() {
      limiter.allow("api", 1, MINUTE);
      assertThat(limiter.tryAllow("api", 1, MINUTE)).isFalse();

      clock.advance(MINUTE);

      assertThat(limiter.tryAllow("api", 1, MINUTE)).isTrue();
    }

    @Test
    @DisplayName("a burst at the boundary may pass twice the limit")
    void boundaryBurst() {
      clock.advance(MINUTE.minusSeconds(1));
      var passed = 0;
      for (int i = 0; i < 5; i++) {
        passed += limiter.tryAllow("api", 5, MINUTE) ? 1 : 0;
      }

      clock.advance(Duration.ofSeconds(1));
      for (int i = 0; i < 5; i++) {
        passed += limiter.tryAllow("api", 5, MINUTE) ? 1 : 0;
      }

      assertThat(passed).isEqualTo(10);
    }
  }

  @Nested
  @DisplayName("Validation and failures")
  class ValidationAndFailures {

    @Test
    @DisplayName("rejects negative limit and sub-millisecond resolution")
    void rejectsInvalidArguments() {
      assertThatThrownBy(() -> limiter.tryAllow("api", -1, MINUTE))
          .isInstanceOf(IllegalArgumentException.class);
      assertThatThrownBy(() -> limiter.tryAllow("api", 1, Duration.ofNanos(10)))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("fails open when the store is unreachable")
    void failsOpen() {
      store.setAvailable(false);

      assertThat(limiter.tryAllow("api", 0, MINUTE)).isTrue();
    }
  }
}
