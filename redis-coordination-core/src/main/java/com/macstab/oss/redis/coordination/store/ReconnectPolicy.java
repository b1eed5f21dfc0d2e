/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.time.Duration;

import lombok.Builder;
import lombok.Value;

/**
 * Exponential reconnect backoff: {@code min(baseSleep × 2^attempt, maxSleep)}, up to {@code
 * maxAttempts} attempts.
 *
 * <pre>
 * base=1s, max=1m:  attempt 1 → 2s, 2 → 4s, 3 → 8s, ... 5 → 32s, 6+ → 60s
 * </pre>
 */
@Value
@Builder(toBuilder = true)
public class ReconnectPolicy {

  @Builder.Default int maxAttempts = 10;

  @Builder.Default Duration baseSleep = Duration.ofSeconds(1);

  @Builder.Default Duration maxSleep = Duration.ofMinutes(1);

  public static ReconnectPolicy defaults() {
    return builder().build();
  }

  /**
   * Delay before the given attempt.
   *
   * @param attempt attempt number (1-based as reported by the client; 0 yields the base delay)
   * @return backoff delay, never above {@code maxSleep}
   */
  public Duration delayFor(final long attempt) {
    final var baseMillis = baseSleep.toMillis();
    final var maxMillis = maxSleep.toMillis();
    if (baseMillis <= 0) {
      return Duration.ZERO;
    }
    if (attempt >= 62) {
      return maxSleep;
    }
    final var factor = 1L << Math.max(attempt, 0);
    final var scaled =
        baseMillis > Long.MAX_VALUE / factor ? Long.MAX_VALUE : baseMillis * factor;
    return Duration.ofMillis(Math.min(scaled, maxMillis));
  }

  /** {@code true} once {@code attempt} is at or beyond the configured maximum. */
  public boolean isExhausted(final long attempt) {
    return attempt >= maxAttempts;
  }
}
