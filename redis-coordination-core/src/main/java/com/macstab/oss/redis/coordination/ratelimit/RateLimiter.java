/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.ratelimit;

import java.time.Clock;
import java.time.Duration;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.ConnectionPool;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-window rate limiting shared by every process using the same store.
 *
 * <p>The window is {@code floor(now / resolution)}; its counter lives under {@code
 * rate.limit.<baseKey>.<window>} and expires after {@code resolution}. Each call increments first
 * (INCR + PEXPIRE in one transaction) and is rejected when the new count exceeds {@code limit},
 * so concurrent callers can never be admitted beyond the limit within one window.
 *
 * <p>Windows are disjoint: a burst straddling a boundary may pass up to {@code 2 × limit} calls
 * across the two windows.
 *
 * <p>When the store is unreachable the call is allowed (fail open); the pool logs the failure.
 */
@Slf4j
public final class RateLimiter {

  static final String KEY_PREFIX = "rate.limit.";

  private final ConnectionPool pool;
  private final CoordinationMetrics metrics;
  private final Clock clock;

  public RateLimiter(
      @NonNull final ConnectionPool pool,
      @NonNull final CoordinationMetrics metrics,
      @NonNull final Clock clock) {
    this.pool = pool;
    this.metrics = metrics;
    this.clock = clock;
  }

  /**
   * Counts one call against {@code baseKey}.
   *
   * @param baseKey what is being limited (user id, endpoint, ...)
   * @param limit calls allowed per window
   * @param resolution window length
   * @throws RateLimitExceededException if this call is beyond {@code limit} in the current window
   */
  public void allow(
      @NonNull final String baseKey, final long limit, @NonNull final Duration resolution) {
    if (!tryAllow(baseKey, limit, resolution)) {
      throw new RateLimitExceededException(baseKey, limit, resolution);
    }
  }

  /**
   * Same as {@link #allow(String, long, Duration)} but reports rejection as {@code false}.
   *
   * @return {@code true} if the call is within the limit
   */
  public boolean tryAllow(
      @NonNull final String baseKey, final long limit, @NonNull final Duration resolution) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
    }
    final var resolutionMillis = resolution.toMillis();
    if (resolutionMillis <= 0) {
      throw new IllegalArgumentException("resolution must be at least 1ms, got: " + resolution);
    }

    final var key = keyFor(baseKey, clock.millis() / resolutionMillis);
    final var count = pool.withResource(c -> c.incrementWithExpiry(key, resolution));

    if (count.isEmpty()) {
      log.warn("Rate limit store unreachable for {}, allowing call", baseKey);
      metrics.recordRateLimitDecision(CoordinationMetrics.OUTCOME_ALLOWED);
      return true;
    }

    if (count.get() > limit) {
      metrics.recordRateLimitDecision(CoordinationMetrics.OUTCOME_REJECTED);
      log.warn(
          "Rate limit exceeded for {} ({} > {} per {})", baseKey, count.get(), limit, resolution);
      return false;
    }

    metrics.recordRateLimitDecision(CoordinationMetrics.OUTCOME_ALLOWED);
    if (log.isTraceEnabled()) {
      log.trace("Rate limit {} at {}/{}", key, count.get(), limit);
    }
    return true;
  }

  static String keyFor(final String baseKey, final long window) {
    return KEY_PREFIX + baseKey + '.' + window;
  }
}
