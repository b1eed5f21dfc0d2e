/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.macstab.oss.redis.coordination.CoordinationException;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.ConnectionPool;
import com.macstab.oss.redis.coordination.store.CompareAndDeleteResult;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Advisory, TTL-based mutual exclusion across processes sharing one store.
 *
 * <p><strong>Acquire:</strong> {@code SET <name>.lock <token> PX <timeout> NX}. On failure the
 * caller either gets "no lock" immediately ({@code wait = false}) or polls every {@code
 * retrySleep} until {@code timeout + retrySleep} has passed since the first attempt, then gets
 * {@link LockTimeoutException}. The polling thread sleeps without holding a pooled connection.
 *
 * <p><strong>Release:</strong> atomic compare-and-delete on the token. An expired key or a key
 * re-acquired by another holder is logged and left alone; neither is an error.
 *
 * <p><strong>Known limitation:</strong> the TTL is the only expiry mechanism and there is no
 * renewal. If protected work outlives the TTL, a second holder can acquire the lock while the
 * first is still running. Size the timeout for the worst-case critical section.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class DistributedLock {

  static final String KEY_SUFFIX = ".lock";

  private final ConnectionPool pool;
  private final LockTokenGenerator tokens;
  private final CoordinationMetrics metrics;
  @Getter private final Duration defaultTimeout;
  @Getter private final Duration defaultRetrySleep;

  public DistributedLock(
      @NonNull final ConnectionPool pool,
      @NonNull final LockTokenGenerator tokens,
      @NonNull final CoordinationMetrics metrics,
      @NonNull final Duration defaultTimeout,
      @NonNull final Duration defaultRetrySleep) {
    this.pool = pool;
    this.tokens = tokens;
    this.metrics = metrics;
    this.defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
    this.defaultRetrySleep = requirePositive(defaultRetrySleep, "defaultRetrySleep");
  }

  /** Waits for the lock with the default timeout and retry sleep. */
  public Optional<LockHandle> acquire(@NonNull final String name) {
    return acquire(name, true, defaultTimeout, defaultRetrySleep);
  }

  /** Single attempt, no waiting. Empty if someone else holds the lock. */
  public Optional<LockHandle> tryAcquire(@NonNull final String name, @NonNull final Duration ttl) {
    return acquire(name, false, ttl, defaultRetrySleep);
  }

  /**
   * Acquires the lock {@code name}.
   *
   * @param name lock name (the key is {@code name + ".lock"})
   * @param wait {@code false} for a single attempt
   * @param timeout lock TTL, and wait budget when {@code wait} is set
   * @param retrySleep pause between attempts
   * @return handle, or empty when {@code wait} is {@code false} and the lock is held
   * @throws LockTimeoutException if waiting exceeded {@code timeout + retrySleep}
   */
  public Optional<LockHandle> acquire(
      @NonNull final String name,
      final boolean wait,
      @NonNull final Duration timeout,
      @NonNull final Duration retrySleep) {

    requirePositive(timeout, "timeout");
    requirePositive(retrySleep, "retrySleep");

    final var key = keyFor(name);
    final var retryNanos = retrySleep.toNanos();
    final var deadline = System.nanoTime() + timeout.toNanos() + retryNanos;

    while (true) {
      final var token = tokens.nextToken();
      if (trySet(key, token, timeout)) {
        metrics.recordLockAcquisition(CoordinationMetrics.OUTCOME_ACQUIRED);
        if (log.isDebugEnabled()) {
          log.debug("Acquired lock {} (ttl {})", key, timeout);
        }
        return Optional.of(new LockHandle(key, token));
      }

      if (!wait) {
        metrics.recordLockAcquisition(CoordinationMetrics.OUTCOME_UNAVAILABLE);
        log.debug("Lock {} is held elsewhere", key);
        return Optional.empty();
      }

      final var remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        metrics.recordLockAcquisition(CoordinationMetrics.OUTCOME_TIMEOUT);
        throw new LockTimeoutException(name, timeout);
      }
      sleepNanos(Math.min(retryNanos, remaining));
    }
  }

  /**
   * Releases a lock if it is still ours.
   *
   * @param handle handle returned by an acquire
   * @return what happened; never throws for expired or foreign locks
   */
  public ReleaseOutcome release(@NonNull final LockHandle handle) {
    final var result =
        pool.withResource(c -> c.compareAndDelete(handle.getKey(), handle.getToken()));

    if (result.isEmpty()) {
      log.warn("Could not release lock {}: store unreachable, it will expire", handle.getKey());
      return ReleaseOutcome.UNREACHABLE;
    }

    if (result.get() == CompareAndDeleteResult.DELETED) {
      metrics.recordLockRelease(CoordinationMetrics.OUTCOME_RELEASED);
      log.debug("Released lock {}", handle.getKey());
      return ReleaseOutcome.RELEASED;
    }

    if (result.get() == CompareAndDeleteResult.ABSENT) {
      metrics.recordLockRelease(CoordinationMetrics.OUTCOME_EXPIRED);
      log.warn("Lock {} doesn't exist anymore (expired before release)", handle.getKey());
      return ReleaseOutcome.EXPIRED;
    }

    metrics.recordLockRelease(CoordinationMetrics.OUTCOME_STOLEN);
    log.warn(
        "Lock {} has a mismatched value (expired and re-acquired by another holder), not deleting",
        handle.getKey());
    return ReleaseOutcome.STOLEN;
  }

  /** Runs {@code action} under the lock with the default timeout and retry sleep. */
  public <T> T withLock(@NonNull final String name, @NonNull final Supplier<T> action) {
    return withLock(name, defaultTimeout, defaultRetrySleep, action);
  }

  /**
   * Waits for the lock, runs {@code action}, releases on every exit path.
   *
   * @throws LockTimeoutException if the lock could not be obtained in time
   */
  public <T> T withLock(
      @NonNull final String name,
      @NonNull final Duration timeout,
      @NonNull final Duration retrySleep,
      @NonNull final Supplier<T> action) {

    final var handle =
        acquire(name, true, timeout, retrySleep)
            .orElseThrow(() -> new LockTimeoutException(name, timeout));
    try {
      return action.get();
    } finally {
      release(handle);
    }
  }

  /** {@code true} if some holder currently has the lock {@code name}. */
  public boolean isLocked(@NonNull final String name) {
    return pool.withResource(c -> c.get(keyFor(name)).isPresent()).orElse(false);
  }

  static String keyFor(final String name) {
    return name + KEY_SUFFIX;
  }

  // ==================== Private Methods ====================

  private boolean trySet(final String key, final String token, final Duration ttl) {
    return pool.withResource(c -> c.set(key, token, ttl, true)).orElse(false);
  }

  private static void sleepNanos(final long nanos) {
    try {
      TimeUnit.NANOSECONDS.sleep(nanos);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CoordinationException("Interrupted while waiting for a lock", e);
    }
  }

  private static Duration requirePositive(final Duration value, final String name) {
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive, got: " + value);
    }
    return value;
  }
}
