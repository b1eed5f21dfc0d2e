/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

import com.macstab.oss.redis.coordination.lock.DistributedLock;
import com.macstab.oss.redis.coordination.lock.LockTimeoutException;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.PooledStore;
import com.macstab.oss.redis.coordination.store.ValueCodec;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache-aside read-through with single-flight recomputation.
 *
 * <p><strong>Flow:</strong>
 *
 * <ol>
 *   <li>Read {@code key}. Hit: return it, no lock taken.
 *   <li>Miss: wait for the lock {@code key} (timeout {@code lockWait}, poll {@code lockWait/100}).
 *   <li>Under the lock, read again: a concurrent holder may just have filled it.
 *   <li>Still absent: compute, store with {@code ttl} unless the result is {@code null}, return.
 * </ol>
 *
 * <p>The lock is released on every path, including a throwing computation (the exception
 * propagates). A caller that times out waiting for the lock gets an empty result, not an error.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class CacheGuard {

  private static final Duration MIN_RETRY_SLEEP = Duration.ofMillis(1);

  private final PooledStore store;
  private final DistributedLock lock;
  private final ValueCodec codec;
  private final CoordinationMetrics metrics;

  public CacheGuard(
      @NonNull final PooledStore store,
      @NonNull final DistributedLock lock,
      @NonNull final ValueCodec codec,
      @NonNull final CoordinationMetrics metrics) {
    this.store = store;
    this.lock = lock;
    this.codec = codec;
    this.metrics = metrics;
  }

  /**
   * String variant of {@link #getOrCompute(String, Duration, Duration, Class, Supplier)}.
   *
   * @return cached or computed value; empty if the computation returned {@code null} or the lock
   *     wait timed out
   */
  public Optional<String> getOrCompute(
      @NonNull final String key,
      @NonNull final Duration ttl,
      @NonNull final Duration lockWait,
      @NonNull final Supplier<String> compute) {
    return getOrCompute(key, ttl, lockWait, String.class, compute);
  }

  /**
   * Returns the cached value of {@code key}, computing and caching it at most once per contention
   * window.
   *
   * @param key cache key (also the lock name)
   * @param ttl expiry of the cached value
   * @param lockWait how long to wait for a concurrent computation
   * @param type value type; non-string values are cached as JSON
   * @param compute value source, called with the lock held
   * @return cached or computed value; empty if the computation returned {@code null} or the lock
   *     wait timed out
   */
  public <T> Optional<T> getOrCompute(
      @NonNull final String key,
      @NonNull final Duration ttl,
      @NonNull final Duration lockWait,
      @NonNull final Class<T> type,
      @NonNull final Supplier<? extends T> compute) {

    final var cached = store.get(key);
    if (cached.isPresent()) {
      metrics.recordCacheLookup(CoordinationMetrics.RESULT_HIT);
      log.trace("Cache hit for {}", key);
      return Optional.ofNullable(codec.decode(cached.get(), type));
    }

    metrics.recordCacheLookup(CoordinationMetrics.RESULT_MISS);
    log.debug("Cache miss for {}", key);

    try {
      final T value =
          lock.withLock(
              key,
              lockWait,
              retrySleepFor(lockWait),
              () -> loadUnderLock(key, ttl, type, compute));
      return Optional.ofNullable(value);
    } catch (final LockTimeoutException e) {
      metrics.recordCacheLookup(CoordinationMetrics.RESULT_TIMEOUT);
      log.warn("Gave up waiting {} for concurrent computation of {}", lockWait, key);
      return Optional.empty();
    }
  }

  /** Removes a cached value. */
  public boolean invalidate(@NonNull final String key) {
    return store.delete(key);
  }

  private <T> T loadUnderLock(
      final String key,
      final Duration ttl,
      final Class<T> type,
      final Supplier<? extends T> compute) {

    final var current = store.get(key);
    if (current.isPresent()) {
      metrics.recordCacheLookup(CoordinationMetrics.RESULT_HIT);
      log.debug("{} was filled while waiting for the lock", key);
      return codec.decode(current.get(), type);
    }

    final T value = compute.get();
    if (value == null) {
      log.debug("Computation for {} returned nothing, not caching", key);
      return null;
    }

    store.set(key, value, ttl);
    metrics.recordCacheLookup(CoordinationMetrics.RESULT_COMPUTED);
    return value;
  }

  static Duration retrySleepFor(final Duration lockWait) {
    final var sleep = lockWait.dividedBy(100);
    return sleep.compareTo(MIN_RETRY_SLEEP) < 0 ? MIN_RETRY_SLEEP : sleep;
  }
}
