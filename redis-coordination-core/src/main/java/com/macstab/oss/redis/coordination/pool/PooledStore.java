/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pool;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.macstab.oss.redis.coordination.store.ValueCodec;

import lombok.Getter;
import lombok.NonNull;

/**
 * Key-value facade that runs every operation on a pooled connection.
 *
 * <p>Each call is one {@link ConnectionPool#withResource} scope. A store failure is logged by the
 * pool and shows up here as an empty result: {@code Optional.empty()}, {@code false}, {@code 0},
 * or an empty collection. Non-string values are written as JSON through the {@link ValueCodec}.
 *
 * <p>The blocking pops keep their pooled connection for the whole wait, so their timeout has to
 * stay below the client's command timeout; a longer wait ends as an empty result.
 *
 * <pre>{@code
 * store.set("greeting", "hello", Duration.ofMinutes(5));
 * store.priorityAdd("jobs", job, Priority.HIGH);
 * Optional<Job> next = store.priorityPop("jobs").map(json -> codec.decode(json, Job.class));
 * }</pre>
 */
public final class PooledStore {

  @Getter private final ConnectionPool pool;
  private final ValueCodec codec;

  public PooledStore(@NonNull final ConnectionPool pool, @NonNull final ValueCodec codec) {
    this.pool = pool;
    this.codec = codec;
  }

  public Optional<String> get(@NonNull final String key) {
    return pool.withResource(c -> c.get(key).orElse(null));
  }

  public <T> Optional<T> get(@NonNull final String key, @NonNull final Class<T> type) {
    return get(key).map(stored -> codec.decode(stored, type));
  }

  /** SET without expiry. */
  public boolean set(@NonNull final String key, @NonNull final Object value) {
    return set(key, value, null, false);
  }

  /** SET with expiry ({@code null} = no expiry). */
  public boolean set(@NonNull final String key, @NonNull final Object value, final Duration ttl) {
    return set(key, value, ttl, false);
  }

  /**
   * SET.
   *
   * @param key key
   * @param value string stored as is, anything else as JSON
   * @param ttl expiry, or {@code null} for none
   * @param exclusive {@code true} to write only if the key is absent (NX)
   * @return {@code true} if written
   */
  public boolean set(
      @NonNull final String key,
      @NonNull final Object value,
      final Duration ttl,
      final boolean exclusive) {
    final var encoded = codec.encode(value);
    return pool.withResource(c -> c.set(key, encoded, ttl, exclusive)).orElse(false);
  }

  public boolean delete(@NonNull final String key) {
    return pool.withResource(c -> c.delete(key)).orElse(false);
  }

  /** TTL in seconds; {@code -2} when the key is missing or the store is unreachable. */
  public long ttl(@NonNull final String key) {
    return pool.withResource(c -> c.ttl(key)).orElse(-2L);
  }

  public List<String> keys(@NonNull final String pattern) {
    return pool.withResource(c -> c.keys(pattern)).orElse(List.of());
  }

  /** Atomic INCR + expiry. Returns {@code 0} when the store is unreachable. */
  public long increment(@NonNull final String key, @NonNull final Duration ttl) {
    return pool.withResource(c -> c.incrementWithExpiry(key, ttl)).orElse(0L);
  }

  /** Publishes a message; returns the number of receiving subscriber connections. */
  public long publish(@NonNull final String topic, @NonNull final Object message) {
    final var encoded = codec.encode(message);
    return pool.withResource(c -> c.publish(topic, encoded)).orElse(0L);
  }

  // ==================== Lists ====================

  public long leftPush(@NonNull final String key, @NonNull final Object... values) {
    final var encoded = Arrays.stream(values).map(codec::encode).toArray(String[]::new);
    return pool.withResource(c -> c.leftPush(key, encoded)).orElse(0L);
  }

  public Optional<String> rightPop(@NonNull final String key) {
    return pool.withResource(c -> c.rightPop(key).orElse(null));
  }

  /** Pops up to {@code count} entries from the tail. */
  public List<String> rightPop(@NonNull final String key, final long count) {
    return pool.withResource(c -> c.rightPop(key, count)).orElse(List.of());
  }

  /** BRPOP; empty on timeout. {@link Duration#ZERO} waits without limit. */
  public Optional<String> blockingRightPop(
      @NonNull final String key, @NonNull final Duration timeout) {
    return pool.withResource(c -> c.blockingRightPop(key, timeout).orElse(null));
  }

  /**
   * LREM.
   *
   * @param count {@code > 0} from the head, {@code < 0} from the tail, {@code 0} every match
   * @return number of removed entries
   */
  public long listRemove(
      @NonNull final String key, final long count, @NonNull final Object value) {
    final var encoded = codec.encode(value);
    return pool.withResource(c -> c.listRemove(key, count, encoded)).orElse(0L);
  }

  /** Index of the first match counted from the head. */
  public Optional<Long> listPosition(@NonNull final String key, @NonNull final Object value) {
    final var encoded = codec.encode(value);
    return pool.withResource(c -> c.listPosition(key, encoded).orElse(null));
  }

  /** LTRIM; negative indexes count from the tail. Returns {@code false} on store failure. */
  public boolean listTrim(@NonNull final String key, final long start, final long stop) {
    return pool.withResource(
            c -> {
              c.listTrim(key, start, stop);
              return true;
            })
        .orElse(false);
  }

  public long listLength(@NonNull final String key) {
    return pool.withResource(c -> c.listLength(key)).orElse(0L);
  }

  // ==================== Sets ====================

  public long setAdd(@NonNull final String key, @NonNull final String... members) {
    return pool.withResource(c -> c.setAdd(key, members)).orElse(0L);
  }

  public long setRemove(@NonNull final String key, @NonNull final String... members) {
    return pool.withResource(c -> c.setRemove(key, members)).orElse(0L);
  }

  public Set<String> setMembers(@NonNull final String key) {
    return pool.withResource(c -> c.setMembers(key)).orElse(Set.of());
  }

  public long setCardinality(@NonNull final String key) {
    return pool.withResource(c -> c.setCardinality(key)).orElse(0L);
  }

  /** Removes and returns an arbitrary member. */
  public Optional<String> setPop(@NonNull final String key) {
    return pool.withResource(c -> c.setPop(key).orElse(null));
  }

  // ==================== Priority queue (sorted set) ====================

  public boolean priorityAdd(
      @NonNull final String key, @NonNull final Object value, @NonNull final Priority priority) {
    final var encoded = codec.encode(value);
    return pool.withResource(c -> c.sortedSetAdd(key, priority.getScore(), encoded)).orElse(0L)
        > 0;
  }

  /** Removes and returns the highest-priority entry. */
  public Optional<String> priorityPop(@NonNull final String key) {
    return pool.withResource(c -> c.sortedSetPopMax(key).orElse(null));
  }

  /** BZPOPMAX; empty on timeout. {@link Duration#ZERO} waits without limit. */
  public Optional<String> priorityPopBlocking(
      @NonNull final String key, @NonNull final Duration timeout) {
    return pool.withResource(c -> c.blockingSortedSetPopMax(key, timeout).orElse(null));
  }

  /** Entries with priority up to and including {@code maxPriority}, lowest first. */
  public List<String> priorityRangeUpTo(
      @NonNull final String key, @NonNull final Priority maxPriority) {
    return pool.withResource(c -> c.sortedSetRangeUpTo(key, maxPriority.getScore()))
        .orElse(List.of());
  }

  public boolean priorityRemove(@NonNull final String key, @NonNull final Object value) {
    final var encoded = codec.encode(value);
    return pool.withResource(c -> c.sortedSetRemove(key, encoded)).orElse(0L) > 0;
  }
}
