/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One store connection, used by exactly one caller at a time.
 *
 * <p>The operations are the subset of Redis commands the coordination primitives need. Every
 * method may throw {@link StoreConnectionException} when the transport fails; implementations
 * never leak client-library exceptions.
 *
 * <p><strong>Ownership:</strong> connections are created by a {@link StoreConnector} and lent out
 * by the connection pool. A lent connection carries one in-flight operation at a time, so
 * {@link #incrementWithExpiry(String, Duration)} may use MULTI/EXEC without interleaving.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public interface StoreConnection extends AutoCloseable {

  /** GET. Empty when the key does not exist. */
  Optional<String> get(String key);

  /**
   * SET with optional expiry and NX.
   *
   * @param key key
   * @param value value
   * @param ttl expiry (PX), or {@code null} to keep the key forever
   * @param onlyIfAbsent {@code true} for NX semantics
   * @return {@code true} if the value was written
   */
  boolean set(String key, String value, Duration ttl, boolean onlyIfAbsent);

  /** DEL. Returns {@code true} if the key existed. */
  boolean delete(String key);

  /**
   * Deletes {@code key} only if it currently holds {@code expectedValue}, atomically.
   *
   * @param key key
   * @param expectedValue value the caller believes it owns
   * @return what happened
   */
  CompareAndDeleteResult compareAndDelete(String key, String expectedValue);

  /**
   * INCR followed by PEXPIRE, executed as one atomic unit.
   *
   * @param key counter key
   * @param ttl expiry applied after the increment
   * @return counter value after the increment
   */
  long incrementWithExpiry(String key, Duration ttl);

  /** TTL in seconds; {@code -2} when the key does not exist, {@code -1} when it never expires. */
  long ttl(String key);

  /** KEYS. */
  List<String> keys(String pattern);

  /** PUBLISH. Returns the number of receiving subscriber connections. */
  long publish(String topic, String message);

  /** LPUSH. Returns the list length after the push. */
  long leftPush(String key, String... values);

  /** RPOP. */
  Optional<String> rightPop(String key);

  /** RPOP with count. Empty list when the key does not exist. */
  List<String> rightPop(String key, long count);

  /**
   * BRPOP on one key. Holds the connection until an element arrives or the timeout passes.
   *
   * @param timeout how long to block; {@link Duration#ZERO} blocks without limit
   * @return the popped element, empty on timeout
   */
  Optional<String> blockingRightPop(String key, Duration timeout);

  /** LREM. Returns the number of removed elements. */
  long listRemove(String key, long count, String value);

  /** LPOS. Index of the first element equal to {@code value}, from the head. */
  Optional<Long> listPosition(String key, String value);

  /** LTRIM, inclusive bounds; negative indexes count from the tail. */
  void listTrim(String key, long start, long stop);

  /** LLEN. */
  long listLength(String key);

  /** SADD. Returns the number of members actually added. */
  long setAdd(String key, String... members);

  /** SREM. Returns the number of members actually removed. */
  long setRemove(String key, String... members);

  /** SMEMBERS. */
  Set<String> setMembers(String key);

  /** SCARD. */
  long setCardinality(String key);

  /** SPOP (single random member). */
  Optional<String> setPop(String key);

  /** ZADD. Returns the number of new members. */
  long sortedSetAdd(String key, double score, String member);

  /** ZPOPMAX (single member). */
  Optional<String> sortedSetPopMax(String key);

  /**
   * BZPOPMAX on one key.
   *
   * @param timeout how long to block; {@link Duration#ZERO} blocks without limit
   * @return the member with the highest score, empty on timeout
   */
  Optional<String> blockingSortedSetPopMax(String key, Duration timeout);

  /** ZRANGEBYSCORE key -inf maxScore, ascending. */
  List<String> sortedSetRangeUpTo(String key, double maxScore);

  /** ZREM. Returns the number of members removed. */
  long sortedSetRemove(String key, String member);

  boolean isOpen();

  /** Disconnects. Idempotent. */
  @Override
  void close();
}
