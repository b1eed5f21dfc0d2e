/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

import io.lettuce.core.Range;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.TransactionResult;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.NonNull;

/**
 * {@link StoreConnection} over one Lettuce {@link StatefulRedisConnection} (sync API, UTF-8
 * strings).
 *
 * <p>Every {@link RedisException} is rethrown as {@link StoreConnectionException} with the command
 * name in the message. A connection whose MULTI/EXEC block fails is closed, so the pool replaces
 * it instead of lending out a connection stuck inside a transaction.
 */
final class LettuceStoreConnection implements StoreConnection {

  /** 1 = deleted, 0 = absent, -1 = held by someone else. */
  private static final String COMPARE_AND_DELETE_SCRIPT =
      "local current = redis.call('get', KEYS[1]) "
          + "if not current then return 0 end "
          + "if current == ARGV[1] then redis.call('del', KEYS[1]) return 1 end "
          + "return -1";

  private final StatefulRedisConnection<String, String> connection;
  private final RedisCommands<String, String> commands;
  private final Consumer<LettuceStoreConnection> onClose;

  LettuceStoreConnection(
      @NonNull final StatefulRedisConnection<String, String> connection,
      @NonNull final Consumer<LettuceStoreConnection> onClose) {
    this.connection = connection;
    this.commands = connection.sync();
    this.onClose = onClose;
  }

  @Override
  public Optional<String> get(final String key) {
    return Optional.ofNullable(execute("GET", c -> c.get(key)));
  }

  @Override
  public boolean set(
      final String key, final String value, final Duration ttl, final boolean onlyIfAbsent) {
    final var args = new SetArgs();
    if (ttl != null) {
      args.px(ttl.toMillis());
    }
    if (onlyIfAbsent) {
      args.nx();
    }
    return "OK".equals(execute("SET", c -> c.set(key, value, args)));
  }

  @Override
  public boolean delete(final String key) {
    return execute("DEL", c -> c.del(key)) > 0;
  }

  @Override
  public CompareAndDeleteResult compareAndDelete(final String key, final String expectedValue) {
    final Long result =
        execute(
            "EVAL",
            c ->
                c.eval(
                    COMPARE_AND_DELETE_SCRIPT,
                    ScriptOutputType.INTEGER,
                    new String[] {key},
                    expectedValue));
    if (result == null || result == 0L) {
      return CompareAndDeleteResult.ABSENT;
    }
    return result > 0 ? CompareAndDeleteResult.DELETED : CompareAndDeleteResult.MISMATCH;
  }

  @Override
  public long incrementWithExpiry(final String key, final Duration ttl) {
    return execute(
        "INCR+PEXPIRE",
        c -> {
          c.multi();
          try {
            c.incr(key);
            c.pexpire(key, ttl.toMillis());
            final TransactionResult result = c.exec();
            if (result.wasDiscarded()) {
              throw new StoreConnectionException("Transaction discarded for key " + key);
            }
            final Long value = result.get(0);
            return value;
          } catch (final RuntimeException e) {
            close();
            throw e;
          }
        });
  }

  @Override
  public long ttl(final String key) {
    return execute("TTL", c -> c.ttl(key));
  }

  @Override
  public List<String> keys(final String pattern) {
    return execute("KEYS", c -> c.keys(pattern));
  }

  @Override
  public long publish(final String topic, final String message) {
    return execute("PUBLISH", c -> c.publish(topic, message));
  }

  @Override
  public long leftPush(final String key, final String... values) {
    return execute("LPUSH", c -> c.lpush(key, values));
  }

  @Override
  public Optional<String> rightPop(final String key) {
    return Optional.ofNullable(execute("RPOP", c -> c.rpop(key)));
  }

  @Override
  public List<String> rightPop(final String key, final long count) {
    return execute("RPOP", c -> c.rpop(key, count));
  }

  @Override
  public Optional<String> blockingRightPop(final String key, final Duration timeout) {
    final var popped = execute("BRPOP", c -> c.brpop(toSeconds(timeout), key));
    return popped != null && popped.hasValue() ? Optional.of(popped.getValue()) : Optional.empty();
  }

  @Override
  public long listRemove(final String key, final long count, final String value) {
    return execute("LREM", c -> c.lrem(key, count, value));
  }

  @Override
  public Optional<Long> listPosition(final String key, final String value) {
    return Optional.ofNullable(execute("LPOS", c -> c.lpos(key, value)));
  }

  @Override
  public void listTrim(final String key, final long start, final long stop) {
    execute("LTRIM", c -> c.ltrim(key, start, stop));
  }

  @Override
  public long listLength(final String key) {
    return execute("LLEN", c -> c.llen(key));
  }

  @Override
  public long setAdd(final String key, final String... members) {
    return execute("SADD", c -> c.sadd(key, members));
  }

  @Override
  public long setRemove(final String key, final String... members) {
    return execute("SREM", c -> c.srem(key, members));
  }

  @Override
  public Set<String> setMembers(final String key) {
    return execute("SMEMBERS", c -> c.smembers(key));
  }

  @Override
  public long setCardinality(final String key) {
    return execute("SCARD", c -> c.scard(key));
  }

  @Override
  public Optional<String> setPop(final String key) {
    return Optional.ofNullable(execute("SPOP", c -> c.spop(key)));
  }

  @Override
  public long sortedSetAdd(final String key, final double score, final String member) {
    return execute("ZADD", c -> c.zadd(key, score, member));
  }

  @Override
  public Optional<String> sortedSetPopMax(final String key) {
    final var scored = execute("ZPOPMAX", c -> c.zpopmax(key));
    return scored != null && scored.hasValue() ? Optional.of(scored.getValue()) : Optional.empty();
  }

  @Override
  public Optional<String> blockingSortedSetPopMax(final String key, final Duration timeout) {
    final var popped = execute("BZPOPMAX", c -> c.bzpopmax(toSeconds(timeout), key));
    if (popped == null || !popped.hasValue() || !popped.getValue().hasValue()) {
      return Optional.empty();
    }
    return Optional.of(popped.getValue().getValue());
  }

  @Override
  public List<String> sortedSetRangeUpTo(final String key, final double maxScore) {
    final Range<Double> range =
        Range.from(Range.Boundary.unbounded(), Range.Boundary.including(maxScore));
    return execute("ZRANGEBYSCORE", c -> c.zrangebyscore(key, range));
  }

  @Override
  public long sortedSetRemove(final String key, final String member) {
    return execute("ZREM", c -> c.zrem(key, member));
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public void close() {
    onClose.accept(this);
    connection.close();
  }

  /** Blocking-command timeout in seconds; Redis accepts fractions since 6.0. */
  private static double toSeconds(final Duration timeout) {
    return timeout.toMillis() / 1000.0;
  }

  private <T> T execute(
      final String command, final Function<RedisCommands<String, String>, T> operation) {
    try {
      return operation.apply(commands);
    } catch (final RedisException e) {
      throw new StoreConnectionException(command + " failed: " + e.getMessage(), e);
    }
  }
}
