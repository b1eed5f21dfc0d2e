/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pubsub;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import com.macstab.oss.redis.coordination.pool.PooledStore;
import com.macstab.oss.redis.coordination.store.ValueCodec;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * A store-backed value mirrored in every process that opens it.
 *
 * <p>The variable listens on the topic named like its key. {@link #set} writes the key and then
 * publishes the new value on that topic; every instance re-reads the key on any message (the
 * payload is only a wake-up) and notifies its {@link ChangeListener}s when the value differs from
 * the last one it saw.
 *
 * <p>Expiry is silent: a key that expires without a publish keeps its old local value until the
 * next {@link #refresh()}.
 */
@Slf4j
public final class SharedVariable implements AutoCloseable {

  /** Receives value changes; {@code null} stands for "absent". */
  @FunctionalInterface
  public interface ChangeListener {
    void onChange(String previous, String current);
  }

  @Getter private final String key;
  private final PooledStore store;
  private final PubSubHub hub;
  private final ValueCodec codec;
  private final CopyOnWriteArrayList<ChangeListener> listeners = new CopyOnWriteArrayList<>();
  private final Subscription subscription;

  private volatile String value;
  private volatile boolean closed;

  public SharedVariable(
      @NonNull final String key,
      @NonNull final PooledStore store,
      @NonNull final PubSubHub hub,
      @NonNull final ValueCodec codec) {
    this.key = key;
    this.store = store;
    this.hub = hub;
    this.codec = codec;
    this.subscription = hub.subscribe(key, (message, topic) -> refresh());
    this.value = store.get(key).orElse(null);
  }

  /** Last value seen by this instance. */
  public Optional<String> get() {
    return Optional.ofNullable(value);
  }

  public <T> Optional<T> get(@NonNull final Class<T> type) {
    final var current = value;
    return current == null ? Optional.empty() : Optional.ofNullable(codec.decode(current, type));
  }

  public boolean set(@NonNull final Object newValue) {
    return set(newValue, null);
  }

  /**
   * Writes the value (JSON unless it is a string) and announces it to every instance.
   *
   * @param ttl expiry, or {@code null} to keep the key forever
   * @return {@code false} if the write failed; nothing is published then
   */
  public boolean set(@NonNull final Object newValue, final Duration ttl) {
    checkNotClosed();
    final var encoded = codec.encode(newValue);
    if (!store.set(key, encoded, ttl)) {
      log.warn("Could not write shared variable {}", key);
      return false;
    }
    hub.publish(key, encoded);
    return true;
  }

  /** Re-reads the key and notifies listeners if the value changed. */
  public synchronized void refresh() {
    if (closed) {
      return;
    }
    final var current = store.get(key).orElse(null);
    final var previous = value;
    value = current;
    if (Objects.equals(previous, current)) {
      return;
    }

    log.debug("Shared variable {} changed", key);
    for (final var listener : listeners) {
      try {
        listener.onChange(previous, current);
      } catch (final RuntimeException e) {
        log.error("Change listener of shared variable {} failed", key, e);
      }
    }
  }

  public void addListener(@NonNull final ChangeListener listener) {
    listeners.add(listener);
  }

  public boolean removeListener(@NonNull final ChangeListener listener) {
    return listeners.remove(listener);
  }

  /** Stops listening for changes. The stored value is left as is. Idempotent. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    listeners.clear();
    hub.unsubscribe(subscription);
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("Shared variable " + key + " has been closed");
    }
  }
}
