/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pubsub;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.PooledStore;
import com.macstab.oss.redis.coordination.store.StoreConnectionException;
import com.macstab.oss.redis.coordination.store.StoreConnector;
import com.macstab.oss.redis.coordination.store.SubscriberConnection;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Topic-multiplexed subscription registry over one shared subscriber connection.
 *
 * <p><strong>Registry invariant:</strong> a topic is subscribed on the store at most once, however
 * many local callbacks it has. The first local subscription issues SUBSCRIBE, removing the last
 * one issues UNSUBSCRIBE. The subscriber connection is opened on first use and closed when no
 * topic is left, to be reopened by the next {@link #subscribe}.
 *
 * <p><strong>Connection:</strong> exactly one subscriber connection is in use at a time. While it
 * is reconnecting it is kept; it is replaced only once closed for good, and the replacement is
 * subscribed to every registered topic.
 *
 * <p><strong>Threading:</strong>
 *
 * <ul>
 *   <li>Registry mutation ({@link #subscribe}, {@link #unsubscribe}, {@link #close}) is serialized
 *       on one monitor, together with the SUBSCRIBE/UNSUBSCRIBE calls it implies. Opening the
 *       subscriber connection happens outside it.
 *   <li>Delivery reads the registry without locking: {@link ConcurrentHashMap} of {@link
 *       CopyOnWriteArrayList}, iterated as a snapshot.
 *   <li>Incoming messages are handed from the store client's receive thread to {@code
 *       dispatchExecutor}, so callbacks may call back into the store without blocking the receive
 *       loop. With a single-threaded executor, messages are delivered in arrival order.
 * </ul>
 *
 * <p><strong>Delivery:</strong> at most once to each callback registered when the message is
 * dispatched. A throwing callback is logged and does not affect the others.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class PubSubHub implements AutoCloseable {

  private final StoreConnector connector;
  private final PooledStore store;
  private final Executor dispatchExecutor;
  private final CoordinationMetrics metrics;

  private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscription>> topics =
      new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();
  private final Object monitor = new Object();

  // guarded by monitor
  private SubscriberConnection subscriber;
  private volatile boolean closed;

  public PubSubHub(
      @NonNull final StoreConnector connector,
      @NonNull final PooledStore store,
      @NonNull final Executor dispatchExecutor,
      @NonNull final CoordinationMetrics metrics) {
    this.connector = connector;
    this.store = store;
    this.dispatchExecutor = dispatchExecutor;
    this.metrics = metrics;
  }

  /**
   * Registers {@code callback} for {@code topic}.
   *
   * <p>The shared subscriber connection is opened outside the registry monitor, so a store that
   * is down delays only the callers that need a new connection, not concurrent {@link
   * #unsubscribe} or {@link #isConnected} calls.
   *
   * @return handle for {@link #unsubscribe(Subscription)}
   * @throws StoreConnectionException if the subscriber connection or SUBSCRIBE fails; nothing is
   *     registered in that case
   */
  public Subscription subscribe(
      @NonNull final String topic, @NonNull final MessageCallback callback) {
    final var subscription = new Subscription(ids.incrementAndGet(), topic, callback);
    SubscriberConnection opened = null;
    while (true) {
      synchronized (monitor) {
        if (closed && opened != null) {
          opened.close();
        }
        checkNotClosed();
        if (opened != null) {
          adopt(opened);
          opened = null;
        }
        if (isUsable(subscriber)) {
          register(subscription);
          return subscription;
        }
      }
      opened = connector.connectSubscriber(this::onMessage);
    }
  }

  /**
   * Removes a subscription. The last one of a topic unsubscribes the topic; the last topic closes
   * the subscriber connection.
   *
   * @return {@code false} if the handle was not registered (already removed, foreign hub)
   */
  public boolean unsubscribe(@NonNull final Subscription subscription) {
    synchronized (monitor) {
      final var topic = subscription.getTopic();
      final var callbacks = topics.get(topic);
      if (callbacks == null || !callbacks.remove(subscription)) {
        log.warn("Subscription {} for topic {} is not registered", subscription.getId(), topic);
        return false;
      }

      if (callbacks.isEmpty()) {
        topics.remove(topic);
        unsubscribeTopic(topic);
        metrics.setActiveTopics(topics.size());
        closeSubscriberIfIdle();
      }
      return true;
    }
  }

  /**
   * Publishes {@code message} (JSON unless it is a string) on a pooled connection.
   *
   * @return number of subscriber connections that received it; {@code 0} if the store is
   *     unreachable
   */
  public long publish(@NonNull final String topic, @NonNull final Object message) {
    final var receivers = store.publish(topic, message);
    metrics.recordPublished();
    if (log.isTraceEnabled()) {
      log.trace("Published to {} ({} receivers)", topic, receivers);
    }
    return receivers;
  }

  /** Topics with at least one local subscription. */
  public Set<String> getTopics() {
    return Set.copyOf(topics.keySet());
  }

  public List<Subscription> getSubscriptions(@NonNull final String topic) {
    final var callbacks = topics.get(topic);
    return callbacks == null ? List.of() : List.copyOf(callbacks);
  }

  public boolean isConnected() {
    synchronized (monitor) {
      return subscriber != null && subscriber.isOpen();
    }
  }

  /** Drops every subscription and closes the subscriber connection. Idempotent. */
  @Override
  public void close() {
    synchronized (monitor) {
      if (closed) {
        return;
      }
      closed = true;
      topics.clear();
      metrics.setActiveTopics(0);
      if (subscriber != null) {
        subscriber.close();
        subscriber = null;
      }
      log.info("Closed PubSubHub");
    }
  }

  // ==================== Private Methods ====================

  /** Receive-thread entry point: hands the message to the dispatch executor. */
  private void onMessage(final String topic, final String message) {
    try {
      dispatchExecutor.execute(() -> dispatch(topic, message));
    } catch (final RejectedExecutionException e) {
      log.warn("Dropping message on topic {}: dispatcher is shut down", topic);
    }
  }

  void dispatch(final String topic, final String message) {
    final var callbacks = topics.get(topic);
    if (callbacks == null || callbacks.isEmpty()) {
      log.warn("Received message on topic {} without subscribers", topic);
      return;
    }

    for (final var subscription : callbacks) {
      try {
        subscription.getCallback().onMessage(message, topic);
        metrics.recordDelivered();
      } catch (final RuntimeException e) {
        metrics.recordCallbackFailure();
        log.error(
            "Subscriber {} failed handling message on topic {}", subscription.getId(), topic, e);
      }
    }
  }

  /** Adds {@code subscription} to the registry; SUBSCRIBE for the first one of a topic. */
  private void register(final Subscription subscription) {
    final var topic = subscription.getTopic();
    final var existing = topics.get(topic);
    if (existing != null) {
      existing.add(subscription);
      return;
    }

    // registered before SUBSCRIBE so that the first message finds its callback
    final var callbacks = new CopyOnWriteArrayList<Subscription>();
    callbacks.add(subscription);
    topics.put(topic, callbacks);
    try {
      subscriber.subscribe(topic);
    } catch (final RuntimeException e) {
      topics.remove(topic);
      closeSubscriberIfIdle();
      throw e;
    }

    metrics.setActiveTopics(topics.size());
    log.debug("Subscribed to topic {}", topic);
  }

  /**
   * Installs a freshly opened subscriber connection unless another caller already did. A
   * replaced connection is closed and every registered topic is subscribed again on the new one.
   */
  private void adopt(final SubscriberConnection opened) {
    if (isUsable(subscriber)) {
      opened.close();
      return;
    }

    final var previous = subscriber;
    subscriber = opened;
    if (previous != null) {
      previous.close();
      log.warn("Replaced closed subscriber connection ({} topics)", topics.size());
    } else {
      log.debug("Opened shared subscriber connection");
    }

    if (topics.isEmpty()) {
      return;
    }
    try {
      subscriber.subscribe(topics.keySet().toArray(new String[0]));
    } catch (final RuntimeException e) {
      subscriber = null;
      opened.close();
      throw e;
    }
  }

  /** A reconnecting connection stays usable; Lettuce re-subscribes its channels itself. */
  private static boolean isUsable(final SubscriberConnection connection) {
    return connection != null && !connection.isClosed();
  }

  private void unsubscribeTopic(final String topic) {
    if (subscriber == null) {
      return;
    }
    try {
      subscriber.unsubscribe(topic);
      log.debug("Unsubscribed from topic {}", topic);
    } catch (final StoreConnectionException e) {
      // registry is already updated; stray messages for the topic are dropped with a warning
      log.error("UNSUBSCRIBE {} failed: {}", topic, e.getMessage(), e);
    }
  }

  private void closeSubscriberIfIdle() {
    if (topics.isEmpty() && subscriber != null) {
      subscriber.close();
      subscriber = null;
      log.debug("Closed shared subscriber connection (no topics left)");
    }
  }

  private void checkNotClosed() {
    if (closed) {
      throw new IllegalStateException("PubSubHub has been closed");
    }
  }
}
