/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

/**
 * Connection in subscriber mode.
 *
 * <p>Once a connection has subscribed it accepts only (UN)SUBSCRIBE, which is why it is never
 * lent out by the pool. Messages for every topic go to the single {@link StoreMessageListener}
 * given to {@link StoreConnector#connectSubscriber(StoreMessageListener)}.
 */
public interface SubscriberConnection extends AutoCloseable {

  void subscribe(String... topics);

  void unsubscribe(String... topics);

  /** Transport currently connected. {@code false} while a reconnect is in progress. */
  boolean isOpen();

  /**
   * Closed for good, by {@link #close()} or by the connector giving up on reconnection. A
   * connection that is only reconnecting is not closed.
   */
  boolean isClosed();

  /** Disconnects. Idempotent. */
  @Override
  void close();
}
