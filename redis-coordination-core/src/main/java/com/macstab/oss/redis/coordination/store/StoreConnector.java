/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

/**
 * Factory for store connections (the CONNECT / DUPLICATE side of the store client).
 *
 * <p>Every call returns a new, independent connection. Implementations are thread-safe.
 *
 * @see LettuceStoreConnector
 */
public interface StoreConnector extends AutoCloseable {

  /**
   * Opens a command connection.
   *
   * @return connected store connection
   * @throws StoreConnectionException if the store cannot be reached
   */
  StoreConnection connect();

  /**
   * Opens a subscriber connection delivering every message to {@code listener}.
   *
   * @param listener receiver for all topics of the connection
   * @return connected subscriber connection
   * @throws StoreConnectionException if the store cannot be reached
   */
  SubscriberConnection connectSubscriber(StoreMessageListener listener);

  /** Closes every connection this connector created and releases client resources. */
  @Override
  void close();
}
