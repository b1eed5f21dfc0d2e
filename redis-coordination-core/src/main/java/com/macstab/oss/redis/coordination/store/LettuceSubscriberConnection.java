/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.util.function.Consumer;

import io.lettuce.core.RedisException;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import lombok.NonNull;

/**
 * {@link SubscriberConnection} over a Lettuce {@link StatefulRedisPubSubConnection}.
 *
 * <p>Lettuce's {@code PubSubCommandHandler} decodes push messages on the event loop and calls the
 * registered adapter there; the adapter forwards channel and payload to the single listener.
 */
final class LettuceSubscriberConnection implements SubscriberConnection {

  private final StatefulRedisPubSubConnection<String, String> connection;
  private final Consumer<LettuceSubscriberConnection> onClose;
  private volatile boolean closed;

  LettuceSubscriberConnection(
      @NonNull final StatefulRedisPubSubConnection<String, String> connection,
      @NonNull final StoreMessageListener listener,
      @NonNull final Consumer<LettuceSubscriberConnection> onClose) {
    this.connection = connection;
    this.onClose = onClose;
    connection.addListener(
        new RedisPubSubAdapter<>() {
          @Override
          public void message(final String channel, final String message) {
            listener.onMessage(channel, message);
          }
        });
  }

  @Override
  public void subscribe(final String... topics) {
    try {
      connection.sync().subscribe(topics);
    } catch (final RedisException e) {
      throw new StoreConnectionException("SUBSCRIBE failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void unsubscribe(final String... topics) {
    try {
      connection.sync().unsubscribe(topics);
    } catch (final RedisException e) {
      throw new StoreConnectionException("UNSUBSCRIBE failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    onClose.accept(this);
    connection.close();
  }
}
