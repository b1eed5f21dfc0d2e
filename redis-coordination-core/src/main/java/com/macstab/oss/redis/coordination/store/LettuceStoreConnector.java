/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.util.function.Supplier;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.event.connection.ReconnectAttemptEvent;
import io.lettuce.core.event.connection.ReconnectFailedEvent;
import io.lettuce.core.resource.ClientResources;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

/**
 * Production {@link StoreConnector} over a Lettuce {@link RedisClient}.
 *
 * <p><strong>Reconnect behavior:</strong>
 *
 * <ul>
 *   <li>{@code autoReconnect(true)}: Lettuce's {@code ConnectionWatchdog} reconnects broken
 *       channels, waiting {@link ReconnectPolicy#delayFor(long)} between attempts ({@link
 *       BackoffDelay}).
 *   <li>{@code REJECT_COMMANDS}: while disconnected, commands fail immediately with a {@code
 *       RedisException} (translated to {@link StoreConnectionException}) instead of piling up in
 *       the disconnected buffer.
 *   <li>The initial connect is retried with the same backoff up to {@code maxAttempts} times.
 *   <li>Once a {@link ReconnectFailedEvent} reports an attempt at or beyond {@code maxAttempts},
 *       reconnection is abandoned: every tracked connection is closed and later {@link
 *       #connect()} calls fail immediately.
 * </ul>
 *
 * <p>The connector owns the client and its {@link ClientResources}; {@link #close()} shuts both
 * down.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class LettuceStoreConnector implements StoreConnector {

  private final RedisClient client;
  private final ClientResources resources;
  @Getter private final ReconnectPolicy reconnectPolicy;
  private final ConnectionTracker tracker;
  private final Disposable eventSubscription;
  private volatile boolean abandoned;
  private volatile boolean closed;

  public LettuceStoreConnector(
      @NonNull final RedisEndpoint endpoint, @NonNull final ReconnectPolicy reconnectPolicy) {
    this.reconnectPolicy = reconnectPolicy;
    this.resources =
        ClientResources.builder().reconnectDelay(new BackoffDelay(reconnectPolicy)).build();
    this.client = RedisClient.create(resources, endpoint.toRedisUri());
    this.tracker = new ConnectionTracker();

    configureClientOptions();
    this.eventSubscription = resources.eventBus().get().subscribe(this::onConnectionEvent);

    if (log.isInfoEnabled()) {
      log.info(
          "Created LettuceStoreConnector for {}:{} (db {}, reconnect: {} attempts, {}..{})",
          endpoint.getHost(),
          endpoint.getPort(),
          endpoint.getDatabase(),
          reconnectPolicy.getMaxAttempts(),
          reconnectPolicy.getBaseSleep(),
          reconnectPolicy.getMaxSleep());
    }
  }

  @Override
  public StoreConnection connect() {
    checkUsable();
    final var connection =
        new LettuceStoreConnection(
            connectWithRetry("command", () -> client.connect(StringCodec.UTF8)), tracker::untrack);
    tracker.track(connection);
    return connection;
  }

  @Override
  public SubscriberConnection connectSubscriber(@NonNull final StoreMessageListener listener) {
    checkUsable();
    final var connection =
        new LettuceSubscriberConnection(
            connectWithRetry("subscriber", () -> client.connectPubSub(StringCodec.UTF8)),
            listener,
            tracker::untrack);
    tracker.track(connection);
    return connection;
  }

  public boolean isAbandoned() {
    return abandoned;
  }

  public int getConnectionCount() {
    return tracker.getConnectionCount();
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }

    closed = true;

    try {
      eventSubscription.dispose();
      tracker.closeAll();
      client.shutdown();
      resources.shutdown();

      if (log.isInfoEnabled()) {
        log.info("Closed LettuceStoreConnector");
      }
    } catch (final RuntimeException e) {
      log.error("Error during LettuceStoreConnector shutdown", e);
    }
  }

  // ==================== Private Methods ====================

  private void checkUsable() {
    if (closed) {
      throw new IllegalStateException("LettuceStoreConnector has been closed");
    }
    if (abandoned) {
      throw new StoreConnectionException(
          "Reconnection abandoned after " + reconnectPolicy.getMaxAttempts() + " attempts");
    }
  }

  /**
   * Initial connect with backoff. The watchdog only covers connections that were established
   * once, so the first handshake needs its own loop.
   */
  private <T> T connectWithRetry(final String kind, final Supplier<T> connect) {
    long attempt = 0;
    while (true) {
      attempt++;
      try {
        return connect.get();
      } catch (final RedisException e) {
        if (reconnectPolicy.isExhausted(attempt)) {
          throw new StoreConnectionException(
              "Could not open " + kind + " connection after " + attempt + " attempts", e);
        }
        final var delay = reconnectPolicy.delayFor(attempt);
        log.warn(
            "Opening {} connection failed (attempt {}/{}), retrying in {}: {}",
            kind,
            attempt,
            reconnectPolicy.getMaxAttempts(),
            delay,
            e.getMessage());
        sleep(delay.toMillis());
      }
    }
  }

  private void sleep(final long millis) {
    try {
      Thread.sleep(millis);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreConnectionException("Interrupted while waiting to reconnect", e);
    }
  }

  private void onConnectionEvent(final Object event) {
    if (event instanceof ReconnectAttemptEvent attemptEvent) {
      log.warn(
          "Reconnecting to {} (attempt {}, delay {})",
          attemptEvent.remoteAddress(),
          attemptEvent.getAttempt(),
          attemptEvent.getDelay());
    } else if (event instanceof ReconnectFailedEvent failedEvent) {
      onReconnectFailed(failedEvent);
    }
  }

  private void onReconnectFailed(final ReconnectFailedEvent event) {
    if (abandoned || !reconnectPolicy.isExhausted(event.getAttempt())) {
      return;
    }

    abandoned = true;
    log.error(
        "Reconnection to {} abandoned after {} attempts",
        event.remoteAddress(),
        event.getAttempt(),
        event.getCause());
    tracker.closeAll();
  }

  /**
   * Auto-reconnect with fail-fast while disconnected (no unbounded disconnected buffer growth).
   */
  private void configureClientOptions() {
    client.setOptions(
        ClientOptions.builder()
            .autoReconnect(true)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .build());
  }
}
