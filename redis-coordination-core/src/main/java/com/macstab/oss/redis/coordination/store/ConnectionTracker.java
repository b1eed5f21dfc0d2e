/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import static lombok.AccessLevel.PRIVATE;

import java.util.concurrent.CopyOnWriteArrayList;

import lombok.NonNull;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe registry of the connections a connector has handed out.
 *
 * <p>Used to close everything at once, either on connector shutdown or when reconnection is
 * abandoned. {@link CopyOnWriteArrayList}: registration and removal are rare (pool growth,
 * subscriber recreation), iteration during {@link #closeAll()} works on a snapshot and is safe
 * against concurrent removal from {@code close()} callbacks.
 */
@Slf4j
@FieldDefaults(level = PRIVATE, makeFinal = true)
final class ConnectionTracker {

  private static final int WARNING_THRESHOLD = 100;

  CopyOnWriteArrayList<AutoCloseable> connections = new CopyOnWriteArrayList<>();

  void track(@NonNull final AutoCloseable connection) {
    connections.add(connection);

    final var count = connections.size();

    if (log.isDebugEnabled()) {
      log.debug("Tracking store connection (total: {})", count);
    }

    if (count > WARNING_THRESHOLD && log.isWarnEnabled()) {
      log.warn(
          "Store connection count ({}) exceeded threshold ({}). Possible connection leak.",
          count,
          WARNING_THRESHOLD);
    }
  }

  /** Forgets a connection that closed itself. Idempotent. */
  void untrack(final AutoCloseable connection) {
    if (connection != null && connections.remove(connection) && log.isDebugEnabled()) {
      log.debug("Untracked store connection (remaining: {})", connections.size());
    }
  }

  int getConnectionCount() {
    return connections.size();
  }

  /** Closes every tracked connection. A failure on one connection does not stop the others. */
  void closeAll() {
    for (final var connection : connections) {
      try {
        connection.close();
      } catch (final Exception e) {
        log.warn("Failed to close store connection: {}", e.getMessage());
      }
    }

    connections.clear();

    if (log.isDebugEnabled()) {
      log.debug("Closed all store connections");
    }
  }
}
