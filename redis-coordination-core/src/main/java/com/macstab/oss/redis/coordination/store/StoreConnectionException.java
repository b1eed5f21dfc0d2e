/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import com.macstab.oss.redis.coordination.CoordinationException;

/**
 * Transport-level failure talking to the store (refused connection, reset socket, command rejected
 * while disconnected, reconnection abandoned).
 *
 * <p>Raised by {@link StoreConnection} and {@link StoreConnector} implementations. The connection
 * pool's scoped execution logs it and turns it into an empty result; every other caller sees it
 * as is.
 */
public class StoreConnectionException extends CoordinationException {

  private static final long serialVersionUID = 1L;

  public StoreConnectionException(final String message) {
    super(message);
  }

  public StoreConnectionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
