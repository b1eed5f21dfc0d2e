/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pool;

import com.macstab.oss.redis.coordination.store.StoreConnection;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * A store connection owned by the {@link ConnectionPool}, lent to one caller at a time.
 *
 * <p>{@code inUse} is written under the pool lock and read without it (monitoring, tests), hence
 * {@code volatile}.
 */
@ToString(onlyExplicitlyIncluded = true)
public final class PooledConnection {

  @Getter @ToString.Include private final long id;
  @Getter private final StoreConnection connection;
  @ToString.Include private volatile boolean inUse;

  PooledConnection(final long id, @NonNull final StoreConnection connection) {
    this.id = id;
    this.connection = connection;
  }

  public boolean isInUse() {
    return inUse;
  }

  void markInUse() {
    inUse = true;
  }

  void markFree() {
    inUse = false;
  }
}
