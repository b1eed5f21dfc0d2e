/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.macstab.oss.redis.coordination.CoordinationException;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.store.StoreConnection;
import com.macstab.oss.redis.coordination.store.StoreConnectionException;
import com.macstab.oss.redis.coordination.store.StoreConnector;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded pool of reusable store connections.
 *
 * <p><strong>Lending model:</strong> connections are created lazily, one per concurrent borrower,
 * up to {@code maxSize}. A lent connection is used by exactly one caller until {@link
 * #release(PooledConnection)}; one in-flight operation per connection.
 *
 * <p><strong>Exhaustion:</strong> with {@code acquireTimeout = 0} an acquire beyond {@code
 * maxSize} fails immediately with {@link PoolExhaustedException}. With a positive timeout the
 * caller waits on a {@link Condition} until a connection is released, then fails with the same
 * exception once the timeout passes (backpressure mode).
 *
 * <p><strong>Locking:</strong> all bookkeeping ({@code connections}, {@code pending}) is guarded
 * by one {@link ReentrantLock}. The network connect runs outside the lock; a reserved slot
 * ({@code pending}) keeps concurrent acquires from overshooting {@code maxSize} meanwhile.
 *
 * <p><strong>Health:</strong> connections reporting {@code isOpen() == false} are evicted on
 * acquire and release and replaced on demand.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class ConnectionPool {

  private final StoreConnector connector;
  @Getter private final int maxSize;
  @Getter private final Duration acquireTimeout;
  private final CoordinationMetrics metrics;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition available = lock.newCondition();
  private final List<PooledConnection> connections = new ArrayList<>();
  private final AtomicLong ids = new AtomicLong();
  private int pending;
  private volatile boolean shutdown;

  /**
   * Creates pool that fails fast when exhausted.
   *
   * @param connector source of new connections
   * @param maxSize maximum number of connections (must be &gt;= 1)
   */
  public ConnectionPool(@NonNull final StoreConnector connector, final int maxSize) {
    this(connector, maxSize, Duration.ZERO, CoordinationMetrics.NOOP);
  }

  /**
   * Creates pool.
   *
   * @param connector source of new connections
   * @param maxSize maximum number of connections (must be &gt;= 1)
   * @param acquireTimeout 0 to fail immediately when exhausted, otherwise maximum wait
   * @param metrics metrics sink
   */
  public ConnectionPool(
      @NonNull final StoreConnector connector,
      final int maxSize,
      @NonNull final Duration acquireTimeout,
      @NonNull final CoordinationMetrics metrics) {

    if (maxSize < 1) {
      throw new IllegalArgumentException("maxSize must be >= 1, got: " + maxSize);
    }
    if (acquireTimeout.isNegative()) {
      throw new IllegalArgumentException("acquireTimeout must not be negative: " + acquireTimeout);
    }

    this.connector = connector;
    this.maxSize = maxSize;
    this.acquireTimeout = acquireTimeout;
    this.metrics = metrics;

    if (log.isInfoEnabled()) {
      log.info(
          "Created ConnectionPool (maxSize: {}, acquireTimeout: {})", maxSize, acquireTimeout);
    }
  }

  /**
   * Borrows a connection, connecting a new one if none is free and the pool is below capacity.
   *
   * @return connection marked in use
   * @throws PoolExhaustedException if the pool is at capacity (after waiting, in backpressure
   *     mode)
   * @throws StoreConnectionException if a new connection cannot be opened
   * @throws IllegalStateException if the pool has been shut down
   */
  public PooledConnection acquire() {
    final var existing = takeFreeOrReserve();
    if (existing != null) {
      return existing;
    }
    return openReserved();
  }

  /**
   * Returns a borrowed connection. Closed connections are dropped instead of being reused.
   *
   * @param pooled connection obtained from {@link #acquire()}
   */
  public void release(final PooledConnection pooled) {
    if (pooled == null) {
      return;
    }

    lock.lock();
    try {
      if (!connections.contains(pooled)) {
        if (log.isDebugEnabled()) {
          log.debug("Released connection {} is no longer pooled", pooled.getId());
        }
        return;
      }
      pooled.markFree();
      if (!pooled.getConnection().isOpen()) {
        connections.remove(pooled);
      }
      available.signal();
      reportSize();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Scoped acquisition: borrows a connection, applies {@code operation}, always releases.
   *
   * <p>Store failures ({@link StoreConnectionException}, including a failed connect) are logged
   * and yield an empty result so one failed operation neither leaks a connection nor breaks the
   * caller. {@link PoolExhaustedException} and exceptions thrown by {@code operation} itself
   * propagate.
   *
   * @param operation work to run with the connection; a {@code null} result yields empty
   * @return operation result, or empty on store failure
   */
  public <T> Optional<T> withResource(@NonNull final Function<StoreConnection, T> operation) {
    final PooledConnection pooled;
    try {
      pooled = acquire();
    } catch (final StoreConnectionException e) {
      onStoreError(e);
      return Optional.empty();
    }

    try {
      return Optional.ofNullable(operation.apply(pooled.getConnection()));
    } catch (final StoreConnectionException e) {
      onStoreError(e);
      return Optional.empty();
    } finally {
      release(pooled);
    }
  }

  /** Current number of pooled connections (free and in use). */
  public int getSize() {
    lock.lock();
    try {
      return connections.size();
    } finally {
      lock.unlock();
    }
  }

  public int getInUseCount() {
    lock.lock();
    try {
      return countInUse();
    } finally {
      lock.unlock();
    }
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** Disconnects every pooled connection. Idempotent. */
  public void shutdown() {
    lock.lock();
    try {
      if (shutdown) {
        return;
      }
      shutdown = true;

      for (final var pooled : connections) {
        closeQuietly(pooled);
      }
      final var closed = connections.size();
      connections.clear();
      available.signalAll();
      reportSize();

      if (log.isInfoEnabled()) {
        log.info("Shut down ConnectionPool ({} connections closed)", closed);
      }
    } finally {
      lock.unlock();
    }
  }

  // ==================== Private Methods ====================

  /**
   * Returns a free connection marked in use, or {@code null} after reserving a slot for a new
   * connection.
   */
  private PooledConnection takeFreeOrReserve() {
    final var deadline = System.nanoTime() + acquireTimeout.toNanos();

    lock.lock();
    try {
      while (true) {
        checkNotShutdown();
        evictClosed();

        for (final var pooled : connections) {
          if (!pooled.isInUse()) {
            pooled.markInUse();
            reportSize();
            return pooled;
          }
        }

        if (connections.size() + pending < maxSize) {
          pending++;
          return null;
        }

        final var remaining = deadline - System.nanoTime();
        if (acquireTimeout.isZero() || remaining <= 0) {
          metrics.recordPoolExhausted();
          throw new PoolExhaustedException(maxSize);
        }
        available.awaitNanos(remaining);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CoordinationException("Interrupted while waiting for a pooled connection", e);
    } finally {
      lock.unlock();
    }
  }

  private PooledConnection openReserved() {
    final StoreConnection connection;
    try {
      connection = connector.connect();
    } catch (final RuntimeException e) {
      lock.lock();
      try {
        pending--;
        available.signal();
      } finally {
        lock.unlock();
      }
      throw e;
    }

    lock.lock();
    try {
      pending--;
      if (shutdown) {
        connection.close();
        throw new IllegalStateException("ConnectionPool has been shut down");
      }
      final var pooled = new PooledConnection(ids.incrementAndGet(), connection);
      pooled.markInUse();
      connections.add(pooled);
      reportSize();

      if (log.isDebugEnabled()) {
        log.debug(
            "Opened pooled connection {} (size: {}/{})",
            pooled.getId(),
            connections.size(),
            maxSize);
      }
      return pooled;
    } finally {
      lock.unlock();
    }
  }

  private void evictClosed() {
    final var evicted = connections.removeIf(pooled -> !pooled.getConnection().isOpen());
    if (evicted) {
      log.debug("Evicted closed pooled connections (size: {})", connections.size());
      reportSize();
    }
  }

  private int countInUse() {
    int inUse = 0;
    for (final var pooled : connections) {
      if (pooled.isInUse()) {
        inUse++;
      }
    }
    return inUse;
  }

  private void reportSize() {
    metrics.recordPoolConnections(connections.size(), countInUse());
  }

  private void onStoreError(final StoreConnectionException e) {
    metrics.recordStoreError();
    log.error("Store operation failed: {}", e.getMessage(), e);
  }

  private void closeQuietly(final PooledConnection pooled) {
    try {
      pooled.getConnection().close();
    } catch (final RuntimeException e) {
      log.warn("Failed to close pooled connection {}: {}", pooled.getId(), e.getMessage());
    }
  }

  private void checkNotShutdown() {
    if (shutdown) {
      throw new IllegalStateException("ConnectionPool has been shut down");
    }
  }
}
