/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.macstab.oss.redis.coordination.cache.CacheGuard;
import com.macstab.oss.redis.coordination.cron.CronScheduler;
import com.macstab.oss.redis.coordination.lock.DistributedLock;
import com.macstab.oss.redis.coordination.lock.LockTokenGenerator;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.ConnectionPool;
import com.macstab.oss.redis.coordination.pool.PooledStore;
import com.macstab.oss.redis.coordination.pubsub.PubSubHub;
import com.macstab.oss.redis.coordination.pubsub.SharedVariable;
import com.macstab.oss.redis.coordination.ratelimit.RateLimiter;
import com.macstab.oss.redis.coordination.store.LettuceStoreConnector;
import com.macstab.oss.redis.coordination.store.ReconnectPolicy;
import com.macstab.oss.redis.coordination.store.RedisEndpoint;
import com.macstab.oss.redis.coordination.store.StoreConnector;
import com.macstab.oss.redis.coordination.store.ValueCodec;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * The process-wide set of coordination primitives sharing one connection pool and one subscriber
 * connection.
 *
 * <p><strong>Ownership:</strong>
 *
 * <ul>
 *   <li>The context owns the pool, the pub/sub registry with its dispatch thread, the cron thread
 *       and the lock-token generator.
 *   <li>The {@link StoreConnector} is owned only when the context was built with {@link
 *       #create(RedisEndpoint, ReconnectPolicy, CoordinationSettings)}; an injected connector is
 *       left open by {@link #shutdown()}.
 *   <li>{@link #shutdown()} also closes the {@link CoordinationMetrics}.
 * </ul>
 *
 * <p><strong>Shutdown order:</strong> cron jobs, pub/sub, pool, metrics, connector. Idempotent.
 *
 * <pre>{@code
 * CoordinationContext context =
 *     CoordinationContext.create(
 *         RedisEndpoint.defaults(), ReconnectPolicy.defaults(), CoordinationSettings.defaults());
 *
 * context.getLock().withLock("invoice-42", () -> issueInvoice(42));
 * context.shutdown();
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@Getter
public final class CoordinationContext {

  static final String DISPATCH_THREAD_NAME = "coordination-pubsub";

  private final StoreConnector connector;
  private final CoordinationSettings settings;
  private final CoordinationMetrics metrics;
  private final ValueCodec codec;
  private final ConnectionPool pool;
  private final PooledStore store;
  private final LockTokenGenerator tokenGenerator;
  private final DistributedLock lock;
  private final CacheGuard cacheGuard;
  private final RateLimiter rateLimiter;
  private final PubSubHub pubSubHub;
  private final CronScheduler cronScheduler;

  @Getter(AccessLevel.NONE)
  private final ExecutorService dispatchExecutor;

  @Getter(AccessLevel.NONE)
  private final boolean ownsConnector;

  private volatile boolean shutdown;

  public CoordinationContext(
      @NonNull final StoreConnector connector,
      @NonNull final CoordinationSettings settings,
      @NonNull final CoordinationMetrics metrics,
      @NonNull final Clock clock) {
    this(connector, settings, metrics, clock, false);
  }

  private CoordinationContext(
      final StoreConnector connector,
      final CoordinationSettings settings,
      final CoordinationMetrics metrics,
      final Clock clock,
      final boolean ownsConnector) {
    this.connector = connector;
    this.settings = settings;
    this.metrics = metrics;
    this.ownsConnector = ownsConnector;
    this.codec = new ValueCodec();
    this.pool =
        new ConnectionPool(
            connector, settings.getPoolSize(), settings.getPoolAcquireTimeout(), metrics);
    this.store = new PooledStore(pool, codec);
    this.tokenGenerator = new LockTokenGenerator(clock);
    this.lock =
        new DistributedLock(
            pool,
            tokenGenerator,
            metrics,
            settings.getLockTimeout(),
            settings.getLockRetrySleep());
    this.cacheGuard = new CacheGuard(store, lock, codec, metrics);
    this.rateLimiter = new RateLimiter(pool, metrics, clock);
    this.dispatchExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat(DISPATCH_THREAD_NAME).setDaemon(true).build());
    this.pubSubHub = new PubSubHub(connector, store, dispatchExecutor, metrics);
    this.cronScheduler = new CronScheduler(lock, metrics, clock, settings);

    if (log.isInfoEnabled()) {
      log.info(
          "Created CoordinationContext (pool size {}, lock timeout {}, cron zone {})",
          settings.getPoolSize(),
          settings.getLockTimeout(),
          settings.getCronZone());
    }
  }

  /**
   * Builds a context over its own {@link LettuceStoreConnector}, closed by {@link #shutdown()}.
   */
  public static CoordinationContext create(
      @NonNull final RedisEndpoint endpoint,
      @NonNull final ReconnectPolicy reconnectPolicy,
      @NonNull final CoordinationSettings settings) {
    final var connector = new LettuceStoreConnector(endpoint, reconnectPolicy);
    try {
      return new CoordinationContext(
          connector, settings, CoordinationMetrics.NOOP, Clock.systemUTC(), true);
    } catch (final RuntimeException e) {
      connector.close();
      throw e;
    }
  }

  /**
   * Opens a {@link SharedVariable} on {@code key}. The caller closes it; any still open when the
   * context shuts down stop receiving updates.
   */
  public SharedVariable sharedVariable(@NonNull final String key) {
    checkNotShutdown();
    return new SharedVariable(key, store, pubSubHub, codec);
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** Stops every primitive and releases all connections. Idempotent. */
  public synchronized void shutdown() {
    if (shutdown) {
      return;
    }
    shutdown = true;

    cronScheduler.shutdown();
    pubSubHub.close();
    dispatchExecutor.shutdown();
    try {
      if (!dispatchExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
        dispatchExecutor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatchExecutor.shutdownNow();
    }
    pool.shutdown();
    closeQuietly("metrics", metrics);
    if (ownsConnector) {
      closeQuietly("connector", connector);
    }
    log.info("CoordinationContext shut down");
  }

  // ==================== Private Methods ====================

  private static void closeQuietly(final String what, final AutoCloseable closeable) {
    try {
      closeable.close();
    } catch (final Exception e) {
      log.warn("Failed to close {} during shutdown: {}", what, e.getMessage(), e);
    }
  }

  private void checkNotShutdown() {
    if (shutdown) {
      throw new IllegalStateException("CoordinationContext has been shut down");
    }
  }
}
