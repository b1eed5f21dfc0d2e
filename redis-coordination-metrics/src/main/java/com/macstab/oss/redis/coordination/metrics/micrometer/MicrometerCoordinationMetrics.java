/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics.micrometer;

import static com.macstab.oss.redis.coordination.metrics.micrometer.MetricsConfiguration.*;

import java.util.concurrent.atomic.AtomicInteger;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer implementation of {@link CoordinationMetrics}.
 *
 * <p>Every meter carries the {@code connection.name} tag so several coordination contexts (for
 * example one per Redis deployment) can share one registry.
 *
 * <table>
 *   <caption>Metric Summary</caption>
 *   <thead>
 *     <tr><th>Metric</th><th>Type</th><th>Extra tags</th></tr>
 *   </thead>
 *   <tbody>
 *     <tr><td>{@code redis.coordination.pool.connections}</td><td>Gauge</td>
 *         <td>state</td></tr>
 *     <tr><td>{@code redis.coordination.pool.exhausted}</td><td>Counter</td><td></td></tr>
 *     <tr><td>{@code redis.coordination.store.errors}</td><td>Counter</td><td></td></tr>
 *     <tr><td>{@code redis.coordination.lock.acquisitions}</td><td>Counter</td>
 *         <td>outcome</td></tr>
 *     <tr><td>{@code redis.coordination.lock.releases}</td><td>Counter</td>
 *         <td>outcome</td></tr>
 *     <tr><td>{@code redis.coordination.cache.lookups}</td><td>Counter</td>
 *         <td>result</td></tr>
 *     <tr><td>{@code redis.coordination.ratelimit.decisions}</td><td>Counter</td>
 *         <td>outcome</td></tr>
 *     <tr><td>{@code redis.coordination.pubsub.published}</td><td>Counter</td><td></td></tr>
 *     <tr><td>{@code redis.coordination.pubsub.delivered}</td><td>Counter</td><td></td></tr>
 *     <tr><td>{@code redis.coordination.pubsub.callback.failures}</td><td>Counter</td>
 *         <td></td></tr>
 *     <tr><td>{@code redis.coordination.pubsub.topics.active}</td><td>Gauge</td><td></td></tr>
 *     <tr><td>{@code redis.coordination.cron.executions}</td><td>Counter</td>
 *         <td>job, outcome</td></tr>
 *   </tbody>
 * </table>
 *
 * <p><strong>Lifecycle:</strong> {@link #close()} unregisters the gauges (they hold strong
 * references) and turns every recording method into a no-op. Idempotent, never throws.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class MicrometerCoordinationMetrics implements CoordinationMetrics {

  static final int DEFAULT_MAX_CACHE_SIZE = 1000;

  private final MetricCache cache;
  @Getter private final String connectionName;

  private volatile boolean closed;

  /**
   * Creates Micrometer metrics collector.
   *
   * @param registry Micrometer meter registry
   * @param connectionName value of the {@code connection.name} tag
   * @param maxCacheSize maximum cached counters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  public MicrometerCoordinationMetrics(
      @NonNull final MeterRegistry registry,
      @NonNull final String connectionName,
      final int maxCacheSize) {
    this.cache = new MetricCache(registry, maxCacheSize);
    this.connectionName = connectionName;

    log.debug(
        "Created MicrometerCoordinationMetrics for connection '{}' (maxCacheSize: {})",
        connectionName,
        maxCacheSize);
  }

  public MicrometerCoordinationMetrics(
      @NonNull final MeterRegistry registry, @NonNull final String connectionName) {
    this(registry, connectionName, DEFAULT_MAX_CACHE_SIZE);
  }

  @Override
  public void recordPoolConnections(final int total, final int inUse) {
    if (closed) {
      return;
    }
    poolGauge(STATE_TOTAL).set(total);
    poolGauge(STATE_IN_USE).set(inUse);
  }

  @Override
  public void recordPoolExhausted() {
    increment(POOL_EXHAUSTED, "Acquires refused because the pool was at capacity");
  }

  @Override
  public void recordStoreError() {
    increment(STORE_ERRORS, "Store failures turned into empty results");
  }

  @Override
  public void recordLockAcquisition(final String outcome) {
    increment(LOCK_ACQUISITIONS, "Finished lock acquisition attempts", TAG_OUTCOME, outcome);
  }

  @Override
  public void recordLockRelease(final String outcome) {
    increment(LOCK_RELEASES, "Finished lock releases", TAG_OUTCOME, outcome);
  }

  @Override
  public void recordCacheLookup(final String result) {
    increment(CACHE_LOOKUPS, "Cache guard lookups", TAG_RESULT, result);
  }

  @Override
  public void recordRateLimitDecision(final String outcome) {
    increment(RATE_LIMIT_DECISIONS, "Rate limiter decisions", TAG_OUTCOME, outcome);
  }

  @Override
  public void recordPublished() {
    increment(PUBSUB_PUBLISHED, "Messages published through the hub");
  }

  @Override
  public void recordDelivered() {
    increment(PUBSUB_DELIVERED, "Messages handed to local callbacks");
  }

  @Override
  public void recordCallbackFailure() {
    increment(PUBSUB_CALLBACK_FAILURES, "Local callbacks that threw");
  }

  @Override
  public void setActiveTopics(final int count) {
    if (closed) {
      return;
    }
    cache
        .gauge(
            PUBSUB_ACTIVE_TOPICS,
            "Topics with at least one local subscription",
            TAG_CONNECTION_NAME,
            connectionName)
        .set(count);
  }

  @Override
  public void recordCronExecution(final String job, final String outcome) {
    increment(
        CRON_EXECUTIONS, "Cron job minutes that matched", TAG_JOB, job, TAG_OUTCOME, outcome);
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;

    try {
      cache.removeGauges();
      log.info("Closed MicrometerCoordinationMetrics for connection '{}'", connectionName);
    } catch (final RuntimeException e) {
      log.error("Error during metrics cleanup for connection '{}'", connectionName, e);
    }
  }

  int getCacheSize() {
    return cache.getCacheSize();
  }

  // ==================== Private Methods ====================

  private void increment(final String name, final String description, final String... tags) {
    if (closed) {
      return;
    }
    final var tagPairs = new String[tags.length + 2];
    tagPairs[0] = TAG_CONNECTION_NAME;
    tagPairs[1] = connectionName;
    System.arraycopy(tags, 0, tagPairs, 2, tags.length);
    cache.counter(name, description, tagPairs).increment();
  }

  private AtomicInteger poolGauge(final String state) {
    return cache.gauge(
        POOL_CONNECTIONS,
        "Pooled store connections",
        TAG_CONNECTION_NAME,
        connectionName,
        TAG_STATE,
        state);
  }
}
