/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics.micrometer;

import lombok.experimental.UtilityClass;

/**
 * Metric names and tag keys of the Micrometer integration.
 *
 * <p><strong>Naming Convention:</strong> {@code redis.coordination.<primitive>.<measure>}.
 * Prometheus output replaces dots with underscores and appends {@code _total} to counters:
 *
 * <pre>
 * redis.coordination.lock.acquisitions → redis_coordination_lock_acquisitions_total
 * redis.coordination.pool.connections  → redis_coordination_pool_connections
 * </pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@UtilityClass
public class MetricsConfiguration {

  public static final String PREFIX = "redis.coordination";

  /** Gauge, tag {@code state} = {@code total} / {@code in_use}. */
  public static final String POOL_CONNECTIONS = PREFIX + ".pool.connections";

  /** Counter: acquires refused at capacity. */
  public static final String POOL_EXHAUSTED = PREFIX + ".pool.exhausted";

  /** Counter: store failures turned into empty results. */
  public static final String STORE_ERRORS = PREFIX + ".store.errors";

  /** Counter, tag {@code outcome} = acquired / unavailable / timeout. */
  public static final String LOCK_ACQUISITIONS = PREFIX + ".lock.acquisitions";

  /** Counter, tag {@code outcome} = released / expired / stolen. */
  public static final String LOCK_RELEASES = PREFIX + ".lock.releases";

  /** Counter, tag {@code result} = hit / miss / computed / timeout. */
  public static final String CACHE_LOOKUPS = PREFIX + ".cache.lookups";

  /** Counter, tag {@code outcome} = allowed / rejected. */
  public static final String RATE_LIMIT_DECISIONS = PREFIX + ".ratelimit.decisions";

  public static final String PUBSUB_PUBLISHED = PREFIX + ".pubsub.published";

  public static final String PUBSUB_DELIVERED = PREFIX + ".pubsub.delivered";

  public static final String PUBSUB_CALLBACK_FAILURES = PREFIX + ".pubsub.callback.failures";

  /** Gauge: topics with at least one local subscription. */
  public static final String PUBSUB_ACTIVE_TOPICS = PREFIX + ".pubsub.topics.active";

  /** Counter, tags {@code job} and {@code outcome} = executed / skipped / failed. */
  public static final String CRON_EXECUTIONS = PREFIX + ".cron.executions";

  // Tag keys
  public static final String TAG_CONNECTION_NAME = "connection.name";
  public static final String TAG_STATE = "state";
  public static final String TAG_OUTCOME = "outcome";
  public static final String TAG_RESULT = "result";
  public static final String TAG_JOB = "job";

  // Tag values
  public static final String STATE_TOTAL = "total";
  public static final String STATE_IN_USE = "in_use";
}
