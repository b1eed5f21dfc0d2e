/* (C)2026 Macstab GmbH */

/**
 * Redis-backed coordination primitives for a fleet of service instances (no Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Lets independent processes that share one Redis server agree on who does what and when:
 *
 * <ul>
 *   <li><strong>Connection pool</strong> ({@link com.macstab.oss.redis.coordination.pool}):
 *       bounded set of exclusive connections, one in-flight operation each.
 *   <li><strong>Distributed lock</strong> ({@link com.macstab.oss.redis.coordination.lock}):
 *       {@code SET NX PX} with a per-acquisition token and compare-and-delete release.
 *   <li><strong>Cache guard</strong> ({@link com.macstab.oss.redis.coordination.cache}):
 *       read-through cache that recomputes a missing value once across the fleet.
 *   <li><strong>Rate limiter</strong> ({@link com.macstab.oss.redis.coordination.ratelimit}):
 *       fixed-window counters.
 *   <li><strong>Pub/sub hub</strong> ({@link com.macstab.oss.redis.coordination.pubsub}): many
 *       local callbacks per topic over one subscriber connection, plus shared variables.
 *   <li><strong>Cron scheduler</strong> ({@link com.macstab.oss.redis.coordination.cron}):
 *       minute-resolution jobs, run once per fleet (serial) or on every instance (parallel).
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │ CoordinationContext                                          │
 * │   CacheGuard ──→ DistributedLock ──┐        CronScheduler    │
 * │   RateLimiter ─────────────────────┤             │           │
 * │   PooledStore ─────────────────────┼──→ ConnectionPool       │
 * │   PubSubHub ── publish ────────────┘             │           │
 * │      └── one SubscriberConnection                │           │
 * └──────────────┬───────────────────────────────────┼───────────┘
 *                ↓                                   ↓
 *          StoreConnector (LettuceStoreConnector: reconnect with backoff)
 *                ↓
 *              Redis
 * </pre>
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * CoordinationContext context =
 *     CoordinationContext.create(
 *         RedisEndpoint.builder().host("redis").build(),
 *         ReconnectPolicy.defaults(),
 *         CoordinationSettings.defaults());
 *
 * Optional<String> report =
 *     context.getCacheGuard()
 *         .getOrCompute("daily-report", Duration.ofHours(1), Duration.ofSeconds(30), this::render);
 *
 * context.getRateLimiter().allow("api:" + userId, 100, Duration.ofMinutes(1));
 * }</pre>
 *
 * <h2>Failure Model</h2>
 *
 * <p>Store connection failures are logged and absorbed at the pool boundary: reads return empty,
 * writes return {@code false}, lock acquisition reports "not acquired", the rate limiter lets the
 * call through. Contract violations (lock timeout, pool exhaustion, rate limit, malformed cron
 * expression) are thrown as subtypes of {@link
 * com.macstab.oss.redis.coordination.CoordinationException}.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.redis.coordination;
