/* (C)2026 Macstab GmbH */

/**
 * Spring Boot 3.x auto-configuration for the coordination primitives.
 *
 * <h2>Quick Start</h2>
 *
 * <p><strong>1. Add dependency (Maven):</strong>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss</groupId>
 *   <artifactId>redis-coordination-spring-boot-3-starter</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p><strong>2. Configure (application.yml):</strong>
 *
 * <pre>{@code
 * coordination:
 *   redis:
 *     host: redis.example.com
 *     lock:
 *       timeout: 10s
 * }</pre>
 *
 * <p><strong>3. Use:</strong>
 *
 * <pre>{@code
 * @Service
 * class InvoiceService {
 *     private final DistributedLock lock;
 *     private final RateLimiter rateLimiter;
 *
 *     void issue(String customer, long id) {
 *         rateLimiter.allow(customer, 100, Duration.ofMinutes(1));
 *         lock.withLock("invoice-" + id, () -> doIssue(id));
 *     }
 * }
 *
 * @Component
 * class NightlyReport extends CronJob {
 *     NightlyReport() {
 *         super(CronExpression.fromCronString("0 2 * * *"));  // SERIAL: one instance per night
 *     }
 *
 *     @Override
 *     public void run(ZonedDateTime now) { ... }
 * }
 * }</pre>
 *
 * <h2>Bean Graph</h2>
 *
 * <pre>
 * CoordinationProperties ──→ StoreConnector (LettuceStoreConnector)
 *                                  ↓
 * CoordinationMetrics ─────→ CoordinationContext
 *                                  ├─→ PooledStore
 *                                  ├─→ DistributedLock
 *                                  ├─→ CacheGuard
 *                                  ├─→ RateLimiter
 *                                  ├─→ PubSubHub
 *                                  └─→ CronScheduler ──→ CronJobLifecycle ←── CronJob beans
 * </pre>
 *
 * <p>On context close the cron jobs stop first (lifecycle), then the context shuts down, then the
 * connector is closed.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.redis.coordination.spring3;
