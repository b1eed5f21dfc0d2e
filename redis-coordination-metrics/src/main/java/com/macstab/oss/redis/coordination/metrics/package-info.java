/* (C)2026 Macstab GmbH */

/**
 * Micrometer metrics integration for the coordination primitives.
 *
 * <h2>Purpose</h2>
 *
 * <p>Publishes what the locks, caches, rate limiters, pub/sub hub and cron scheduler do, so
 * contention (lock timeouts, stolen locks), cache effectiveness and rejected calls show up on
 * dashboards.
 *
 * <h2>Quick Start</h2>
 *
 * <pre>{@code
 * <dependency>
 *   <groupId>com.macstab.oss</groupId>
 *   <artifactId>redis-coordination-metrics</artifactId>
 *   <version>1.0.0</version>
 * </dependency>
 * }</pre>
 *
 * <p>With a {@code MeterRegistry} bean present (Spring Boot Actuator), metrics activate on their
 * own:
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     coordination:
 *       enabled: true            # default
 *       connection-name: orders  # tag value, default "default"
 * }</pre>
 *
 * <h2>Without Spring</h2>
 *
 * <pre>{@code
 * CoordinationMetrics metrics = new MicrometerCoordinationMetrics(registry, "orders");
 * CoordinationContext context =
 *     new CoordinationContext(
 *         connector, CoordinationSettings.defaults(), metrics, Clock.systemUTC());
 * }</pre>
 *
 * <p>See {@code MicrometerCoordinationMetrics} in the {@code micrometer} subpackage for the metric
 * catalog.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.redis.coordination.metrics;
