/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration of the coordination metrics.
 *
 * <pre>{@code
 * management:
 *   metrics:
 *     coordination:
 *       enabled: true
 *       connection-name: orders
 *       max-cache-size: 1000
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Data
@ConfigurationProperties(prefix = "management.metrics.coordination")
public class CoordinationMetricsProperties {

  /** Enable Micrometer metrics. When disabled the core NOOP metrics are used. */
  private boolean enabled = true;

  /** Value of the {@code connection.name} tag on every coordination metric. */
  private String connectionName = "default";

  /**
   * Maximum cached counters. Each cron job adds three (one per outcome); every other primitive
   * needs a handful.
   */
  private int maxCacheSize = 1000;
}
