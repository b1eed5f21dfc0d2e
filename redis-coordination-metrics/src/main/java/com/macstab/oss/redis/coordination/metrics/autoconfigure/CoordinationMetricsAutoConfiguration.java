/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics.autoconfigure;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.metrics.micrometer.MicrometerCoordinationMetrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Spring Boot auto-configuration publishing coordination metrics to Micrometer.
 *
 * <p><strong>Activation Conditions:</strong>
 *
 * <ol>
 *   <li>{@code MeterRegistry.class} on classpath
 *   <li>{@code MeterRegistry} bean exists (Actuator or user-defined)
 *   <li>{@code management.metrics.coordination.enabled=true} (default)
 *   <li>No user-defined {@link CoordinationMetrics} bean
 * </ol>
 *
 * <p>Otherwise {@link CoordinationMetrics#NOOP} is registered. The bean is not closed by Spring;
 * the {@code CoordinationContext} that uses it closes it on shutdown.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
@AutoConfiguration(
    afterName =
        "org.springframework.boot.actuate.autoconfigure.metrics."
            + "CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@EnableConfigurationProperties(CoordinationMetricsProperties.class)
public class CoordinationMetricsAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnProperty(
      prefix = "management.metrics.coordination",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(CoordinationMetrics.class)
  public CoordinationMetrics micrometerCoordinationMetrics(
      final MeterRegistry registry, final CoordinationMetricsProperties properties) {

    log.info(
        "Activating coordination metrics (Micrometer) - connection: '{}', maxCacheSize: {}",
        properties.getConnectionName(),
        properties.getMaxCacheSize());

    return new MicrometerCoordinationMetrics(
        registry, properties.getConnectionName(), properties.getMaxCacheSize());
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(CoordinationMetrics.class)
  public CoordinationMetrics noOpCoordinationMetrics() {
    log.debug("Coordination metrics disabled - using NOOP singleton");
    return CoordinationMetrics.NOOP;
  }
}
