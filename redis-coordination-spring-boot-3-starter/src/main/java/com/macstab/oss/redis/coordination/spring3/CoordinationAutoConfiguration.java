/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.spring3;

import java.time.Clock;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.macstab.oss.redis.coordination.CoordinationContext;
import com.macstab.oss.redis.coordination.cache.CacheGuard;
import com.macstab.oss.redis.coordination.cron.CronJob;
import com.macstab.oss.redis.coordination.cron.CronScheduler;
import com.macstab.oss.redis.coordination.lock.DistributedLock;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.metrics.autoconfigure.CoordinationMetricsAutoConfiguration;
import com.macstab.oss.redis.coordination.pool.PooledStore;
import com.macstab.oss.redis.coordination.pubsub.PubSubHub;
import com.macstab.oss.redis.coordination.ratelimit.RateLimiter;
import com.macstab.oss.redis.coordination.store.LettuceStoreConnector;
import com.macstab.oss.redis.coordination.store.StoreConnector;

import io.lettuce.core.RedisClient;
import lombok.extern.slf4j.Slf4j;

/**
 * Auto-configuration of the coordination context and its primitives.
 *
 * <p><strong>Beans</strong> (each backs off when the application defines its own):
 *
 * <ul>
 *   <li>{@link StoreConnector} - a {@link LettuceStoreConnector} for {@code coordination.redis.*},
 *       closed by Spring
 *   <li>{@link CoordinationContext} - shut down on context close, before the connector
 *   <li>{@link PooledStore}, {@link DistributedLock}, {@link CacheGuard}, {@link RateLimiter},
 *       {@link PubSubHub}, {@link CronScheduler} - the context's components; their lifecycle
 *       belongs to the context, so Spring calls no destroy method on them
 *   <li>{@link CronJobLifecycle} - starts every {@link CronJob} bean, unless {@code
 *       coordination.redis.cron.enabled=false}
 * </ul>
 *
 * <p>Metrics come from the {@link CoordinationMetrics} bean if one exists (see {@link
 * CoordinationMetricsAutoConfiguration}), otherwise {@link CoordinationMetrics#NOOP}.
 *
 * @see CoordinationProperties
 */
@Slf4j
@AutoConfiguration(after = CoordinationMetricsAutoConfiguration.class)
@ConditionalOnClass(RedisClient.class)
@EnableConfigurationProperties(CoordinationProperties.class)
public class CoordinationAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(StoreConnector.class)
  public StoreConnector coordinationStoreConnector(final CoordinationProperties properties) {
    return new LettuceStoreConnector(properties.toEndpoint(), properties.toReconnectPolicy());
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean(CoordinationContext.class)
  public CoordinationContext coordinationContext(
      final StoreConnector connector,
      final CoordinationProperties properties,
      final ObjectProvider<CoordinationMetrics> metrics) {

    final var resolvedMetrics = metrics.getIfAvailable(() -> CoordinationMetrics.NOOP);

    if (log.isInfoEnabled()) {
      log.info(
          "Coordination context for {}:{} (pool size {}, metrics={})",
          properties.getHost(),
          properties.getPort(),
          properties.getPoolSize(),
          resolvedMetrics == CoordinationMetrics.NOOP ? "disabled" : "enabled");
    }

    return new CoordinationContext(
        connector, properties.toSettings(), resolvedMetrics, Clock.systemUTC());
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(PooledStore.class)
  public PooledStore coordinationPooledStore(final CoordinationContext context) {
    return context.getStore();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(DistributedLock.class)
  public DistributedLock coordinationLock(final CoordinationContext context) {
    return context.getLock();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(CacheGuard.class)
  public CacheGuard coordinationCacheGuard(final CoordinationContext context) {
    return context.getCacheGuard();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(RateLimiter.class)
  public RateLimiter coordinationRateLimiter(final CoordinationContext context) {
    return context.getRateLimiter();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(PubSubHub.class)
  public PubSubHub coordinationPubSubHub(final CoordinationContext context) {
    return context.getPubSubHub();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(CronScheduler.class)
  public CronScheduler coordinationCronScheduler(final CoordinationContext context) {
    return context.getCronScheduler();
  }

  @Bean
  @ConditionalOnMissingBean(CronJobLifecycle.class)
  @ConditionalOnProperty(
      prefix = "coordination.redis.cron",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public CronJobLifecycle coordinationCronJobLifecycle(
      final CronScheduler scheduler, final ObjectProvider<CronJob> jobs) {
    return new CronJobLifecycle(scheduler, jobs);
  }
}
