/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.spring3;

import java.time.Duration;
import java.time.ZoneId;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.macstab.oss.redis.coordination.CoordinationSettings;
import com.macstab.oss.redis.coordination.store.ReconnectPolicy;
import com.macstab.oss.redis.coordination.store.RedisEndpoint;

import lombok.Getter;
import lombok.Setter;

/**
 * Configuration properties of the coordination context.
 *
 * <pre>{@code
 * coordination:
 *   redis:
 *     host: redis.internal
 *     port: 6379
 *     password: secret
 *     database: 0
 *     pool-size: 10
 *     pool-acquire-timeout: 0       # 0 = fail fast when exhausted
 *     retry:
 *       max-attempts: 10
 *       base-sleep-time: 1s
 *       max-sleep-time: 1m
 *     lock:
 *       timeout: 10s
 *       retry-sleep: 500ms
 *     cron:
 *       enabled: true
 *       tick-interval: 1s
 *       lock-ttl: 45s
 *       zone: Europe/Berlin         # default: system zone
 * }</pre>
 *
 * <p>Durations accept Spring Boot's formats ({@code 500ms}, {@code 1s}, {@code 1m}, ISO-8601).
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "coordination.redis")
public class CoordinationProperties {

  public static final int MIN_POOL_SIZE = 1;

  private String host = "localhost";

  private int port = 6379;

  private String password;

  private int database;

  /** Maximum pooled connections, at least {@value #MIN_POOL_SIZE}. */
  private int poolSize = 10;

  /** 0 to fail immediately when the pool is exhausted, otherwise maximum wait. */
  private Duration poolAcquireTimeout = Duration.ZERO;

  private final Retry retry = new Retry();

  private final Lock lock = new Lock();

  private final Cron cron = new Cron();

  public void setPoolSize(final int poolSize) {
    this.poolSize = Math.max(MIN_POOL_SIZE, poolSize);
  }

  RedisEndpoint toEndpoint() {
    return RedisEndpoint.builder()
        .host(host)
        .port(port)
        .password(password)
        .database(database)
        .build();
  }

  ReconnectPolicy toReconnectPolicy() {
    return ReconnectPolicy.builder()
        .maxAttempts(retry.getMaxAttempts())
        .baseSleep(retry.getBaseSleepTime())
        .maxSleep(retry.getMaxSleepTime())
        .build();
  }

  CoordinationSettings toSettings() {
    final var builder =
        CoordinationSettings.builder()
            .poolSize(poolSize)
            .poolAcquireTimeout(poolAcquireTimeout)
            .lockTimeout(lock.getTimeout())
            .lockRetrySleep(lock.getRetrySleep())
            .cronTickInterval(cron.getTickInterval())
            .cronLockTtl(cron.getLockTtl());
    if (cron.getZone() != null) {
      builder.cronZone(cron.getZone());
    }
    return builder.build();
  }

  /** Reconnect backoff: {@code min(base × 2^attempt, max)}. */
  @Getter
  @Setter
  public static class Retry {

    private int maxAttempts = 10;

    private Duration baseSleepTime = Duration.ofSeconds(1);

    private Duration maxSleepTime = Duration.ofMinutes(1);
  }

  /** Defaults for {@code DistributedLock.acquire(name)} and {@code withLock(name, ...)}. */
  @Getter
  @Setter
  public static class Lock {

    /** Lock TTL and wait budget. */
    private Duration timeout = Duration.ofSeconds(10);

    private Duration retrySleep = Duration.ofMillis(500);
  }

  @Getter
  @Setter
  public static class Cron {

    /** Register and start every {@code CronJob} bean on context refresh. */
    private boolean enabled = true;

    private Duration tickInterval = Duration.ofSeconds(1);

    /** TTL of the lock a serial job holds for the minute it ran. */
    private Duration lockTtl = Duration.ofSeconds(45);

    /** Zone cron expressions are matched in; {@code null} for the system default. */
    private ZoneId zone;
  }
}
