/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.macstab.oss.redis.coordination.CoordinationSettings;
import com.macstab.oss.redis.coordination.lock.DistributedLock;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs {@link CronJob}s on one shared daemon thread.
 *
 * <p>All jobs tick on the same thread, so a slow job delays the ticks of the others (not the
 * minute they fire for, as long as it finishes within the minute). Jobs that do heavy work should
 * hand it off to their own executor.
 *
 * <pre>{@code
 * CronScheduler scheduler = context.getCronScheduler();
 * ScheduledCronJob handle = scheduler.schedule(new NightlyCleanup());
 * ...
 * handle.stop();
 * }</pre>
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public final class CronScheduler {

  static final String THREAD_NAME = "coordination-cron";

  @Getter(AccessLevel.PACKAGE)
  private final DistributedLock lock;

  private final CoordinationMetrics metrics;
  private final Clock clock;
  @Getter private final ZoneId zone;

  @Getter(AccessLevel.PACKAGE)
  private final Duration tickInterval;

  @Getter(AccessLevel.PACKAGE)
  private final Duration lockTtl;

  @Getter(AccessLevel.PACKAGE)
  private final ScheduledExecutorService executor;

  private final CopyOnWriteArrayList<ScheduledCronJob> jobs = new CopyOnWriteArrayList<>();
  private volatile boolean shutdown;

  public CronScheduler(
      @NonNull final DistributedLock lock,
      @NonNull final CoordinationMetrics metrics,
      @NonNull final Clock clock,
      @NonNull final CoordinationSettings settings) {
    if (settings.getCronTickInterval().isNegative() || settings.getCronTickInterval().isZero()) {
      throw new IllegalArgumentException(
          "cronTickInterval must be positive, got: " + settings.getCronTickInterval());
    }
    this.lock = lock;
    this.metrics = metrics;
    this.clock = clock;
    this.zone = settings.getCronZone();
    this.tickInterval = settings.getCronTickInterval();
    this.lockTtl = settings.getCronLockTtl();
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat(THREAD_NAME).setDaemon(true).build());
  }

  /** Registers a job without starting it. */
  public ScheduledCronJob register(@NonNull final CronJob job) {
    checkNotShutdown();
    final var scheduled = new ScheduledCronJob(job, this, metrics);
    jobs.add(scheduled);
    log.debug("Registered cron job {}", job.getName());
    return scheduled;
  }

  /** Registers and starts a job. */
  public ScheduledCronJob schedule(@NonNull final CronJob job) {
    final var scheduled = register(job);
    scheduled.start();
    return scheduled;
  }

  public List<ScheduledCronJob> getJobs() {
    return List.copyOf(jobs);
  }

  public boolean isShutdown() {
    return shutdown;
  }

  /** Stops every job and the tick thread. Idempotent. */
  public void shutdown() {
    if (shutdown) {
      return;
    }
    shutdown = true;

    for (final var job : jobs) {
      job.stop();
    }
    jobs.clear();

    executor.shutdown();
    try {
      if (!executor.awaitTermination(tickInterval.toMillis() * 5, TimeUnit.MILLISECONDS)) {
        log.warn("Cron thread did not finish in time, interrupting running job");
        executor.shutdownNow();
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    log.info("Cron scheduler shut down");
  }

  ZonedDateTime now() {
    return ZonedDateTime.now(clock).withZoneSameInstant(zone);
  }

  private void checkNotShutdown() {
    if (shutdown) {
      throw new IllegalStateException("CronScheduler has been shut down");
    }
  }
}
