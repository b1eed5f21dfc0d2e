/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * A {@link CronJob} registered with a {@link CronScheduler}.
 *
 * <p><strong>State machine:</strong> {@code STOPPED -> start() -> RUNNING -> stop() -> STOPPED}.
 * While running, every tick computes the epoch-minute bucket; the job fires when the bucket is
 * past {@link #getLastFiredMinute()} and the expression matches the wall-clock minute. The first
 * tick after creation only records the current bucket, so a job never fires for the minute it was
 * started in.
 *
 * <p>{@link #stop()} may be called while a run is in progress; that run completes, no further tick
 * is scheduled.
 */
@Slf4j
public final class ScheduledCronJob {

  static final String LOCK_PREFIX = "cronjob.";

  private static final long UNSET = Long.MIN_VALUE;

  @Getter private final CronJob job;
  private final CronScheduler scheduler;
  private final CoordinationMetrics metrics;

  private final Object monitor = new Object();

  // guarded by monitor
  private ScheduledFuture<?> ticks;

  @Getter private volatile JobState state = JobState.STOPPED;
  private volatile long lastFiredMinute = UNSET;

  ScheduledCronJob(
      final CronJob job, final CronScheduler scheduler, final CoordinationMetrics metrics) {
    this.job = job;
    this.scheduler = scheduler;
    this.metrics = metrics;
  }

  /** Starts ticking. No-op when already running. */
  public void start() {
    synchronized (monitor) {
      if (state == JobState.RUNNING) {
        return;
      }
      final var interval = scheduler.getTickInterval().toMillis();
      ticks =
          scheduler
              .getExecutor()
              .scheduleAtFixedRate(this::tickSafely, 0, interval, TimeUnit.MILLISECONDS);
      state = JobState.RUNNING;
      log.info("Started cron job {} ({}, {})", job.getName(), job.getExpression(), job.getMode());
    }
  }

  /** Stops ticking. No-op when already stopped. */
  public void stop() {
    synchronized (monitor) {
      if (state == JobState.STOPPED) {
        return;
      }
      ticks.cancel(false);
      ticks = null;
      state = JobState.STOPPED;
      log.info("Stopped cron job {}", job.getName());
    }
  }

  /** Epoch minute of the last run, or of the first tick if it never ran; -1 before any tick. */
  public long getLastFiredMinute() {
    final var last = lastFiredMinute;
    return last == UNSET ? -1 : last;
  }

  /** Lock name contended in serial mode. */
  public String getLockName() {
    return LOCK_PREFIX + job.getName();
  }

  // ==================== Private Methods ====================

  private void tickSafely() {
    if (state != JobState.RUNNING) {
      return;
    }
    try {
      tick(scheduler.now());
    } catch (final RuntimeException e) {
      // lock or store failure; the next tick retries
      log.error("Cron tick for {} failed: {}", job.getName(), e.getMessage(), e);
    }
  }

  /** One scheduler tick at {@code now}. */
  void tick(final ZonedDateTime now) {
    final var minute = now.toEpochSecond() / 60;
    if (lastFiredMinute == UNSET) {
      lastFiredMinute = minute;
      return;
    }
    if (minute <= lastFiredMinute || !job.getExpression().matches(now)) {
      return;
    }
    lastFiredMinute = minute;

    if (job.getMode() == ExecutionMode.SERIAL && !winsLock()) {
      metrics.recordCronExecution(job.getName(), CoordinationMetrics.OUTCOME_SKIPPED);
      log.debug("Cron job {} runs elsewhere this minute", job.getName());
      return;
    }
    execute(now);
  }

  private boolean winsLock() {
    // never released: the TTL keeps other instances out for the rest of the minute
    return scheduler.getLock().tryAcquire(getLockName(), scheduler.getLockTtl()).isPresent();
  }

  private void execute(final ZonedDateTime now) {
    if (log.isDebugEnabled()) {
      log.debug("Running cron job {} for {}", job.getName(), now);
    }
    try {
      job.run(now);
      metrics.recordCronExecution(job.getName(), CoordinationMetrics.OUTCOME_EXECUTED);
    } catch (final RuntimeException e) {
      metrics.recordCronExecution(job.getName(), CoordinationMetrics.OUTCOME_FAILED);
      log.error("Cron job {} failed: {}", job.getName(), e.getMessage(), e);
    }
  }
}
