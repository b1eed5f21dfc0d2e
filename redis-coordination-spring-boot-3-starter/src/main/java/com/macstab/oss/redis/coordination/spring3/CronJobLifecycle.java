/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.spring3;

import java.util.ArrayList;
import java.util.List;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;

import com.macstab.oss.redis.coordination.cron.CronJob;
import com.macstab.oss.redis.coordination.cron.CronScheduler;
import com.macstab.oss.redis.coordination.cron.ScheduledCronJob;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Starts every {@link CronJob} bean after the context is refreshed and stops them on close.
 *
 * <p>Jobs are registered once, on the first {@link #start()}; a restart of the lifecycle resumes
 * the same handles. Runs in the default phase, so it stops before lower-phase beans such as web
 * servers shut down.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
public class CronJobLifecycle implements SmartLifecycle {

  private final CronScheduler scheduler;
  private final ObjectProvider<CronJob> jobs;
  private final List<ScheduledCronJob> handles = new ArrayList<>();

  private volatile boolean running;

  public CronJobLifecycle(
      @NonNull final CronScheduler scheduler, @NonNull final ObjectProvider<CronJob> jobs) {
    this.scheduler = scheduler;
    this.jobs = jobs;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    if (handles.isEmpty()) {
      jobs.orderedStream().forEach(job -> handles.add(scheduler.register(job)));
    }
    handles.forEach(ScheduledCronJob::start);
    running = true;

    if (log.isInfoEnabled()) {
      log.info("Started {} cron jobs", handles.size());
    }
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    handles.forEach(ScheduledCronJob::stop);
    running = false;
    log.info("Stopped {} cron jobs", handles.size());
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Registered job handles, in bean order. */
  public synchronized List<ScheduledCronJob> getHandles() {
    return List.copyOf(handles);
  }
}
