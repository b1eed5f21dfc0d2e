/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import java.time.ZonedDateTime;

import lombok.Getter;
import lombok.NonNull;

/**
 * A periodic task with one-minute resolution.
 *
 * <pre>{@code
 * public class NightlyCleanup extends CronJob {
 *   public NightlyCleanup() {
 *     super(CronExpression.fromCronString("30 2 * * *"));
 *   }
 *
 *   @Override
 *   public void run(ZonedDateTime now) {
 *     ...
 *   }
 * }
 * }</pre>
 *
 * <p>The job's name identifies it across the fleet: in {@link ExecutionMode#SERIAL} mode every
 * instance competes for the lock {@code cronjob.<name>}. Override {@link #getName()} when two job
 * classes share a simple name.
 */
@Getter
public abstract class CronJob {

  private final CronExpression expression;
  private final ExecutionMode mode;

  protected CronJob(@NonNull final CronExpression expression) {
    this(expression, ExecutionMode.SERIAL);
  }

  protected CronJob(@NonNull final CronExpression expression, @NonNull final ExecutionMode mode) {
    this.expression = expression;
    this.mode = mode;
  }

  /** Fleet-wide identity; defaults to the simple class name. */
  public String getName() {
    final var simpleName = getClass().getSimpleName();
    return simpleName.isEmpty() ? getClass().getName() : simpleName;
  }

  /**
   * Job body. Exceptions are logged by the scheduler and do not stop later runs.
   *
   * @param now the matching minute, in the scheduler's zone
   */
  public abstract void run(ZonedDateTime now);
}
