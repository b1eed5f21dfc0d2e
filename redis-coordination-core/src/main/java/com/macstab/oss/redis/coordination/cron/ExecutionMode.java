/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

/** How many instances of a fleet run a job for one matching minute. */
public enum ExecutionMode {

  /** Exactly one instance, elected through a non-waiting lock on {@code cronjob.<name>}. */
  SERIAL,

  /** Every running instance, independently. */
  PARALLEL
}
