/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

public enum JobState {
  STOPPED,
  RUNNING
}
