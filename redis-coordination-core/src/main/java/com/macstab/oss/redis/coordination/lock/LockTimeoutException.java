/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

import java.time.Duration;

import com.macstab.oss.redis.coordination.CoordinationException;

import lombok.Getter;

/** Waiting for a lock exceeded its deadline ({@code timeout + retrySleep}). */
@Getter
public class LockTimeoutException extends CoordinationException {

  private static final long serialVersionUID = 1L;

  private final String lockName;
  private final Duration timeout;

  public LockTimeoutException(final String lockName, final Duration timeout) {
    super("Timed out after " + timeout.toMillis() + "ms waiting for lock '" + lockName + "'");
    this.lockName = lockName;
    this.timeout = timeout;
  }
}
