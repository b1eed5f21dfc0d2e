/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import java.time.Duration;

import io.lettuce.core.resource.Delay;
import lombok.NonNull;

/**
 * Lettuce reconnect {@link Delay} driven by a {@link ReconnectPolicy}.
 *
 * <p>Lettuce's {@code ConnectionWatchdog} asks for a delay before every reconnect attempt. The
 * watchdog itself never gives up; abandoning after {@link ReconnectPolicy#getMaxAttempts()} is
 * done by {@link LettuceStoreConnector} on {@code ReconnectFailedEvent}.
 */
final class BackoffDelay extends Delay {

  private final ReconnectPolicy policy;

  BackoffDelay(@NonNull final ReconnectPolicy policy) {
    this.policy = policy;
  }

  @Override
  public Duration createDelay(final long attempt) {
    return policy.delayFor(attempt);
  }
}
