/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.ratelimit;

import java.time.Duration;

import com.macstab.oss.redis.coordination.CoordinationException;

import lombok.Getter;

/** The current fixed window of a rate limit key is used up. */
@Getter
public class RateLimitExceededException extends CoordinationException {

  private static final long serialVersionUID = 1L;

  private final String key;
  private final long limit;
  private final Duration resolution;

  public RateLimitExceededException(final String key, final long limit, final Duration resolution) {
    super(
        "Rate limit exceeded for '"
            + key
            + "': more than "
            + limit
            + " calls per "
            + resolution.toMillis()
            + "ms");
    this.key = key;
    this.limit = limit;
    this.resolution = resolution;
  }
}
