/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pool;

import com.macstab.oss.redis.coordination.CoordinationException;

import lombok.Getter;

/** Every pooled connection is in use and the pool is at its configured maximum. */
@Getter
public class PoolExhaustedException extends CoordinationException {

  private static final long serialVersionUID = 1L;

  private final int maxSize;

  public PoolExhaustedException(final int maxSize) {
    super("Pool size exceeded: all " + maxSize + " connections are in use");
    this.maxSize = maxSize;
  }
}
