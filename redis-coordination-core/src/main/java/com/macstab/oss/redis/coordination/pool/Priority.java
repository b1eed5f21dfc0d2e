/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pool;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Sorted-set score used by the priority queue operations of {@link PooledStore}. */
@Getter
@RequiredArgsConstructor
public enum Priority {
  LOW(1),
  NORMAL(5),
  HIGH(10);

  private final int score;
}
