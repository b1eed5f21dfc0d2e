/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

/** Result of {@link DistributedLock#release(LockHandle)}. None of them is an error. */
public enum ReleaseOutcome {

  /** The key still held our token and was deleted. */
  RELEASED,

  /** The key had already expired. */
  EXPIRED,

  /** The key expired and was re-acquired by another holder; it was left alone. */
  STOLEN,

  /** The store could not be reached; the key expires on its own. */
  UNREACHABLE
}
