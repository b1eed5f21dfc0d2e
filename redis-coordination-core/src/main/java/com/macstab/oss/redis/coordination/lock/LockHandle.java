/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

import lombok.Value;

/**
 * Proof of a successful acquisition: the lock key and the token stored under it.
 *
 * <p>Only the holder of the matching token may delete the key, see {@link
 * DistributedLock#release(LockHandle)}.
 */
@Value
public class LockHandle {

  String key;

  String token;
}
