/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

/** Outcome of {@link StoreConnection#compareAndDelete(String, String)}. */
public enum CompareAndDeleteResult {

  /** The stored value matched the expected one and the key was removed. */
  DELETED,

  /** The key did not exist (expired or never written). */
  ABSENT,

  /** The key holds a different value; nothing was removed. */
  MISMATCH
}
