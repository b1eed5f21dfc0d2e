/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination;

/**
 * Base type of every failure raised by the coordination primitives.
 *
 * <p>All subtypes are unchecked. Callers that want a single catch site for "the coordination layer
 * refused" catch this type; callers that care about the reason catch the specific subtype (lock
 * timeout, pool exhaustion, rate limit, malformed cron expression, store connection failure).
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public class CoordinationException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public CoordinationException(final String message) {
    super(message);
  }

  public CoordinationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
