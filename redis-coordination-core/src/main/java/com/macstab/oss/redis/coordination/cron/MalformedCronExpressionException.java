/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import com.macstab.oss.redis.coordination.CoordinationException;

import lombok.Getter;

/** A cron expression failed syntax or bounds validation; {@link #getToken()} is the culprit. */
@Getter
public class MalformedCronExpressionException extends CoordinationException {

  private static final long serialVersionUID = 1L;

  private final String expression;
  private final String token;

  public MalformedCronExpressionException(final String expression, final String token) {
    super("Malformed cron expression '" + expression + "': unexpected value '" + token + "'");
    this.expression = expression;
    this.token = token;
  }
}
