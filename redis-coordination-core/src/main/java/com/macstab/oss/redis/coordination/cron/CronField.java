/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.Value;

/**
 * One expanded field of a {@link CronExpression}: either a wildcard or a set of allowed values.
 *
 * <p>Accepted syntax per comma-separated part: {@code N}, {@code A-B} (inclusive, {@code A <= B})
 * and {@code *}{@code /N} (every Nth value from 0 up to the field maximum; on the date field the
 * 0 never matches). A lone {@code *} is the wildcard; {@code *} inside a list is rejected.
 */
@Value
public class CronField {

  /** Field positions with their bounds. Month and weekday are zero-based, Sunday is 0. */
  @Getter
  @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
  public enum Type {
    MINUTE(0, 59),
    HOUR(0, 23),
    DATE(1, 31),
    MONTH(0, 11),
    WEEKDAY(0, 6);

    private final int min;
    private final int max;
  }

  private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
  private static final String WILDCARD = "*";
  private static final String STEP_PREFIX = "*/";

  Type type;

  boolean wildcard;

  SortedSet<Integer> values;

  public static CronField wildcard(final Type type) {
    return new CronField(type, true, Collections.emptySortedSet());
  }

  /**
   * Expands one field token.
   *
   * @param expression whole expression, for error reporting
   * @throws MalformedCronExpressionException naming the offending part
   */
  static CronField parse(final String token, final Type type, final String expression) {
    if (WILDCARD.equals(token)) {
      return wildcard(type);
    }

    final var values = new TreeSet<Integer>();
    for (final var part : token.split(",", -1)) {
      if (part.startsWith(STEP_PREFIX)) {
        final var step = parseNumber(part.substring(STEP_PREFIX.length()), part, expression);
        if (step < 1 || step > type.getMax()) {
          throw new MalformedCronExpressionException(expression, part);
        }
        for (int value = 0; value <= type.getMax(); value += step) {
          values.add(value);
        }
      } else if (part.indexOf('-') >= 0) {
        final var bounds = part.split("-", -1);
        if (bounds.length != 2) {
          throw new MalformedCronExpressionException(expression, part);
        }
        final var start = parseNumber(bounds[0], part, expression);
        final var end = parseNumber(bounds[1], part, expression);
        if (start < type.getMin() || end > type.getMax() || start > end) {
          throw new MalformedCronExpressionException(expression, part);
        }
        for (int value = start; value <= end; value++) {
          values.add(value);
        }
      } else {
        final var value = parseNumber(part, part, expression);
        if (value < type.getMin() || value > type.getMax()) {
          throw new MalformedCronExpressionException(expression, part);
        }
        values.add(value);
      }
    }
    return new CronField(type, false, Collections.unmodifiableSortedSet(values));
  }

  public boolean matches(final int value) {
    return wildcard || values.contains(value);
  }

  @Override
  public String toString() {
    if (wildcard) {
      return WILDCARD;
    }
    final var joined = new StringBuilder();
    for (final var value : values) {
      if (joined.length() > 0) {
        joined.append(',');
      }
      joined.append(value);
    }
    return joined.toString();
  }

  private static int parseNumber(final String text, final String part, final String expression) {
    if (!NUMBER.matcher(text).matches()) {
      throw new MalformedCronExpressionException(expression, part);
    }
    return Integer.parseInt(text);
  }
}
