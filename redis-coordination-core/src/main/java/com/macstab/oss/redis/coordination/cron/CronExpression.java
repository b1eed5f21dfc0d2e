/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.Value;

/**
 * Five-field cron expression: {@code minute hour date month weekday}.
 *
 * <table>
 *   <caption>Fields</caption>
 *   <tr><th>Field</th><th>Range</th></tr>
 *   <tr><td>minute</td><td>0-59</td></tr>
 *   <tr><td>hour</td><td>0-23</td></tr>
 *   <tr><td>date</td><td>1-31</td></tr>
 *   <tr><td>month</td><td>0-11 (January = 0)</td></tr>
 *   <tr><td>weekday</td><td>0-6 (Sunday = 0)</td></tr>
 * </table>
 *
 * <p>Month and weekday are zero-based, unlike classic crontab. {@code "0 12 * 0 1"} means noon on
 * every Monday in January. Date and weekday are combined with AND.
 *
 * <p>Macros: {@code @yearly} / {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily}
 * / {@code @midnight}, {@code @hourly}.
 */
@Value
public class CronExpression {

  private static final Pattern FIELD_SYNTAX = Pattern.compile("[*0-9/\\-,]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int FIELD_COUNT = 5;

  private static final Map<String, String> MACROS =
      Map.of(
          "@yearly", "0 0 1 0 *",
          "@annually", "0 0 1 0 *",
          "@monthly", "0 0 1 * *",
          "@weekly", "0 0 * * 0",
          "@daily", "0 0 * * *",
          "@midnight", "0 0 * * *",
          "@hourly", "0 * * * *");

  private static final CronExpression ALWAYS = fromCronString("* * * * *");

  CronField minute;
  CronField hour;
  CronField date;
  CronField month;
  CronField weekday;

  /** Matches every minute. */
  public static CronExpression always() {
    return ALWAYS;
  }

  /**
   * Parses and validates an expression or macro.
   *
   * @throws MalformedCronExpressionException on a wrong field count, a character outside {@code
   *     [*0-9/-,]}, or a value out of its field's bounds
   */
  public static CronExpression fromCronString(@NonNull final String cron) {
    final var trimmed = cron.trim();
    final var source = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);

    final var tokens = WHITESPACE.split(source);
    if (tokens.length != FIELD_COUNT) {
      throw new MalformedCronExpressionException(cron, cron);
    }
    for (final var token : tokens) {
      if (!FIELD_SYNTAX.matcher(token).matches()) {
        throw new MalformedCronExpressionException(cron, token);
      }
    }

    return new CronExpression(
        CronField.parse(tokens[0], CronField.Type.MINUTE, cron),
        CronField.parse(tokens[1], CronField.Type.HOUR, cron),
        CronField.parse(tokens[2], CronField.Type.DATE, cron),
        CronField.parse(tokens[3], CronField.Type.MONTH, cron),
        CronField.parse(tokens[4], CronField.Type.WEEKDAY, cron));
  }

  /** {@code true} if the wall-clock minute of {@code time}, in its own zone, matches all fields. */
  public boolean matches(@NonNull final ZonedDateTime time) {
    return minute.matches(time.getMinute())
        && hour.matches(time.getHour())
        && date.matches(time.getDayOfMonth())
        && month.matches(time.getMonthValue() - 1)
        && weekday.matches(time.getDayOfWeek().getValue() % 7);
  }

  @Override
  public String toString() {
    return String.join(
        " ",
        minute.toString(),
        hour.toString(),
        date.toString(),
        month.toString(),
        weekday.toString());
  }
}
