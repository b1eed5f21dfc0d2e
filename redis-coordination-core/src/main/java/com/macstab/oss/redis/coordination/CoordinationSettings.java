/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination;

import java.time.Duration;
import java.time.ZoneId;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning of the coordination primitives.
 *
 * <table>
 *   <caption>Defaults</caption>
 *   <tr><th>Setting</th><th>Default</th><th>Meaning</th></tr>
 *   <tr><td>poolSize</td><td>10</td><td>maximum pooled connections</td></tr>
 *   <tr><td>poolAcquireTimeout</td><td>0</td><td>0 = fail immediately when exhausted;
 *       &gt; 0 = wait up to that long for a free connection</td></tr>
 *   <tr><td>lockTimeout</td><td>10s</td><td>lock TTL and wait budget</td></tr>
 *   <tr><td>lockRetrySleep</td><td>500ms</td><td>poll interval while waiting</td></tr>
 *   <tr><td>cronTickInterval</td><td>1s</td><td>scheduler tick</td></tr>
 *   <tr><td>cronLockTtl</td><td>45s</td><td>serial job lock TTL</td></tr>
 *   <tr><td>cronZone</td><td>system default</td><td>zone cron expressions are matched in</td></tr>
 * </table>
 */
@Value
@Builder(toBuilder = true)
public class CoordinationSettings {

  @Builder.Default int poolSize = 10;

  @Builder.Default Duration poolAcquireTimeout = Duration.ZERO;

  @Builder.Default Duration lockTimeout = Duration.ofSeconds(10);

  @Builder.Default Duration lockRetrySleep = Duration.ofMillis(500);

  @Builder.Default Duration cronTickInterval = Duration.ofSeconds(1);

  @Builder.Default Duration cronLockTtl = Duration.ofSeconds(45);

  @Builder.Default ZoneId cronZone = ZoneId.systemDefault();

  public static CoordinationSettings defaults() {
    return builder().build();
  }
}
