/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces lock tokens unique per acquisition: {@code host.pid.epochMillis.counter}.
 *
 * <p>The host name is resolved once and cut at the first dot. The counter is per generator, i.e.
 * per coordination context; host, pid and timestamp keep tokens apart across processes.
 */
@Slf4j
public final class LockTokenGenerator {

  @Getter private final String hostname;
  private final long pid;
  private final Clock clock;
  private final AtomicLong counter = new AtomicLong();

  public LockTokenGenerator(@NonNull final Clock clock) {
    this(resolveHostname(), ProcessHandle.current().pid(), clock);
  }

  LockTokenGenerator(@NonNull final String hostname, final long pid, @NonNull final Clock clock) {
    this.hostname = hostname;
    this.pid = pid;
    this.clock = clock;
  }

  public String nextToken() {
    return hostname + '.' + pid + '.' + clock.millis() + '.' + counter.incrementAndGet();
  }

  private static String resolveHostname() {
    try {
      final var name = InetAddress.getLocalHost().getHostName();
      final var dot = name.indexOf('.');
      return dot > 0 ? name.substring(0, dot) : name;
    } catch (final UnknownHostException e) {
      log.warn(
          "Cannot resolve local host name, using 'localhost' in lock tokens: {}", e.getMessage());
      return "localhost";
    }
  }
}
