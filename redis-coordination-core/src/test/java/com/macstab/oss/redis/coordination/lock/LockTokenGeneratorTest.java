/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.lock;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.coordination.testkit.MutableClock;

@DisplayName("LockTokenGenerator")
class LockTokenGeneratorTest {

  @Test
  @DisplayName("token is host.pid.millis.counter")
  void format() {
    var clock = new MutableClock(Instant.ofEpochMilli(1_700_000_000_000L));
    var generator = new LockTokenGenerator("web-1", 4711, clock);

    assertThat(generator.nextToken()).isEqualTo("web-1.4711.1700000000000.1");
    assertThat(generator.nextToken()).isEqualTo("web-1.4711.1700000000000.2");
  }

  @Test
  @DisplayName("resolved host name has no domain part")
  void shortHostname() {
    var generator = new LockTokenGenerator(new MutableClock(Instant.EPOCH));

    assertThat(generator.getHostname()).isNotBlank().doesNotContain(".");
  }
}
