/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import io.lettuce.core.RedisURI;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Address and credentials of the Redis server. */
@Value
@Builder(toBuilder = true)
public class RedisEndpoint {

  @Builder.Default String host = "localhost";

  @Builder.Default int port = 6379;

  @ToString.Exclude String password;

  @Builder.Default int database = 0;

  public static RedisEndpoint defaults() {
    return builder().build();
  }

  RedisURI toRedisUri() {
    final var builder = RedisURI.builder().withHost(host).withPort(port).withDatabase(database);
    if (password != null && !password.isEmpty()) {
      builder.withPassword(password.toCharArray());
    }
    return builder.build();
  }
}
