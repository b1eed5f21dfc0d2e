/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pubsub;

import lombok.EqualsAndHashCode;
import lombok.Value;

/** Handle of one local subscription; pass it to {@link PubSubHub#unsubscribe(Subscription)}. */
@Value
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Subscription {

  @EqualsAndHashCode.Include long id;

  String topic;

  MessageCallback callback;
}
