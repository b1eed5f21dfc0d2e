/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

/**
 * Receives every message arriving on a {@link SubscriberConnection}, whatever the topic.
 *
 * <p>Invoked on the store client's I/O thread. Implementations must return quickly: a slow
 * listener delays every later message on every topic of the same connection.
 */
@FunctionalInterface
public interface StoreMessageListener {

  void onMessage(String topic, String message);
}
