/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.pubsub;

/** Local receiver of messages published on one topic. */
@FunctionalInterface
public interface MessageCallback {

  /**
   * Handles one message. Runs on the hub's dispatch thread, shared by every topic; keep it short.
   *
   * @param message payload as published (JSON for non-string messages)
   * @param topic topic the message arrived on
   */
  void onMessage(String message, String topic);
}
