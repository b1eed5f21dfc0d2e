/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics;

/**
 * Framework-agnostic metrics hooks for the coordination primitives.
 *
 * <p><strong>Design Pattern:</strong> Interface with default no-op methods. Components call every
 * method unconditionally (no null checks); implementations override only what they export.
 *
 * <p><strong>Implementations:</strong>
 *
 * <ul>
 *   <li>{@link #NOOP} - singleton using the default methods
 *   <li>{@code MicrometerCoordinationMetrics} - Micrometer integration (metrics module)
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Implementations MUST be thread-safe. Recording methods are
 * called from application threads, the cron timer thread and the pub/sub dispatch thread.
 *
 * <p><strong>Outcome values:</strong> the {@code OUTCOME_*} / {@code RESULT_*} constants below are
 * the only values passed as outcome or result; they map one to one onto metric tag values.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
public interface CoordinationMetrics extends AutoCloseable {

  /** No-op singleton instance (uses default methods). */
  CoordinationMetrics NOOP = new CoordinationMetrics() {};

  String OUTCOME_ACQUIRED = "acquired";
  String OUTCOME_UNAVAILABLE = "unavailable";
  String OUTCOME_TIMEOUT = "timeout";

  String OUTCOME_RELEASED = "released";
  String OUTCOME_EXPIRED = "expired";
  String OUTCOME_STOLEN = "stolen";

  String RESULT_HIT = "hit";
  String RESULT_MISS = "miss";
  String RESULT_COMPUTED = "computed";
  String RESULT_TIMEOUT = "timeout";

  String OUTCOME_ALLOWED = "allowed";
  String OUTCOME_REJECTED = "rejected";

  String OUTCOME_EXECUTED = "executed";
  String OUTCOME_SKIPPED = "skipped";
  String OUTCOME_FAILED = "failed";

  /**
   * Reports the pool size after every acquire/release/eviction.
   *
   * <p><strong>Metric Type:</strong> Gauge, {@code redis.coordination.pool.connections}, tag
   * {@code state} = {@code total} / {@code in_use}.
   */
  default void recordPoolConnections(int total, int inUse) {
    // No-op by default
  }

  /** Counter: acquire refused because the pool was at capacity. */
  default void recordPoolExhausted() {
    // No-op by default
  }

  /** Counter: store failure swallowed at the pool boundary. */
  default void recordStoreError() {
    // No-op by default
  }

  /**
   * Counter: lock acquisition attempt finished.
   *
   * @param outcome {@link #OUTCOME_ACQUIRED}, {@link #OUTCOME_UNAVAILABLE} or {@link
   *     #OUTCOME_TIMEOUT}
   */
  default void recordLockAcquisition(String outcome) {
    // No-op by default
  }

  /**
   * Counter: lock release finished.
   *
   * @param outcome {@link #OUTCOME_RELEASED}, {@link #OUTCOME_EXPIRED} or {@link #OUTCOME_STOLEN}
   */
  default void recordLockRelease(String outcome) {
    // No-op by default
  }

  /**
   * Counter: cache guard lookup.
   *
   * @param result {@link #RESULT_HIT}, {@link #RESULT_MISS}, {@link #RESULT_COMPUTED} or {@link
   *     #RESULT_TIMEOUT}
   */
  default void recordCacheLookup(String result) {
    // No-op by default
  }

  /**
   * Counter: rate limiter decision.
   *
   * @param outcome {@link #OUTCOME_ALLOWED} or {@link #OUTCOME_REJECTED}
   */
  default void recordRateLimitDecision(String outcome) {
    // No-op by default
  }

  /** Counter: message published through the hub. */
  default void recordPublished() {
    // No-op by default
  }

  /** Counter: message handed to one local callback. */
  default void recordDelivered() {
    // No-op by default
  }

  /** Counter: local callback threw while handling a message. */
  default void recordCallbackFailure() {
    // No-op by default
  }

  /** Gauge: topics with at least one local subscription. */
  default void setActiveTopics(int count) {
    // No-op by default
  }

  /**
   * Counter: cron job tick that matched its expression.
   *
   * @param job job name
   * @param outcome {@link #OUTCOME_EXECUTED}, {@link #OUTCOME_SKIPPED} (serial lock held
   *     elsewhere) or {@link #OUTCOME_FAILED}
   */
  default void recordCronExecution(String job, String outcome) {
    // No-op by default
  }

  /**
   * Removes registered gauges. Called once by {@code CoordinationContext.shutdown()}.
   *
   * <p>MUST be idempotent and MUST NOT throw.
   */
  @Override
  default void close() {
    // No-op by default
  }
}
