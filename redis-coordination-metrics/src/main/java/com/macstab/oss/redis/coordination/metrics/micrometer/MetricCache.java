/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.metrics.micrometer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-safe cache of Micrometer counters and gauge holders.
 *
 * <p><strong>Why:</strong> coordination primitives record on every lock attempt, cache lookup and
 * rate-limit decision. Registry lookups with tag matching are far slower than a map hit, so each
 * distinct {@code name + tags} combination is registered once and reused.
 *
 * <p><strong>Bounded:</strong> at most {@code maxCacheSize} counters are cached. Beyond that,
 * counters are still registered and returned but not cached, and a warning is logged. Cron job
 * names are the only open-ended tag value. Gauges are few and always cached.
 *
 * <p><strong>Key Format:</strong> {@code metric.name:tag1=value1:tag2=value2} in the order the
 * tags were given.
 *
 * @author Christian Schnapka - Macstab GmbH
 */
@Slf4j
final class MetricCache {

  private final MeterRegistry registry;
  private final int maxCacheSize;

  private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>(64);
  private final ConcurrentHashMap<String, RegisteredGauge> gauges = new ConcurrentHashMap<>(16);
  private final AtomicInteger cacheSize = new AtomicInteger();

  /**
   * Creates metric cache.
   *
   * @param registry Micrometer meter registry
   * @param maxCacheSize maximum cached meters
   * @throws IllegalArgumentException if maxCacheSize &lt;= 0
   */
  MetricCache(@NonNull final MeterRegistry registry, final int maxCacheSize) {
    if (maxCacheSize <= 0) {
      throw new IllegalArgumentException("maxCacheSize must be > 0, got: " + maxCacheSize);
    }
    this.registry = registry;
    this.maxCacheSize = maxCacheSize;
  }

  /**
   * Gets or registers a counter.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  Counter counter(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = counters.get(key);
    if (cached != null) {
      return cached;
    }

    if (cacheSize.get() >= maxCacheSize) {
      log.warn("Metric cache full at {} entries, counter {} is not cached", maxCacheSize, key);
      return registerCounter(name, description, tagPairs);
    }

    return counters.computeIfAbsent(
        key,
        k -> {
          cacheSize.incrementAndGet();
          return registerCounter(name, description, tagPairs);
        });
  }

  /**
   * Gets or registers the value holder of a gauge.
   *
   * <p>The registry keeps a strong reference to the holder until {@link #removeGauges()}.
   *
   * @param name metric name
   * @param description metric description
   * @param tagPairs tag key-value pairs [key1, value1, key2, value2, ...]
   * @return holder whose value the gauge reports
   * @throws IllegalArgumentException if tagPairs length is odd
   */
  AtomicInteger gauge(final String name, final String description, final String... tagPairs) {
    validateTagPairs(tagPairs);

    final var key = buildKey(name, tagPairs);
    final var cached = gauges.get(key);
    if (cached != null) {
      return cached.value;
    }

    return gauges.computeIfAbsent(
            key,
            k -> {
              cacheSize.incrementAndGet();
              final var value = new AtomicInteger();
              final var gauge =
                  Gauge.builder(name, value, AtomicInteger::get)
                      .description(description)
                      .tags(tagPairs)
                      .register(registry);
              return new RegisteredGauge(gauge, value);
            })
        .value;
  }

  /** Unregisters every cached gauge. Counters stay registered, their totals remain valid. */
  void removeGauges() {
    final List<String> removed = new ArrayList<>();
    gauges.forEach(
        (key, gauge) -> {
          registry.remove(gauge.meter.getId());
          removed.add(key);
        });
    removed.forEach(
        key -> {
          gauges.remove(key);
          cacheSize.decrementAndGet();
        });

    log.debug("Removed {} gauges", removed.size());
  }

  int getCacheSize() {
    return cacheSize.get();
  }

  // ==================== Private Methods ====================

  private Counter registerCounter(
      final String name, final String description, final String... tagPairs) {
    return Counter.builder(name).description(description).tags(tagPairs).register(registry);
  }

  private static String buildKey(final String name, final String... tagPairs) {
    final var key = new StringBuilder(32 + tagPairs.length * 12);
    key.append(name);
    for (int i = 0; i < tagPairs.length; i += 2) {
      key.append(':').append(tagPairs[i]).append('=').append(tagPairs[i + 1]);
    }
    return key.toString();
  }

  private static void validateTagPairs(final String... tagPairs) {
    if (tagPairs.length % 2 != 0) {
      throw new IllegalArgumentException(
          "Tag pairs must have even length (key-value pairs), got: " + tagPairs.length);
    }
  }

  /** Gauge meter and the holder it reads. */
  private static final class RegisteredGauge {

    private final Meter meter;
    private final AtomicInteger value;

    private RegisteredGauge(final Meter meter, final AtomicInteger value) {
      this.meter = meter;
      this.value = value;
    }
  }
}
