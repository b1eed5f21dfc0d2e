/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.testkit;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import com.macstab.oss.redis.coordination.store.CompareAndDeleteResult;
import com.macstab.oss.redis.coordination.store.StoreConnection;
import com.macstab.oss.redis.coordination.store.StoreConnectionException;
import com.macstab.oss.redis.coordination.store.StoreConnector;
import com.macstab.oss.redis.coordination.store.StoreMessageListener;
import com.macstab.oss.redis.coordination.store.SubscriberConnection;

/**
 * In-memory {@link StoreConnector} for unit tests.
 *
 * <p><strong>Semantics:</strong>
 *
 * <ul>
 *   <li>All data operations are atomic (one monitor), expiry is evaluated against the injected
 *       {@link Clock}.
 *   <li>{@code publish} delivers synchronously on the publishing thread, outside the monitor.
 *   <li>Blocking pops wait on the monitor in real time (not the injected clock); pushes wake them.
 *   <li>{@link #setAvailable(boolean) setAvailable(false)} makes every connect and every
 *       operation on open connections fail with {@link StoreConnectionException}.
 *   <li>{@link #setSubscribersConnected(boolean) setSubscribersConnected(false)} puts subscriber
 *       connections into the reconnecting state: not open, not closed, (UN)SUBSCRIBE rejected,
 *       no delivery. Reconnecting keeps their topics.
 * </ul>
 *
 * <p><strong>Counters:</strong> connects, subscriber connects, SUBSCRIBE/UNSUBSCRIBE per topic.
 */
public final class InMemoryStore implements StoreConnector {

  private final Clock clock;
  private final Object monitor = new Object();

  private final Map<String, String> strings = new HashMap<>();
  private final Map<String, Deque<String>> lists = new HashMap<>();
  private final Map<String, Set<String>> sets = new HashMap<>();
  private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
  private final Map<String, Long> expiries = new HashMap<>();

  private final CopyOnWriteArrayList<InMemorySubscriber> subscribers =
      new CopyOnWriteArrayList<>();
  private final Map<String, AtomicInteger> subscribeCalls = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> unsubscribeCalls = new ConcurrentHashMap<>();
  private final AtomicInteger connects = new AtomicInteger();
  private final AtomicInteger subscriberConnects = new AtomicInteger();
  private final AtomicInteger openConnections = new AtomicInteger();

  private volatile boolean available = true;
  private volatile boolean closed;

  public InMemoryStore(final Clock clock) {
    this.clock = clock;
  }

  // ==================== StoreConnector ====================

  @Override
  public StoreConnection connect() {
    checkAvailable();
    connects.incrementAndGet();
    openConnections.incrementAndGet();
    return new InMemoryConnection();
  }

  @Override
  public SubscriberConnection connectSubscriber(final StoreMessageListener listener) {
    checkAvailable();
    subscriberConnects.incrementAndGet();
    final var subscriber = new InMemorySubscriber(listener);
    subscribers.add(subscriber);
    return subscriber;
  }

  @Override
  public void close() {
    closed = true;
  }

  // ==================== Test controls ====================

  public void setAvailable(final boolean available) {
    this.available = available;
  }

  public boolean isClosed() {
    return closed;
  }

  public void setSubscribersConnected(final boolean connected) {
    for (final var subscriber : subscribers) {
      subscriber.connected = connected;
    }
  }

  /** Closes every subscriber connection, as a connector does when it gives up reconnecting. */
  public void closeSubscribers() {
    for (final var subscriber : subscribers) {
      subscriber.close();
    }
  }

  /** Topics subscribed on each open subscriber connection, in creation order. */
  public List<Set<String>> getSubscriberTopics() {
    final var result = new ArrayList<Set<String>>();
    for (final var subscriber : subscribers) {
      result.add(Set.copyOf(subscriber.topics));
    }
    return result;
  }

  public int getConnectCount() {
    return connects.get();
  }

  public int getOpenConnectionCount() {
    return openConnections.get();
  }

  public int getSubscriberConnectCount() {
    return subscriberConnects.get();
  }

  public int getOpenSubscriberCount() {
    return (int) subscribers.stream().filter(InMemorySubscriber::isOpen).count();
  }

  public int getSubscribeCalls(final String topic) {
    return subscribeCalls.getOrDefault(topic, new AtomicInteger()).get();
  }

  public int getUnsubscribeCalls(final String topic) {
    return unsubscribeCalls.getOrDefault(topic, new AtomicInteger()).get();
  }

  /** Direct read bypassing connections and availability. */
  public Optional<String> peek(final String key) {
    synchronized (monitor) {
      evictIfExpired(key);
      return Optional.ofNullable(strings.get(key));
    }
  }

  /** Direct write bypassing connections and availability. */
  public void put(final String key, final String value) {
    synchronized (monitor) {
      strings.put(key, value);
      expiries.remove(key);
    }
  }

  /** Remaining time to live in milliseconds, {@code -1} without expiry, {@code -2} if missing. */
  public long ttlMillis(final String key) {
    synchronized (monitor) {
      evictIfExpired(key);
      if (!exists(key)) {
        return -2;
      }
      final var expiry = expiries.get(key);
      return expiry == null ? -1 : expiry - clock.millis();
    }
  }

  // ==================== Private Methods ====================

  private void checkAvailable() {
    if (!available) {
      throw new StoreConnectionException("In-memory store is unavailable");
    }
  }

  private boolean exists(final String key) {
    return strings.containsKey(key)
        || lists.containsKey(key)
        || sets.containsKey(key)
        || sortedSets.containsKey(key);
  }

  private void evictIfExpired(final String key) {
    final var expiry = expiries.get(key);
    if (expiry != null && expiry <= clock.millis()) {
      removeKey(key);
    }
  }

  private boolean removeKey(final String key) {
    expiries.remove(key);
    final var removed =
        strings.remove(key) != null
            | lists.remove(key) != null
            | sets.remove(key) != null
            | sortedSets.remove(key) != null;
    return removed;
  }

  private void expireAfter(final String key, final Duration ttl) {
    if (ttl == null) {
      expiries.remove(key);
    } else {
      expiries.put(key, clock.millis() + ttl.toMillis());
    }
  }

  private static Pattern globToRegex(final String glob) {
    final var regex = new StringBuilder();
    for (final char c : glob.toCharArray()) {
      if (c == '*') {
        regex.append(".*");
      } else if (c == '?') {
        regex.append('.');
      } else {
        regex.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return Pattern.compile(regex.toString());
  }

  private final class InMemoryConnection implements StoreConnection {

    private volatile boolean open = true;

    @Override
    public Optional<String> get(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        return Optional.ofNullable(strings.get(key));
      }
    }

    @Override
    public boolean set(
        final String key, final String value, final Duration ttl, final boolean onlyIfAbsent) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        if (onlyIfAbsent && exists(key)) {
          return false;
        }
        removeKey(key);
        strings.put(key, value);
        expireAfter(key, ttl);
        return true;
      }
    }

    @Override
    public boolean delete(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        return removeKey(key);
      }
    }

    @Override
    public CompareAndDeleteResult compareAndDelete(final String key, final String expectedValue) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var current = strings.get(key);
        if (current == null) {
          return CompareAndDeleteResult.ABSENT;
        }
        if (!current.equals(expectedValue)) {
          return CompareAndDeleteResult.MISMATCH;
        }
        removeKey(key);
        return CompareAndDeleteResult.DELETED;
      }
    }

    @Override
    public long incrementWithExpiry(final String key, final Duration ttl) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var current = strings.get(key);
        final var next = current == null ? 1L : Long.parseLong(current) + 1;
        strings.put(key, Long.toString(next));
        expireAfter(key, ttl);
        return next;
      }
    }

    @Override
    public long ttl(final String key) {
      synchronized (monitor) {
        checkUsable();
        final var millis = ttlMillis(key);
        return millis < 0 ? millis : (millis + 999) / 1000;
      }
    }

    @Override
    public List<String> keys(final String pattern) {
      synchronized (monitor) {
        checkUsable();
        final var regex = globToRegex(pattern);
        final var all = new LinkedHashSet<String>();
        all.addAll(strings.keySet());
        all.addAll(lists.keySet());
        all.addAll(sets.keySet());
        all.addAll(sortedSets.keySet());
        final var result = new ArrayList<String>();
        for (final var key : all) {
          evictIfExpired(key);
          if (exists(key) && regex.matcher(key).matches()) {
            result.add(key);
          }
        }
        return result;
      }
    }

    @Override
    public long publish(final String topic, final String message) {
      checkUsable();
      long receivers = 0;
      for (final var subscriber : subscribers) {
        if (subscriber.deliver(topic, message)) {
          receivers++;
        }
      }
      return receivers;
    }

    @Override
    public long leftPush(final String key, final String... values) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var list = lists.computeIfAbsent(key, k -> new ArrayDeque<>());
        for (final var value : values) {
          list.addFirst(value);
        }
        monitor.notifyAll();
        return list.size();
      }
    }

    @Override
    public List<String> rightPop(final String key, final long count) {
      synchronized (monitor) {
        checkUsable();
        final var popped = new ArrayList<String>();
        for (long i = 0; i < count; i++) {
          final var value = popLast(key);
          if (value == null) {
            break;
          }
          popped.add(value);
        }
        return popped;
      }
    }

    @Override
    public Optional<String> blockingRightPop(final String key, final Duration timeout) {
      synchronized (monitor) {
        final var deadline = deadlineFor(timeout);
        while (true) {
          checkUsable();
          final var value = popLast(key);
          if (value != null) {
            return Optional.of(value);
          }
          if (!awaitChange(deadline)) {
            return Optional.empty();
          }
        }
      }
    }

    @Override
    public long listRemove(final String key, final long count, final String value) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var list = lists.get(key);
        if (list == null) {
          return 0;
        }
        final var limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
        final var iterator = count < 0 ? list.descendingIterator() : list.iterator();
        long removed = 0;
        while (iterator.hasNext() && removed < limit) {
          if (iterator.next().equals(value)) {
            iterator.remove();
            removed++;
          }
        }
        if (list.isEmpty()) {
          lists.remove(key);
        }
        return removed;
      }
    }

    @Override
    public Optional<Long> listPosition(final String key, final String value) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var list = lists.get(key);
        if (list == null) {
          return Optional.empty();
        }
        long index = 0;
        for (final var element : list) {
          if (element.equals(value)) {
            return Optional.of(index);
          }
          index++;
        }
        return Optional.empty();
      }
    }

    @Override
    public void listTrim(final String key, final long start, final long stop) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var list = lists.get(key);
        if (list == null) {
          return;
        }
        final var size = list.size();
        final var from = Math.max(0, start < 0 ? size + start : start);
        final var to = Math.min(size - 1, stop < 0 ? size + stop : stop);
        final var kept = new ArrayDeque<String>();
        long index = 0;
        for (final var element : list) {
          if (index >= from && index <= to) {
            kept.addLast(element);
          }
          index++;
        }
        if (kept.isEmpty()) {
          lists.remove(key);
        } else {
          lists.put(key, kept);
        }
      }
    }

    @Override
    public Optional<String> rightPop(final String key) {
      synchronized (monitor) {
        checkUsable();
        return Optional.ofNullable(popLast(key));
      }
    }

    @Override
    public long listLength(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var list = lists.get(key);
        return list == null ? 0 : list.size();
      }
    }

    @Override
    public long setAdd(final String key, final String... members) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var set = sets.computeIfAbsent(key, k -> new LinkedHashSet<>());
        long added = 0;
        for (final var member : members) {
          if (set.add(member)) {
            added++;
          }
        }
        return added;
      }
    }

    @Override
    public long setRemove(final String key, final String... members) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var set = sets.get(key);
        if (set == null) {
          return 0;
        }
        long removed = 0;
        for (final var member : members) {
          if (set.remove(member)) {
            removed++;
          }
        }
        if (set.isEmpty()) {
          sets.remove(key);
        }
        return removed;
      }
    }

    @Override
    public Set<String> setMembers(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var set = sets.get(key);
        return set == null ? Set.of() : Set.copyOf(set);
      }
    }

    @Override
    public long setCardinality(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var set = sets.get(key);
        return set == null ? 0 : set.size();
      }
    }

    @Override
    public Optional<String> setPop(final String key) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var set = sets.get(key);
        if (set == null) {
          return Optional.empty();
        }
        final var member = set.iterator().next();
        set.remove(member);
        if (set.isEmpty()) {
          sets.remove(key);
        }
        return Optional.of(member);
      }
    }

    @Override
    public long sortedSetAdd(final String key, final double score, final String member) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var zset = sortedSets.computeIfAbsent(key, k -> new HashMap<>());
        final var added = zset.put(member, score) == null ? 1 : 0;
        monitor.notifyAll();
        return added;
      }
    }

    @Override
    public Optional<String> sortedSetPopMax(final String key) {
      synchronized (monitor) {
        checkUsable();
        return Optional.ofNullable(popMax(key));
      }
    }

    @Override
    public Optional<String> blockingSortedSetPopMax(final String key, final Duration timeout) {
      synchronized (monitor) {
        final var deadline = deadlineFor(timeout);
        while (true) {
          checkUsable();
          final var member = popMax(key);
          if (member != null) {
            return Optional.of(member);
          }
          if (!awaitChange(deadline)) {
            return Optional.empty();
          }
        }
      }
    }

    @Override
    public List<String> sortedSetRangeUpTo(final String key, final double maxScore) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var zset = sortedSets.get(key);
        if (zset == null) {
          return List.of();
        }
        final var result = new ArrayList<Map.Entry<String, Double>>();
        for (final var entry : zset.entrySet()) {
          if (entry.getValue() <= maxScore) {
            result.add(entry);
          }
        }
        result.sort(
            Map.Entry.<String, Double>comparingByValue()
                .thenComparing(Map.Entry.<String, Double>comparingByKey()));
        final var members = new ArrayList<String>();
        for (final var entry : result) {
          members.add(entry.getKey());
        }
        return members;
      }
    }

    @Override
    public long sortedSetRemove(final String key, final String member) {
      synchronized (monitor) {
        checkUsable();
        evictIfExpired(key);
        final var zset = sortedSets.get(key);
        if (zset == null || zset.remove(member) == null) {
          return 0;
        }
        if (zset.isEmpty()) {
          sortedSets.remove(key);
        }
        return 1;
      }
    }

    @Override
    public boolean isOpen() {
      return open;
    }

    @Override
    public void close() {
      if (open) {
        open = false;
        openConnections.decrementAndGet();
      }
    }

    private void checkUsable() {
      if (!open) {
        throw new StoreConnectionException("Connection is closed");
      }
      checkAvailable();
    }

    // callers hold monitor

    private String popLast(final String key) {
      evictIfExpired(key);
      final var list = lists.get(key);
      if (list == null) {
        return null;
      }
      final var value = list.pollLast();
      if (list.isEmpty()) {
        lists.remove(key);
      }
      return value;
    }

    private String popMax(final String key) {
      evictIfExpired(key);
      final var zset = sortedSets.get(key);
      if (zset == null) {
        return null;
      }
      final var max =
          zset.entrySet().stream()
              .max(
                  Map.Entry.<String, Double>comparingByValue()
                      .thenComparing(Map.Entry.<String, Double>comparingByKey()))
              .map(Map.Entry::getKey)
              .orElse(null);
      if (max != null) {
        zset.remove(max);
      }
      if (zset.isEmpty()) {
        sortedSets.remove(key);
      }
      return max;
    }

    /** Nano-time deadline, {@code Long.MAX_VALUE} for "no limit". */
    private long deadlineFor(final Duration timeout) {
      return timeout.isZero() ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
    }

    /** Waits for a push; {@code false} once the deadline has passed. */
    private boolean awaitChange(final long deadline) {
      var waitMillis = 0L;
      if (deadline != Long.MAX_VALUE) {
        final var remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        waitMillis = Math.max(1, remaining / 1_000_000);
      }
      try {
        monitor.wait(waitMillis);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StoreConnectionException("Interrupted during blocking pop", e);
      }
      return true;
    }
  }

  private final class InMemorySubscriber implements SubscriberConnection {

    private final StoreMessageListener listener;
    private final Set<String> topics = ConcurrentHashMap.newKeySet();
    private volatile boolean open = true;
    private volatile boolean connected = true;

    private InMemorySubscriber(final StoreMessageListener listener) {
      this.listener = listener;
    }

    @Override
    public void subscribe(final String... newTopics) {
      checkUsable();
      for (final var topic : newTopics) {
        subscribeCalls.computeIfAbsent(topic, t -> new AtomicInteger()).incrementAndGet();
        topics.add(topic);
      }
    }

    @Override
    public void unsubscribe(final String... oldTopics) {
      checkUsable();
      for (final var topic : oldTopics) {
        unsubscribeCalls.computeIfAbsent(topic, t -> new AtomicInteger()).incrementAndGet();
        topics.remove(topic);
      }
    }

    @Override
    public boolean isOpen() {
      return open && connected;
    }

    @Override
    public boolean isClosed() {
      return !open;
    }

    @Override
    public void close() {
      open = false;
      topics.clear();
      subscribers.remove(this);
    }

    private boolean deliver(final String topic, final String message) {
      if (!isOpen() || !topics.contains(topic)) {
        return false;
      }
      listener.onMessage(topic, message);
      return true;
    }

    private void checkUsable() {
      if (!open) {
        throw new StoreConnectionException("Subscriber connection is closed");
      }
      if (!connected) {
        throw new StoreConnectionException("Subscriber connection is reconnecting");
      }
      checkAvailable();
    }
  }
}
