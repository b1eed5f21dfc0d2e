/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.cron;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.macstab.oss.redis.coordination.CoordinationSettings;
import com.macstab.oss.redis.coordination.lock.DistributedLock;
import com.macstab.oss.redis.coordination.lock.LockTokenGenerator;
import com.macstab.oss.redis.coordination.metrics.CoordinationMetrics;
import com.macstab.oss.redis.coordination.pool.ConnectionPool;
import com.macstab.oss.redis.coordination.testkit.InMemoryStore;
import com.macstab.oss.redis.coordination.testkit.MutableClock;

/**
 * Tests for {@link CronScheduler} and {@link ScheduledCronJob}.
 *
 * <p>Firing logic is driven through {@code tick(now)} directly; only the lifecycle tests use the
 * real tick thread.
 */
@DisplayName("CronScheduler")
class CronSchedulerTest {

  private static final Instant START = Instant.parse("2026-03-02T10:00:10Z");

  private MutableClock clock;
  private InMemoryStore store;
  private CoordinationMetrics metrics;
  private CronScheduler scheduler;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new InMemoryStore(clock);
    metrics = mock(CoordinationMetrics.class);
    scheduler = newInstance();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
  }

  /** A scheduler as another fleet member would have it: own pool and lock, same store. */
  private CronScheduler newInstance() {
    var settings =
        CoordinationSettings.builder()
            .cronTickInterval(Duration.ofMillis(10))
            .cronZone(ZoneOffset.UTC)
            .build();
    var lock =
        new DistributedLock(
            new ConnectionPool(store, 4),
            new LockTokenGenerator(clock),
            CoordinationMetrics.NOOP,
            Duration.ofSeconds(10),
            Duration.ofMillis(10));
    return new CronScheduler(lock, metrics, clock, settings);
  }

  private static RecordingJob serialJob() {
    return new RecordingJob(CronExpression.always(), ExecutionMode.SERIAL);
  }

  private ZonedDateTime now() {
    return ZonedDateTime.now(clock);
  }

  /** Records the minutes it ran for. */
  static class RecordingJob extends CronJob {

    final CopyOnWriteArrayList<ZonedDateTime> runs = new CopyOnWriteArrayList<>();

    RecordingJob(final CronExpression expression, final ExecutionMode mode) {
      super(expression, mode);
    }

    @Override
    public void run(final ZonedDateTime now) {
      runs.add(now);
    }
  }

  @Nested
  @DisplayName("Firing")
  class Firing {

    @Test
    @DisplayName("first tick only records the current minute")
    void firstTickRecordsOnly() {
      // Arrange
      var job = new RecordingJob(CronExpression.always(), ExecutionMode.PARALLEL);
      var handle = scheduler.register(job);

      // Act
      handle.tick(now());

      // Assert
      assertThat(job.runs).isEmpty();
      assertThat(handle.getLastFiredMinute()).isEqualTo(START.getEpochSecond() / 60);
    }

    @Test
    @DisplayName("fires once per matching minute")
    void firesOncePerMinute() {
      // Arrange
      var job = new RecordingJob(CronExpression.always(), ExecutionMode.PARALLEL);
      var handle = scheduler.register(job);
      handle.tick(now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());
      clock.advance(Duration.ofSeconds(20));
      handle.tick(now());

      // Assert
      assertThat(job.runs).hasSize(1);
      verify(metrics).recordCronExecution("RecordingJob", CoordinationMetrics.OUTCOME_EXECUTED);
    }

    @Test
    @DisplayName("does not fire on non-matching minutes")
    void skipsNonMatchingMinutes() {
      // Arrange: 10:00 now, job wants 10:02
      var job =
          new RecordingJob(CronExpression.fromCronString("2 10 * * *"), ExecutionMode.PARALLEL);
      var handle = scheduler.register(job);
      handle.tick(now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());

      // Assert
      assertThat(job.runs).hasSize(1);
      assertThat(job.runs.get(0).getMinute()).isEqualTo(2);
    }

    @Test
    @DisplayName("matches in the configured zone")
    void usesConfiguredZone() {
      // Arrange
      var job =
          new RecordingJob(CronExpression.fromCronString("1 10 * * *"), ExecutionMode.PARALLEL);
      var handle = scheduler.register(job);
      handle.tick(scheduler.now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handle.tick(scheduler.now());

      // Assert
      assertThat(scheduler.getZone()).isEqualTo(ZoneOffset.UTC);
      assertThat(job.runs).hasSize(1);
    }

    @Test
    @DisplayName("a throwing job is logged and fires again next minute")
    void throwingJobKeepsRunning() {
      // Arrange
      var attempts = new CopyOnWriteArrayList<ZonedDateTime>();
      var job =
          new CronJob(CronExpression.always(), ExecutionMode.PARALLEL) {
            @Override
            public void run(final ZonedDateTime now) {
              attempts.add(now);
              throw new IllegalStateException("job failed");
            }

            @Override
            public String getName() {
              return "failing";
            }
          };
      var handle = scheduler.register(job);
      handle.tick(now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());

      // Assert
      assertThat(attempts).hasSize(2);
      verify(metrics, times(2))
          .recordCronExecution("failing", CoordinationMetrics.OUTCOME_FAILED);
    }
  }

  @Nested
  @DisplayName("Serial Mode")
  class SerialMode {

    @Test
    @DisplayName("only one instance runs a matching minute")
    void oneInstancePerMinute() {
      // Arrange
      var other = newInstance();
      var jobA = new RecordingJob(CronExpression.always(), ExecutionMode.SERIAL);
      var jobB = new RecordingJob(CronExpression.always(), ExecutionMode.SERIAL);
      var handleA = scheduler.register(jobA);
      var handleB = other.register(jobB);
      handleA.tick(now());
      handleB.tick(now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handleA.tick(now());
      handleB.tick(now());

      // Assert
      assertThat(jobA.runs.size() + jobB.runs.size()).isEqualTo(1);
      assertThat(store.peek("cronjob.RecordingJob.lock")).isPresent();
      verify(metrics).recordCronExecution("RecordingJob", CoordinationMetrics.OUTCOME_SKIPPED);
      other.shutdown();
    }

    @Test
    @DisplayName("lock is left to expire, the next minute is contended again")
    void lockExpiresBeforeNextMinute() {
      // Arrange
      var job = new RecordingJob(CronExpression.always(), ExecutionMode.SERIAL);
      var handle = scheduler.register(job);
      handle.tick(now());

      // Act
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());
      var ttlAfterRun = store.ttlMillis("cronjob.RecordingJob.lock");
      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());

      // Assert
      assertThat(ttlAfterRun).isEqualTo(Duration.ofSeconds(45).toMillis());
      assertThat(job.runs).hasSize(2);
    }

    @Test
    @DisplayName("unreachable store skips the run")
    void storeDown() {
      var job = new RecordingJob(CronExpression.always(), ExecutionMode.SERIAL);
      var handle = scheduler.register(job);
      handle.tick(now());
      store.setAvailable(false);

      clock.advance(Duration.ofMinutes(1));
      handle.tick(now());

      assertThat(job.runs).isEmpty();
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("start ticks on the scheduler thread, stop halts it")
    void startAndStop() throws Exception {
      // Arrange
      var job = new RecordingJob(CronExpression.always(), ExecutionMode.PARALLEL);
      var handle = scheduler.register(job);

      // Act
      handle.start();
      await().atMost(2, TimeUnit.SECONDS).until(() -> handle.getLastFiredMinute() >= 0);
      clock.advance(Duration.ofMinutes(1));
      await().atMost(2, TimeUnit.SECONDS).until(() -> job.runs.size() == 1);
      handle.stop();
      clock.advance(Duration.ofMinutes(1));
      Thread.sleep(100);

      // Assert
      assertThat(handle.getState()).isEqualTo(JobState.STOPPED);
      assertThat(job.runs).hasSize(1);
    }

    @Test
    @DisplayName("start and stop are idempotent")
    void idempotent() {
      var handle = scheduler.register(serialJob());

      handle.start();
      handle.start();
      assertThat(handle.getState()).isEqualTo(JobState.RUNNING);

      handle.stop();
      handle.stop();
      assertThat(handle.getState()).isEqualTo(JobState.STOPPED);
    }

    @Test
    @DisplayName("shutdown stops every job and refuses new ones")
    void shutdown() {
      // Arrange
      var first = scheduler.schedule(serialJob());
      var second =
          scheduler.schedule(new RecordingJob(CronExpression.always(), ExecutionMode.PARALLEL));

      // Act
      scheduler.shutdown();

      // Assert
      assertThat(first.getState()).isEqualTo(JobState.STOPPED);
      assertThat(second.getState()).isEqualTo(JobState.STOPPED);
      assertThat(scheduler.isShutdown()).isTrue();
      assertThatThrownBy(() -> scheduler.register(serialJob()))
          .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("job name defaults to the simple class name and names the lock")
    void jobName() {
      var handle = scheduler.register(serialJob());

      assertThat(handle.getJob().getName()).isEqualTo("RecordingJob");
      assertThat(handle.getLockName()).isEqualTo("cronjob.RecordingJob");
    }
  }
}
