package com.logimetrics.coordinator.job;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class JobRunnerTest {

  private final List<JobRun> runs = new CopyOnWriteArrayList<>();
  private ExecutorService workers;
  private ThreadPoolTaskScheduler timeoutScheduler;
  private SingleFlightGate gate;
  private JobRunner runner;
  private JobRegistry registry;

  @BeforeEach
  void setUp() {
    workers = Executors.newFixedThreadPool(4);
    timeoutScheduler = new ThreadPoolTaskScheduler();
    timeoutScheduler.initialize();
    gate = new SingleFlightGate();
    runner = new JobRunner(gate, workers, timeoutScheduler, Clock.systemUTC(), List.of(runs::add));
    registry = new JobRegistry(runner, gate);
  }

  @AfterEach
  void tearDown() {
    workers.shutdownNow();
    timeoutScheduler.shutdown();
  }

  @Test
  void secondTriggerIsSkippedWhileFirstRunIsActive() throws Exception {
    final JobSlot slot =
        register(
            JobDescriptor.builder("J2")
                .cron("* * * * *")
                .handler(token -> Thread.sleep(400))
                .concurrencyPolicy(ConcurrencyPolicy.SKIP_IF_RUNNING));

    final CompletableFuture<JobRun> first = runner.launch(slot, JobTrigger.SCHEDULED);
    Thread.sleep(100);
    final CompletableFuture<JobRun> second = runner.launch(slot, JobTrigger.SCHEDULED);

    assertThat(second.get(1, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.SKIPPED);
    assertThat(first.get(2, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.OK);
    assertThat(gate.isRunning("J2")).isFalse();
  }

  @Test
  void queueOneParksASingleTriggerAndRunsItAfterwards() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final AtomicInteger invocations = new AtomicInteger();
    final JobSlot slot =
        register(
            JobDescriptor.builder("drain")
                .cron("* * * * *")
                .handler(
                    token -> {
                      if (invocations.incrementAndGet() == 1) {
                        release.await(2, TimeUnit.SECONDS);
                      }
                    })
                .concurrencyPolicy(ConcurrencyPolicy.QUEUE_ONE));

    final CompletableFuture<JobRun> first = runner.launch(slot, JobTrigger.SCHEDULED);
    waitUntilRunning("drain");
    final CompletableFuture<JobRun> parked = runner.launch(slot, JobTrigger.SCHEDULED);
    final CompletableFuture<JobRun> collapsed = runner.launch(slot, JobTrigger.SCHEDULED);
    release.countDown();

    assertThat(first.get(2, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.OK);
    final JobRun queued = parked.get(2, TimeUnit.SECONDS);
    assertThat(queued.trigger()).isEqualTo(JobTrigger.QUEUED);
    assertThat(queued.outcome()).isEqualTo(JobOutcome.OK);
    assertThat(collapsed.get(2, TimeUnit.SECONDS)).isSameAs(queued);
    assertThat(invocations).hasValue(2);
  }

  @Test
  void triggerParkedJustAfterTheRunReleasedStillRuns() throws Exception {
    final CountDownLatch refused = new CountDownLatch(1);
    final CountDownLatch previousRunUnwound = new CountDownLatch(1);
    final SingleFlightGate slowParkGate =
        new SingleFlightGate() {
          @Override
          public Optional<Permit> tryAcquire(String jobName, ConcurrencyPolicy policy) {
            final Optional<Permit> permit = super.tryAcquire(jobName, policy);
            if (permit.isEmpty()) {
              refused.countDown();
              awaitQuietly(previousRunUnwound);
            }
            return permit;
          }
        };
    final ExecutorService singleWorker = Executors.newSingleThreadExecutor();
    final ExecutorService triggerThread = Executors.newSingleThreadExecutor();
    try {
      final JobRunner queueRunner =
          new JobRunner(
              slowParkGate, singleWorker, timeoutScheduler, Clock.systemUTC(), List.of());
      final JobRegistry queueRegistry = new JobRegistry(queueRunner, slowParkGate);
      final CountDownLatch finishFirst = new CountDownLatch(1);
      final AtomicInteger invocations = new AtomicInteger();
      queueRegistry.register(
          JobDescriptor.builder("drain")
              .cron("* * * * *")
              .zone(ZoneId.of("UTC"))
              .handler(
                  token -> {
                    if (invocations.incrementAndGet() == 1) {
                      finishFirst.await(2, TimeUnit.SECONDS);
                    }
                  })
              .concurrencyPolicy(ConcurrencyPolicy.QUEUE_ONE)
              .build());
      final JobSlot slot = queueRegistry.slots().get(0);

      final CompletableFuture<JobRun> first = queueRunner.launch(slot, JobTrigger.SCHEDULED);
      final CompletableFuture<JobRun> parked =
          CompletableFuture.supplyAsync(
                  () -> queueRunner.launch(slot, JobTrigger.SCHEDULED), triggerThread)
              .thenCompose(Function.identity());
      assertThat(refused.await(2, TimeUnit.SECONDS)).isTrue();
      finishFirst.countDown();
      assertThat(first.get(2, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.OK);
      // the single worker is free only once the first run has fully unwound
      singleWorker.submit(() -> {}).get(2, TimeUnit.SECONDS);
      previousRunUnwound.countDown();

      final JobRun queued = parked.get(2, TimeUnit.SECONDS);
      assertThat(queued.trigger()).isEqualTo(JobTrigger.QUEUED);
      assertThat(queued.outcome()).isEqualTo(JobOutcome.OK);
      assertThat(invocations).hasValue(2);
    } finally {
      singleWorker.shutdownNow();
      triggerThread.shutdownNow();
    }
  }

  @Test
  void allowConcurrentRunsOverlap() throws Exception {
    final CountDownLatch bothStarted = new CountDownLatch(2);
    final JobSlot slot =
        register(
            JobDescriptor.builder("parallel")
                .cron("* * * * *")
                .handler(
                    token -> {
                      bothStarted.countDown();
                      bothStarted.await(2, TimeUnit.SECONDS);
                    })
                .concurrencyPolicy(ConcurrencyPolicy.ALLOW_CONCURRENT));

    final CompletableFuture<JobRun> first = runner.launch(slot, JobTrigger.SCHEDULED);
    final CompletableFuture<JobRun> second = runner.launch(slot, JobTrigger.SCHEDULED);

    assertThat(first.get(3, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.OK);
    assertThat(second.get(3, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.OK);
    assertThat(bothStarted.getCount()).isZero();
  }

  @Test
  void runExceedingTimeoutIsRecordedAsTimedOut() throws Exception {
    final JobSlot slot =
        register(
            JobDescriptor.builder("slow")
                .cron("* * * * *")
                .timeout(Duration.ofMillis(200))
                .handler(
                    token -> {
                      while (true) {
                        token.throwIfCancelled();
                        Thread.sleep(20);
                      }
                    }));

    final JobRun run = runner.launch(slot, JobTrigger.SCHEDULED).get(2, TimeUnit.SECONDS);

    assertThat(run.outcome()).isEqualTo(JobOutcome.TIMED_OUT);
    assertThat(run.errorMessage()).contains("exceeded timeout");
    assertThat(registry.get("slow").lastRun()).isEqualTo(run);
  }

  @Test
  void timedOutRunThatIgnoresCancellationDoesNotBlockTheNextRun() throws Exception {
    final AtomicBoolean stop = new AtomicBoolean();
    final AtomicInteger invocations = new AtomicInteger();
    final JobSlot slot =
        register(
            JobDescriptor.builder("stubborn")
                .cron("* * * * *")
                .timeout(Duration.ofMillis(200))
                .handler(
                    token -> {
                      if (invocations.incrementAndGet() == 1) {
                        while (!stop.get()) {
                          Thread.onSpinWait();
                        }
                      }
                    }));
    try {
      final JobRun timedOut = runner.launch(slot, JobTrigger.SCHEDULED).get(2, TimeUnit.SECONDS);
      final JobRun next = runner.launch(slot, JobTrigger.SCHEDULED).get(2, TimeUnit.SECONDS);

      assertThat(timedOut.outcome()).isEqualTo(JobOutcome.TIMED_OUT);
      assertThat(next.outcome()).isEqualTo(JobOutcome.OK);
      assertThat(invocations).hasValue(2);
    } finally {
      stop.set(true);
    }
  }

  @Test
  void failureIsRecordedAndNextRunStillStarts() throws Exception {
    final AtomicInteger invocations = new AtomicInteger();
    final JobSlot slot =
        register(
            JobDescriptor.builder("flaky")
                .cron("* * * * *")
                .handler(
                    token -> {
                      if (invocations.incrementAndGet() == 1) {
                        throw new IllegalStateException("store offline");
                      }
                    }));

    final JobRun failed = runner.launch(slot, JobTrigger.SCHEDULED).get(2, TimeUnit.SECONDS);
    final JobRun ok = runner.launch(slot, JobTrigger.SCHEDULED).get(2, TimeUnit.SECONDS);

    assertThat(failed.outcome()).isEqualTo(JobOutcome.FAILED);
    assertThat(failed.errorMessage()).isEqualTo("store offline");
    assertThat(ok.outcome()).isEqualTo(JobOutcome.OK);
    assertThat(runs).extracting(JobRun::outcome).containsExactly(JobOutcome.FAILED, JobOutcome.OK);
  }

  @Test
  void shutdownCancelsRunningHandlersAndRejectsNewTriggers() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final JobSlot slot =
        register(
            JobDescriptor.builder("long")
                .cron("* * * * *")
                .handler(
                    token -> {
                      started.countDown();
                      while (true) {
                        token.throwIfCancelled();
                        Thread.sleep(10);
                      }
                    }));
    final CompletableFuture<JobRun> running = runner.launch(slot, JobTrigger.SCHEDULED);
    assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

    final boolean drained = runner.shutdown(Duration.ofSeconds(2));

    assertThat(drained).isTrue();
    assertThat(running.get(1, TimeUnit.SECONDS).outcome()).isEqualTo(JobOutcome.FAILED);
    assertThat(runner.accepting()).isFalse();
    assertThat(runner.launch(slot, JobTrigger.MANUAL).get().outcome())
        .isEqualTo(JobOutcome.SKIPPED);
  }

  private JobSlot register(JobDescriptor.Builder builder) {
    final JobDescriptor descriptor = builder.zone(ZoneId.of("UTC")).build();
    registry.register(descriptor);
    return registry.slots().get(registry.slots().size() - 1);
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(2, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private void waitUntilRunning(String name) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
    while (!gate.isRunning(name) && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }
  }
}
