/*
 * Where: Job execution
 * What: Launches handler runs on worker threads behind the single-flight gate and enforces timeouts
 * Why: A failing, hanging or overlapping job must never stall the coordinator or other jobs
 */
package com.logimetrics.coordinator.job;

import com.logimetrics.common.TraceIds;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

public class JobRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobRunner.class);
  private static final String MDC_JOB_NAME = "job_name";
  private static final int ERROR_MESSAGE_MAX_LENGTH = 500;

  private final SingleFlightGate gate;
  private final ExecutorService workers;
  private final TaskScheduler timeoutScheduler;
  private final Clock clock;
  private final List<JobRunListener> listeners;
  private volatile boolean accepting = true;

  public JobRunner(
      SingleFlightGate gate,
      ExecutorService workers,
      TaskScheduler timeoutScheduler,
      Clock clock,
      List<JobRunListener> listeners) {
    this.gate = gate;
    this.workers = workers;
    this.timeoutScheduler = timeoutScheduler;
    this.clock = clock;
    this.listeners = List.copyOf(listeners);
  }

  /**
   * Starts a run of the job in {@code slot}. The returned future completes with the JobRun once
   * the handler finishes or its timeout fires. A trigger parked by queue-one completes when the
   * parked run does.
   */
  CompletableFuture<JobRun> launch(JobSlot slot, JobTrigger trigger) {
    final JobDescriptor descriptor = slot.descriptor();
    final Instant now = clock.instant();
    if (!accepting) {
      return CompletableFuture.completedFuture(
          record(slot, JobRun.skipped(slot.name(), trigger, now, "scheduler is shutting down")));
    }
    final Optional<SingleFlightGate.Permit> permit =
        gate.tryAcquire(slot.name(), descriptor.concurrencyPolicy());
    if (permit.isEmpty()) {
      if (descriptor.concurrencyPolicy() == ConcurrencyPolicy.QUEUE_ONE
          && trigger != JobTrigger.MANUAL) {
        logger.info("job trigger parked behind running instance name={}", slot.name());
        final CompletableFuture<JobRun> parked = slot.park();
        // the running instance may have released between the refused acquire and the park
        if (!gate.isRunning(slot.name())) {
          relaunchParked(slot);
        }
        return parked;
      }
      logger.info("job run skipped because previous run is active name={}", slot.name());
      return CompletableFuture.completedFuture(
          record(slot, JobRun.skipped(slot.name(), trigger, now, "previous run still active")));
    }
    return start(slot, trigger, permit.get(), now);
  }

  private CompletableFuture<JobRun> start(
      JobSlot slot, JobTrigger trigger, SingleFlightGate.Permit permit, Instant startedAt) {
    final CompletableFuture<JobRun> result = new CompletableFuture<>();
    final AtomicBoolean settled = new AtomicBoolean();
    final String traceId = TraceIds.newTraceId();
    final Future<?> task;
    try {
      task =
          workers.submit(
              () -> execute(slot, trigger, permit, startedAt, traceId, settled, result));
    } catch (RejectedExecutionException ex) {
      gate.release(permit);
      logger.warn("job run rejected by worker pool name={}", slot.name(), ex);
      return CompletableFuture.completedFuture(
          record(
              slot, JobRun.skipped(slot.name(), trigger, startedAt, "worker pool rejected run")));
    }
    if (!result.isDone()) {
      final Duration timeout = slot.descriptor().timeout();
      final ScheduledFuture<?> watchdog =
          timeoutScheduler.schedule(
              () -> onTimeout(slot, trigger, permit, startedAt, task, settled, result),
              timeoutScheduler.getClock().instant().plus(timeout));
      result.whenComplete((run, error) -> watchdog.cancel(false));
    }
    return result;
  }

  private void execute(
      JobSlot slot,
      JobTrigger trigger,
      SingleFlightGate.Permit permit,
      Instant startedAt,
      String traceId,
      AtomicBoolean settled,
      CompletableFuture<JobRun> result) {
    MDC.put(MDC_JOB_NAME, slot.name());
    MDC.put(TraceIds.MDC_TRACE_ID, traceId);
    JobOutcome outcome = JobOutcome.OK;
    String error = null;
    try {
      logger.info("job run started name={} trigger={}", slot.name(), trigger);
      slot.descriptor().handler().run(permit.token());
      if (permit.token().isCancelled()) {
        outcome = outcomeFor(permit.token());
        error = "cancelled: " + permit.token().reason();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      outcome = permit.token().isCancelled() ? outcomeFor(permit.token()) : JobOutcome.FAILED;
      error = "interrupted";
    } catch (JobCancelledException ex) {
      outcome = outcomeFor(permit.token());
      error = ex.getMessage();
    } catch (Exception ex) {
      if (permit.token().isCancelled()) {
        outcome = outcomeFor(permit.token());
        error = "cancelled: " + permit.token().reason();
      } else {
        outcome = JobOutcome.FAILED;
        error = truncate(ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage());
        logger.error("job run failed name={}", slot.name(), ex);
      }
    } finally {
      gate.release(permit);
      settle(
          slot,
          settled,
          result,
          JobRun.finished(slot.name(), trigger, startedAt, clock.instant(), outcome, error));
      MDC.remove(MDC_JOB_NAME);
      MDC.remove(TraceIds.MDC_TRACE_ID);
      relaunchParked(slot);
    }
  }

  private void onTimeout(
      JobSlot slot,
      JobTrigger trigger,
      SingleFlightGate.Permit permit,
      Instant startedAt,
      Future<?> task,
      AtomicBoolean settled,
      CompletableFuture<JobRun> result) {
    if (settled.get()) {
      return;
    }
    permit.token().cancel(CancellationToken.Reason.TIMEOUT);
    task.cancel(true);
    final JobRun run =
        JobRun.finished(
            slot.name(),
            trigger,
            startedAt,
            clock.instant(),
            JobOutcome.TIMED_OUT,
            "exceeded timeout " + slot.descriptor().timeout());
    if (settle(slot, settled, result, run)) {
      logger.warn(
          "job run timed out name={} timeoutMs={}",
          slot.name(),
          slot.descriptor().timeout().toMillis());
      // a handler that ignores cancellation must not hold the job closed past its deadline
      gate.release(permit);
      relaunchParked(slot);
    }
  }

  // lastRun and listeners are updated before the future completes
  private boolean settle(
      JobSlot slot, AtomicBoolean settled, CompletableFuture<JobRun> result, JobRun run) {
    if (!settled.compareAndSet(false, true)) {
      return false;
    }
    record(slot, run);
    result.complete(run);
    return true;
  }

  private void relaunchParked(JobSlot slot) {
    if (!slot.hasParked()) {
      return;
    }
    final CompletableFuture<JobRun> parked = slot.takeParked();
    if (parked == null) {
      return;
    }
    final CompletableFuture<JobRun> relaunched;
    try {
      relaunched = launch(slot, JobTrigger.QUEUED);
    } catch (RuntimeException ex) {
      logger.error("parked job trigger could not be relaunched name={}", slot.name(), ex);
      parked.complete(
          record(
              slot,
              JobRun.skipped(slot.name(), JobTrigger.QUEUED, clock.instant(), "relaunch failed")));
      return;
    }
    relaunched.whenComplete((run, error) -> parked.complete(run));
  }

  private JobOutcome outcomeFor(CancellationToken token) {
    return token.reason() == CancellationToken.Reason.SHUTDOWN
        ? JobOutcome.FAILED
        : JobOutcome.TIMED_OUT;
  }

  private JobRun record(JobSlot slot, JobRun run) {
    slot.lastRun(run);
    logger.info(
        "job run finished name={} trigger={} outcome={} durationMs={}",
        run.jobName(),
        run.trigger(),
        run.outcome().value(),
        run.durationMs());
    for (JobRunListener listener : listeners) {
      try {
        listener.onRunFinished(run);
      } catch (RuntimeException ex) {
        logger.warn("job run listener failed name={}", run.jobName(), ex);
      }
    }
    return run;
  }

  /**
   * Stops accepting triggers, signals every running handler and waits up to {@code grace} for the
   * worker pool to drain. Returns true when all handlers unwound in time.
   */
  public boolean shutdown(Duration grace) {
    accepting = false;
    final int cancelled = gate.cancelAll(CancellationToken.Reason.SHUTDOWN);
    logger.info("job runner shutting down runningJobs={} graceMs={}", cancelled, grace.toMillis());
    workers.shutdown();
    try {
      if (workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    final int abandoned = workers.shutdownNow().size();
    logger.warn("job runner forced shutdown after grace window abandonedTasks={}", abandoned);
    return false;
  }

  public boolean accepting() {
    return accepting;
  }

  private String truncate(String message) {
    if (message.length() <= ERROR_MESSAGE_MAX_LENGTH) {
      return message;
    }
    return message.substring(0, ERROR_MESSAGE_MAX_LENGTH);
  }
}
