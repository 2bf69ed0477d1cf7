/*
 * Where: Job scheduler
 * What: Single coordinator that fires registered jobs at their next cron instant
 * Why: One logical timer keeps cadences exact without polling and never blocks on job I/O
 */
package com.logimetrics.coordinator.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

/**
 * Drives jobs from a logical timer. {@link #tick(Instant)} fires everything due at the given
 * instant and returns the next wake-up; in production the wake-up is scheduled on a
 * single-threaded {@link TaskScheduler}, in tests the caller advances time itself.
 *
 * <p>Missed fire times (for example after a long GC pause) collapse into one run.
 */
public class JobScheduler implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);
  private static final AtomicBoolean PROCESS_SCHEDULER_ACTIVE = new AtomicBoolean(false);

  private final JobRegistry registry;
  private final JobRunner runner;
  private final TaskScheduler timer;
  private final Clock clock;
  private final Duration shutdownGrace;
  private final boolean autoStart;
  private volatile boolean running;
  private volatile ScheduledFuture<?> pendingWake;

  public JobScheduler(
      JobRegistry registry,
      JobRunner runner,
      TaskScheduler timer,
      Clock clock,
      Duration shutdownGrace,
      boolean autoStart) {
    this.registry = registry;
    this.runner = runner;
    this.timer = timer;
    this.clock = clock;
    this.shutdownGrace = shutdownGrace;
    this.autoStart = autoStart;
  }

  /**
   * Fires every enabled, unpaused job whose next fire instant is at or before {@code now}, then
   * returns the earliest upcoming fire instant across all jobs (null when nothing is scheduled).
   */
  public Instant tick(Instant now) {
    Instant earliest = null;
    for (JobSlot slot : registry.slots()) {
      Instant next = slot.nextFireAt();
      if (next == null) {
        next = slot.schedule().next(now);
        slot.nextFireAt(next);
      } else if (!next.isAfter(now)) {
        fire(slot, now);
        next = slot.schedule().next(now);
        slot.nextFireAt(next);
      }
      if (next != null && (earliest == null || next.isBefore(earliest))) {
        earliest = next;
      }
    }
    return earliest;
  }

  /** Earliest scheduled instant across jobs, without firing anything. */
  public Instant nextWakeAt() {
    Instant earliest = null;
    for (JobSlot slot : registry.slots()) {
      final Instant next = slot.nextFireAt();
      if (next != null && (earliest == null || next.isBefore(earliest))) {
        earliest = next;
      }
    }
    return earliest;
  }

  private void fire(JobSlot slot, Instant now) {
    if (!slot.enabled() || slot.paused()) {
      logger.debug(
          "job tick ignored name={} enabled={} paused={}",
          slot.name(),
          slot.enabled(),
          slot.paused());
      return;
    }
    try {
      runner.launch(slot, JobTrigger.SCHEDULED);
    } catch (RuntimeException ex) {
      logger.error("job launch failed name={} at={}", slot.name(), now, ex);
    }
  }

  private void onWake() {
    if (!running) {
      return;
    }
    Instant next = null;
    try {
      next = tick(clock.instant());
    } catch (RuntimeException ex) {
      logger.error("scheduler tick failed", ex);
      next = clock.instant().plusSeconds(1);
    } finally {
      scheduleWake(next);
    }
  }

  private void scheduleWake(Instant next) {
    if (!running || next == null) {
      return;
    }
    pendingWake = timer.schedule(this::onWake, next);
  }

  @Override
  public void start() {
    if (running) {
      return;
    }
    if (!PROCESS_SCHEDULER_ACTIVE.compareAndSet(false, true)) {
      throw new IllegalStateException("another job scheduler is already active in this process");
    }
    running = true;
    final Instant first = tick(clock.instant());
    logger.info("job scheduler started jobs={} nextWakeAt={}", registry.slots().size(), first);
    scheduleWake(first);
  }

  @Override
  public void stop() {
    if (!running) {
      return;
    }
    running = false;
    final ScheduledFuture<?> wake = pendingWake;
    if (wake != null) {
      wake.cancel(false);
    }
    final boolean drained = runner.shutdown(shutdownGrace);
    PROCESS_SCHEDULER_ACTIVE.set(false);
    logger.info("job scheduler stopped drained={}", drained);
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public boolean isAutoStartup() {
    return autoStart;
  }
}
