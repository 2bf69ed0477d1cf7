package com.logimetrics.coordinator.job;

import com.logimetrics.coordinator.cron.CronSchedule;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Registry-owned state of one job. Running work refers to a slot by its index; flags are
 * volatile so operator calls and the coordinator thread see each other's writes.
 */
final class JobSlot {

  private final int index;
  private final JobDescriptor descriptor;
  private final CronSchedule schedule;
  private final AtomicReference<CompletableFuture<JobRun>> parked = new AtomicReference<>();
  private volatile boolean enabled;
  private volatile boolean paused;
  private volatile Instant nextFireAt;
  private volatile JobRun lastRun;

  JobSlot(int index, JobDescriptor descriptor, CronSchedule schedule, boolean enabled) {
    this.index = index;
    this.descriptor = descriptor;
    this.schedule = schedule;
    this.enabled = enabled;
  }

  int index() {
    return index;
  }

  JobDescriptor descriptor() {
    return descriptor;
  }

  String name() {
    return descriptor.name();
  }

  CronSchedule schedule() {
    return schedule;
  }

  boolean enabled() {
    return enabled;
  }

  void enabled(boolean value) {
    this.enabled = value;
  }

  boolean paused() {
    return paused;
  }

  void paused(boolean value) {
    this.paused = value;
  }

  Instant nextFireAt() {
    return nextFireAt;
  }

  void nextFireAt(Instant value) {
    this.nextFireAt = value;
  }

  JobRun lastRun() {
    return lastRun;
  }

  void lastRun(JobRun value) {
    this.lastRun = value;
  }

  /** Parks one pending trigger; later triggers collapse into the same future. */
  CompletableFuture<JobRun> park() {
    final CompletableFuture<JobRun> fresh = new CompletableFuture<>();
    if (parked.compareAndSet(null, fresh)) {
      return fresh;
    }
    final CompletableFuture<JobRun> existing = parked.get();
    return existing == null ? park() : existing;
  }

  CompletableFuture<JobRun> takeParked() {
    return parked.getAndSet(null);
  }

  boolean hasParked() {
    return parked.get() != null;
  }
}
