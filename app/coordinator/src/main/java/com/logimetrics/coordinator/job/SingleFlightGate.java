/*
 * Where: Job execution
 * What: Tracks which jobs are running and hands out run permits according to the concurrency policy
 * Why: Scheduler ticks and operator run-now requests must share one view of what is in flight
 */
package com.logimetrics.coordinator.job;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class SingleFlightGate {

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Integer> running = new HashMap<>();
  private final Map<Long, Permit> active = new HashMap<>();
  private long sequence;

  public record Permit(long id, String jobName, CancellationToken token) {}

  public Optional<Permit> tryAcquire(String jobName, ConcurrencyPolicy policy) {
    lock.lock();
    try {
      final int current = running.getOrDefault(jobName, 0);
      if (current > 0 && policy != ConcurrencyPolicy.ALLOW_CONCURRENT) {
        return Optional.empty();
      }
      running.put(jobName, current + 1);
      final Permit permit = new Permit(++sequence, jobName, CancellationToken.create());
      active.put(permit.id(), permit);
      return Optional.of(permit);
    } finally {
      lock.unlock();
    }
  }

  public void release(Permit permit) {
    lock.lock();
    try {
      if (active.remove(permit.id()) == null) {
        return;
      }
      final int remaining = running.getOrDefault(permit.jobName(), 1) - 1;
      if (remaining <= 0) {
        running.remove(permit.jobName());
      } else {
        running.put(permit.jobName(), remaining);
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean isRunning(String jobName) {
    lock.lock();
    try {
      return running.getOrDefault(jobName, 0) > 0;
    } finally {
      lock.unlock();
    }
  }

  public int activeCount() {
    lock.lock();
    try {
      return active.size();
    } finally {
      lock.unlock();
    }
  }

  /** Cancels every in-flight run and returns how many were signalled. */
  public int cancelAll(CancellationToken.Reason reason) {
    final List<Permit> snapshot;
    lock.lock();
    try {
      snapshot = new ArrayList<>(active.values());
    } finally {
      lock.unlock();
    }
    snapshot.forEach(permit -> permit.token().cancel(reason));
    return snapshot.size();
  }
}
