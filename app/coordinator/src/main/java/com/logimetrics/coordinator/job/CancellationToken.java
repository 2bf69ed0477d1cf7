/*
 * Where: Job execution
 * What: Cooperative cancellation signal passed to handlers, tenant work and store calls
 * Why: Per-job timeouts and shutdown must unwind work that is blocked in I/O or looping over batches
 */
package com.logimetrics.coordinator.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public final class CancellationToken {

  public enum Reason {
    TIMEOUT,
    SHUTDOWN,
    PARENT
  }

  private final CancellationToken parent;
  private final Clock clock;
  private final Instant deadline;
  private volatile Reason reason;

  private CancellationToken(CancellationToken parent, Clock clock, Instant deadline) {
    this.parent = parent;
    this.clock = clock;
    this.deadline = deadline;
  }

  public static CancellationToken create() {
    return new CancellationToken(null, null, null);
  }

  /** Child token cancelled with its parent, and additionally once {@code budget} has elapsed. */
  public CancellationToken child(Clock childClock, Duration budget) {
    return new CancellationToken(this, childClock, Instant.now(childClock).plus(budget));
  }

  public void cancel(Reason cancelReason) {
    if (reason == null) {
      reason = cancelReason;
    }
  }

  public boolean isCancelled() {
    return reason() != null;
  }

  public Reason reason() {
    if (reason != null) {
      return reason;
    }
    if (parent != null && parent.isCancelled()) {
      return Reason.PARENT;
    }
    if (deadline != null && !Instant.now(clock).isBefore(deadline)) {
      return Reason.TIMEOUT;
    }
    return null;
  }

  public void throwIfCancelled() {
    final Reason current = reason();
    if (current != null) {
      throw new JobCancelledException(current);
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new JobCancelledException(Reason.TIMEOUT);
    }
  }
}
