package com.logimetrics.coordinator.job;

import java.time.Duration;
import java.time.Instant;

public record JobRun(
    String jobName,
    JobTrigger trigger,
    Instant startedAt,
    Instant finishedAt,
    JobOutcome outcome,
    long durationMs,
    String errorMessage) {

  public static JobRun finished(
      String jobName,
      JobTrigger trigger,
      Instant startedAt,
      Instant finishedAt,
      JobOutcome outcome,
      String errorMessage) {
    final long durationMs = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
    return new JobRun(jobName, trigger, startedAt, finishedAt, outcome, durationMs, errorMessage);
  }

  public static JobRun skipped(String jobName, JobTrigger trigger, Instant at, String reason) {
    return new JobRun(jobName, trigger, at, at, JobOutcome.SKIPPED, 0L, reason);
  }
}
