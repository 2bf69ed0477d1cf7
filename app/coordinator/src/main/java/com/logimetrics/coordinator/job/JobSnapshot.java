package com.logimetrics.coordinator.job;

import java.time.Duration;
import java.time.Instant;

/** Point-in-time view of a registered job for operators. */
public record JobSnapshot(
    String name,
    String cron,
    String zone,
    Duration timeout,
    ConcurrencyPolicy concurrencyPolicy,
    boolean enabled,
    JobStatus status,
    Instant nextFireAt,
    JobRun lastRun) {}
