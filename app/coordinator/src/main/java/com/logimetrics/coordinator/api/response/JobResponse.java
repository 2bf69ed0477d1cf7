/*
 * Where: Admin API response DTO
 * What: Operator view of one registered job
 * Why: Durations and enums are rendered as plain strings so dashboards need no Java types
 */
package com.logimetrics.coordinator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.logimetrics.coordinator.job.JobSnapshot;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
    String name,
    String cron,
    String timezone,
    long timeoutSeconds,
    String concurrencyPolicy,
    boolean enabled,
    String status,
    String nextFireAt,
    JobRunResponse lastRun) {

  public static JobResponse from(JobSnapshot snapshot) {
    return new JobResponse(
        snapshot.name(),
        snapshot.cron(),
        snapshot.zone(),
        snapshot.timeout().toSeconds(),
        snapshot.concurrencyPolicy().value(),
        snapshot.enabled(),
        snapshot.status().name().toLowerCase(Locale.ROOT),
        snapshot.nextFireAt() == null ? null : snapshot.nextFireAt().toString(),
        JobRunResponse.from(snapshot.lastRun()));
  }
}
