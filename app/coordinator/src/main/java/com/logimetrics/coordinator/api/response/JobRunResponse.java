package com.logimetrics.coordinator.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.logimetrics.coordinator.job.JobRun;
import java.util.Locale;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunResponse(
    String jobName,
    String trigger,
    String startedAt,
    String finishedAt,
    String outcome,
    long durationMs,
    String error) {

  public static JobRunResponse from(JobRun run) {
    if (run == null) {
      return null;
    }
    return new JobRunResponse(
        run.jobName(),
        run.trigger().name().toLowerCase(Locale.ROOT),
        run.startedAt().toString(),
        run.finishedAt() == null ? null : run.finishedAt().toString(),
        run.outcome().value(),
        run.durationMs(),
        run.errorMessage());
  }
}
