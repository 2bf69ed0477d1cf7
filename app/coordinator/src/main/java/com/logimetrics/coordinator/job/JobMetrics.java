/*
 * Where: Job execution
 * What: Records run outcomes, durations and in-flight runs as Micrometer meters
 * Why: Operators alert on failing or slow jobs from Prometheus instead of grepping logs
 */
package com.logimetrics.coordinator.job;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class JobMetrics implements JobRunListener {

  private static final String METRIC_RUNS_TOTAL = "coordinator.job.runs";
  private static final String METRIC_RUN_DURATION = "coordinator.job.duration";
  private static final String METRIC_RUNNING = "coordinator.job.running";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> durationTimers = new ConcurrentHashMap<>();

  public JobMetrics(MeterRegistry meterRegistry, SingleFlightGate gate) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_RUNNING, gate, SingleFlightGate::activeCount)
        .description("Job runs currently holding a permit")
        .register(meterRegistry);
  }

  @Override
  public void onRunFinished(JobRun run) {
    final String outcome = run.outcome().value();
    runCounters
        .computeIfAbsent(
            run.jobName() + "|" + outcome,
            ignored ->
                Counter.builder(METRIC_RUNS_TOTAL)
                    .description("Job run outcomes")
                    .tags(Tags.of("job", run.jobName(), "outcome", outcome))
                    .register(meterRegistry))
        .increment();
    if (run.outcome() == JobOutcome.SKIPPED) {
      return;
    }
    durationTimers
        .computeIfAbsent(
            run.jobName(),
            name ->
                Timer.builder(METRIC_RUN_DURATION)
                    .description("Job run wall-clock duration")
                    .tags(Tags.of("job", name))
                    .register(meterRegistry))
        .record(Duration.ofMillis(run.durationMs()));
  }
}
