package com.logimetrics.coordinator.job;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JobMetricsTest {

  private static final Instant STARTED = Instant.parse("2026-02-24T00:00:00Z");

  @Test
  void recordsOutcomesDurationsAndRunningGauge() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final SingleFlightGate gate = new SingleFlightGate();
    final JobMetrics metrics = new JobMetrics(registry, gate);
    gate.tryAcquire("healthCheck", ConcurrencyPolicy.SKIP_IF_RUNNING);

    metrics.onRunFinished(
        JobRun.finished(
            "healthCheck",
            JobTrigger.SCHEDULED,
            STARTED,
            STARTED.plusMillis(250),
            JobOutcome.OK,
            null));
    metrics.onRunFinished(JobRun.skipped("healthCheck", JobTrigger.SCHEDULED, STARTED, "busy"));

    final Counter ok =
        registry
            .get("coordinator.job.runs")
            .tags("job", "healthCheck", "outcome", "ok")
            .counter();
    final Counter skipped =
        registry
            .get("coordinator.job.runs")
            .tags("job", "healthCheck", "outcome", "skipped")
            .counter();
    final Timer duration =
        registry.get("coordinator.job.duration").tag("job", "healthCheck").timer();
    final Gauge running = registry.get("coordinator.job.running").gauge();

    assertThat(ok.count()).isEqualTo(1.0d);
    assertThat(skipped.count()).isEqualTo(1.0d);
    assertThat(duration.count()).isEqualTo(1L);
    assertThat(running.value()).isEqualTo(1.0d);
  }
}
