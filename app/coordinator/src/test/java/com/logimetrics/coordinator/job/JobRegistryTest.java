package com.logimetrics.coordinator.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.google.common.util.concurrent.MoreExecutors;
import com.logimetrics.coordinator.cron.InvalidScheduleException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class JobRegistryTest {

  private ThreadPoolTaskScheduler timeoutScheduler;
  private JobRegistry registry;

  @BeforeEach
  void setUp() {
    timeoutScheduler = new ThreadPoolTaskScheduler();
    timeoutScheduler.initialize();
    final SingleFlightGate gate = new SingleFlightGate();
    final JobRunner runner =
        new JobRunner(
            gate,
            MoreExecutors.newDirectExecutorService(),
            timeoutScheduler,
            Clock.systemUTC(),
            List.of());
    registry = new JobRegistry(runner, gate);
  }

  @AfterEach
  void tearDown() {
    timeoutScheduler.shutdown();
  }

  @Test
  void registerReturnsIdleSnapshot() {
    final JobSnapshot snapshot =
        registry.register(
            JobDescriptor.builder("generateDailyReports")
                .cron("0 1 * * *")
                .zone(ZoneId.of("Asia/Kolkata"))
                .timeout(Duration.ofMinutes(10))
                .handler(token -> {})
                .build());

    assertThat(snapshot.name()).isEqualTo("generateDailyReports");
    assertThat(snapshot.cron()).isEqualTo("0 1 * * *");
    assertThat(snapshot.zone()).isEqualTo("Asia/Kolkata");
    assertThat(snapshot.timeout()).isEqualTo(Duration.ofMinutes(10));
    assertThat(snapshot.concurrencyPolicy()).isEqualTo(ConcurrencyPolicy.SKIP_IF_RUNNING);
    assertThat(snapshot.enabled()).isTrue();
    assertThat(snapshot.status()).isEqualTo(JobStatus.IDLE);
    assertThat(snapshot.lastRun()).isNull();
  }

  @Test
  void duplicateNameIsRejected() {
    registry.register(job("healthCheck", "*/5 * * * *"));

    assertThatThrownBy(() -> registry.register(job("healthCheck", "0 * * * *")))
        .isInstanceOf(DuplicateJobException.class)
        .hasMessageContaining("healthCheck");
    assertThat(registry.list()).hasSize(1);
  }

  @Test
  void invalidCronIsRejectedAtRegistration() {
    assertThatThrownBy(() -> registry.register(job("broken", "every five minutes")))
        .isInstanceOf(InvalidScheduleException.class);
    assertThat(registry.list()).isEmpty();
  }

  @Test
  void enablePredicateIsEvaluatedOnceAtRegistration() {
    final AtomicInteger evaluations = new AtomicInteger();
    final JobSnapshot snapshot =
        registry.register(
            JobDescriptor.builder("syncMLPredictions")
                .cron("*/30 * * * *")
                .handler(token -> {})
                .enabledWhen(
                    () -> {
                      evaluations.incrementAndGet();
                      return false;
                    })
                .build());

    registry.list();
    registry.get("syncMLPredictions");

    assertThat(snapshot.enabled()).isFalse();
    assertThat(evaluations).hasValue(1);
  }

  @Test
  void operatorControlsToggleState() {
    registry.register(job("cleanupDatabase", "0 3 * * 0"));

    assertThat(registry.disable("cleanupDatabase").enabled()).isFalse();
    assertThat(registry.enable("cleanupDatabase").enabled()).isTrue();
    assertThat(registry.pause("cleanupDatabase").status()).isEqualTo(JobStatus.PAUSED);
    assertThat(registry.resume("cleanupDatabase").status()).isEqualTo(JobStatus.IDLE);
  }

  @Test
  void unknownNameIsReported() {
    assertThatThrownBy(() -> registry.get("missing"))
        .isInstanceOf(UnknownJobException.class)
        .hasMessage("job not found: missing");
    assertThatThrownBy(() -> registry.runNow("missing")).isInstanceOf(UnknownJobException.class);
  }

  @Test
  void runNowIgnoresPauseAndRecordsManualRun() {
    final AtomicInteger invocations = new AtomicInteger();
    registry.register(
        JobDescriptor.builder("cacheAnalyticsData")
            .cron("*/15 * * * *")
            .handler(token -> invocations.incrementAndGet())
            .build());
    registry.pause("cacheAnalyticsData");

    final JobRun run = registry.runNow("cacheAnalyticsData");

    assertThat(invocations).hasValue(1);
    assertThat(run.trigger()).isEqualTo(JobTrigger.MANUAL);
    assertThat(run.outcome()).isEqualTo(JobOutcome.OK);
    assertThat(registry.get("cacheAnalyticsData").lastRun()).isEqualTo(run);
  }

  @Test
  void descriptorRequiresPositiveTimeout() {
    assertThatThrownBy(
            () ->
                JobDescriptor.builder("zero")
                    .cron("* * * * *")
                    .handler(token -> {})
                    .timeout(Duration.ZERO)
                    .build())
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static JobDescriptor job(String name, String cron) {
    return JobDescriptor.builder(name).cron(cron).handler(token -> {}).build();
  }
}
