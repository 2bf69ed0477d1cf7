package com.logimetrics.coordinator.jobs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.google.common.util.concurrent.MoreExecutors;
import com.logimetrics.coordinator.config.FeatureProperties;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.domain.StoreUnavailableException;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.job.ConcurrencyPolicy;
import com.logimetrics.coordinator.job.JobDescriptor;
import com.logimetrics.coordinator.job.JobHandler;
import com.logimetrics.coordinator.job.JobRegistry;
import com.logimetrics.coordinator.job.JobRunner;
import com.logimetrics.coordinator.job.JobSnapshot;
import com.logimetrics.coordinator.job.SingleFlightGate;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class JobCatalogTest {

  private final InvoiceJobs invoiceJobs = mock(InvoiceJobs.class);
  private final NotificationJobs notificationJobs = mock(NotificationJobs.class);
  private final TrackingJobs trackingJobs = mock(TrackingJobs.class);
  private final AnalyticsJobs analyticsJobs = mock(AnalyticsJobs.class);
  private final ExpiryJobs expiryJobs = mock(ExpiryJobs.class);
  private final CleanupJobs cleanupJobs = mock(CleanupJobs.class);
  private final SyncJobs syncJobs = mock(SyncJobs.class);
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
  void registersEveryBuiltInJobInSchedulerZone() {
    final JobCatalog catalog = catalog(new FeatureProperties(true, "http://ml:8000"));

    catalog.afterPropertiesSet();

    final List<JobSnapshot> jobs = registry.list();
    assertThat(jobs).hasSize(24);
    assertThat(jobs).extracting(JobSnapshot::zone).containsOnly("Asia/Kolkata");
    assertThat(jobs).allMatch(JobSnapshot::enabled);
  }

  @Test
  void policiesAndTimeoutsFollowJobWeight() {
    final Map<String, JobDescriptor> byName =
        catalog(new FeatureProperties(false, null)).descriptors().stream()
            .collect(Collectors.toMap(JobDescriptor::name, Function.identity()));

    assertThat(byName.get("processNotificationQueue").concurrencyPolicy())
        .isEqualTo(ConcurrencyPolicy.QUEUE_ONE);
    assertThat(byName.get("processNotificationQueue").cron()).isEqualTo("*/5 * * * *");
    assertThat(byName.get("generateDailyReports").concurrencyPolicy())
        .isEqualTo(ConcurrencyPolicy.SKIP_IF_RUNNING);
    assertThat(byName.get("archiveOldTrackingData").timeout())
        .isEqualTo(JobCatalog.LONG_RUNNING_TIMEOUT);
    assertThat(byName.get("cleanupDatabase").timeout())
        .isEqualTo(JobCatalog.LONG_RUNNING_TIMEOUT);
    assertThat(byName.get("healthCheck").timeout()).isEqualTo(Duration.ofMinutes(5));
    assertThat(byName.get("generateMonthlyReports").cron()).isEqualTo("0 7 1 * *");
  }

  @Test
  void featureGatedJobsRegisterDisabled() {
    catalog(new FeatureProperties(false, "  ")).afterPropertiesSet();

    assertThat(registry.get("syncExternalSystems").enabled()).isFalse();
    assertThat(registry.get("syncMLPredictions").enabled()).isFalse();
    assertThat(registry.get("reconcilePayments").enabled()).isTrue();
  }

  @Test
  void handlersDelegateToJobBeans() throws Exception {
    final Map<String, JobDescriptor> byName =
        catalog(new FeatureProperties(false, null)).descriptors().stream()
            .collect(Collectors.toMap(JobDescriptor::name, Function.identity()));
    final CancellationToken token = CancellationToken.create();

    byName.get("checkLicenseExpiry").handler().run(token);
    byName.get("processNotificationQueue").handler().run(token);

    verify(expiryJobs).checkLicenseExpiry(token);
    verify(notificationJobs).processNotificationQueue(token);
  }

  @Test
  void dataAccessFailureSurfacesAsUnavailableStore() throws Exception {
    final CancellationToken token = CancellationToken.create();
    final JobHandler failing = mock(JobHandler.class);
    doThrow(new DataAccessResourceFailureException("connection refused"))
        .when(failing)
        .run(token);

    assertThatThrownBy(() -> JobCatalog.storeGuarded(failing).run(token))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessage("postgres: connection refused")
        .extracting(ex -> ((StoreUnavailableException) ex).store())
        .isEqualTo(StoreUnavailableException.POSTGRES);
  }

  private JobCatalog catalog(FeatureProperties features) {
    return new JobCatalog(
        registry,
        invoiceJobs,
        notificationJobs,
        trackingJobs,
        analyticsJobs,
        expiryJobs,
        cleanupJobs,
        syncJobs,
        features,
        new SchedulerProperties(true, "Asia/Kolkata", null, null, 0, 0, null));
  }
}
