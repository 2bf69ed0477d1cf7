/*
 * Where: Periodic jobs
 * What: Registers every built-in job with its cadence, timeout and concurrency policy
 * Why: One table of cadences is easier to audit than annotations scattered over handlers
 */
package com.logimetrics.coordinator.jobs;

import com.logimetrics.coordinator.config.FeatureProperties;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.cron.InvalidScheduleException;
import com.logimetrics.coordinator.domain.StoreUnavailableException;
import com.logimetrics.coordinator.job.ConcurrencyPolicy;
import com.logimetrics.coordinator.job.DuplicateJobException;
import com.logimetrics.coordinator.job.JobDescriptor;
import com.logimetrics.coordinator.job.JobHandler;
import com.logimetrics.coordinator.job.JobRegistry;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Job beans and the registry are shared Spring-managed components")
public class JobCatalog implements InitializingBean {

  static final Duration LONG_RUNNING_TIMEOUT = Duration.ofMinutes(30);

  private static final Logger logger = LoggerFactory.getLogger(JobCatalog.class);

  private final JobRegistry registry;
  private final InvoiceJobs invoiceJobs;
  private final NotificationJobs notificationJobs;
  private final TrackingJobs trackingJobs;
  private final AnalyticsJobs analyticsJobs;
  private final ExpiryJobs expiryJobs;
  private final CleanupJobs cleanupJobs;
  private final SyncJobs syncJobs;
  private final FeatureProperties features;
  private final ZoneId zone;
  private final Duration defaultTimeout;

  public JobCatalog(
      JobRegistry registry,
      InvoiceJobs invoiceJobs,
      NotificationJobs notificationJobs,
      TrackingJobs trackingJobs,
      AnalyticsJobs analyticsJobs,
      ExpiryJobs expiryJobs,
      CleanupJobs cleanupJobs,
      SyncJobs syncJobs,
      FeatureProperties features,
      SchedulerProperties schedulerProperties) {
    this.registry = registry;
    this.invoiceJobs = invoiceJobs;
    this.notificationJobs = notificationJobs;
    this.trackingJobs = trackingJobs;
    this.analyticsJobs = analyticsJobs;
    this.expiryJobs = expiryJobs;
    this.cleanupJobs = cleanupJobs;
    this.syncJobs = syncJobs;
    this.features = features;
    this.zone = schedulerProperties.zoneId();
    this.defaultTimeout = schedulerProperties.defaultTimeout();
  }

  @Override
  public void afterPropertiesSet() {
    int registered = 0;
    for (JobDescriptor descriptor : descriptors()) {
      try {
        registry.register(descriptor);
        registered++;
      } catch (InvalidScheduleException | DuplicateJobException ex) {
        logger.error("job registration rejected name={}", descriptor.name(), ex);
      }
    }
    logger.info("job catalog registered count={}", registered);
  }

  List<JobDescriptor> descriptors() {
    final List<JobDescriptor> jobs = new ArrayList<>(24);
    // billing
    jobs.add(job("processRecurringInvoices", "0 1 * * *", invoiceJobs::processRecurringInvoices));
    jobs.add(job("sendPaymentReminders", "0 9 * * *", invoiceJobs::sendPaymentReminders));
    jobs.add(job("updateOverdueStatus", "0 0 * * *", invoiceJobs::updateOverdueStatus));
    // notifications
    jobs.add(
        builder(
                "processNotificationQueue",
                "*/5 * * * *",
                notificationJobs::processNotificationQueue)
            .concurrencyPolicy(ConcurrencyPolicy.QUEUE_ONE)
            .build());
    jobs.add(
        job("cleanupOldNotifications", "0 2 * * *", notificationJobs::cleanupOldNotifications));
    jobs.add(
        job("sendDigestNotifications", "0 8 * * *", notificationJobs::sendDigestNotifications));
    // tracking
    jobs.add(
        builder("archiveOldTrackingData", "0 3 * * 0", trackingJobs::archiveOldTrackingData)
            .timeout(LONG_RUNNING_TIMEOUT)
            .build());
    jobs.add(job("cleanupStaleSessions", "*/30 * * * *", trackingJobs::cleanupStaleSessions));
    jobs.add(
        job("aggregateTrackingMetrics", "0 4 * * *", trackingJobs::aggregateTrackingMetrics));
    // analytics
    jobs.add(job("generateDailyReports", "0 5 * * *", analyticsJobs::generateDailyReports));
    jobs.add(job("generateWeeklyReports", "0 6 * * 1", analyticsJobs::generateWeeklyReports));
    jobs.add(job("generateMonthlyReports", "0 7 1 * *", analyticsJobs::generateMonthlyReports));
    jobs.add(job("cacheAnalyticsData", "*/15 * * * *", analyticsJobs::cacheAnalyticsData));
    // maintenance
    jobs.add(job("checkVehicleMaintenance", "0 8 * * *", expiryJobs::checkVehicleMaintenance));
    jobs.add(job("checkLicenseExpiry", "0 9 * * *", expiryJobs::checkLicenseExpiry));
    jobs.add(job("checkDocumentExpiry", "0 10 * * *", expiryJobs::checkDocumentExpiry));
    // cleanup
    jobs.add(
        builder("cleanupDatabase", "0 2 * * 0", cleanupJobs::cleanupDatabase)
            .timeout(LONG_RUNNING_TIMEOUT)
            .build());
    jobs.add(job("rotateLogs", "0 3 1 * *", cleanupJobs::rotateLogs));
    jobs.add(job("cleanupTempFiles", "0 4 * * *", cleanupJobs::cleanupTempFiles));
    jobs.add(job("cleanupExpiredTokens", "0 1 * * *", cleanupJobs::cleanupExpiredTokens));
    // sync
    jobs.add(
        gated(
            "syncExternalSystems",
            "*/30 * * * *",
            syncJobs::syncExternalSystems,
            features::externalSyncEnabled));
    jobs.add(job("reconcilePayments", "0 6 * * *", syncJobs::reconcilePayments));
    jobs.add(
        gated(
            "syncMLPredictions",
            "0 */4 * * *",
            syncJobs::syncMLPredictions,
            features::mlPredictionsEnabled));
    jobs.add(job("healthCheck", "*/10 * * * *", syncJobs::healthCheck));
    return jobs;
  }

  private JobDescriptor job(String name, String cron, JobHandler handler) {
    return builder(name, cron, handler).build();
  }

  private JobDescriptor gated(
      String name, String cron, JobHandler handler, BooleanSupplier enabledWhen) {
    return builder(name, cron, handler).enabledWhen(enabledWhen).build();
  }

  private JobDescriptor.Builder builder(String name, String cron, JobHandler handler) {
    return JobDescriptor.builder(name)
        .cron(cron)
        .zone(zone)
        .timeout(defaultTimeout)
        .handler(storeGuarded(handler));
  }

  /** Spring data access failures surface as a named unavailable store on the failed run. */
  static JobHandler storeGuarded(JobHandler handler) {
    return token -> {
      try {
        handler.run(token);
      } catch (DataAccessException ex) {
        throw StoreUnavailableException.from(ex);
      }
    };
  }
}
