/*
 * Where: Periodic jobs
 * What: Daily, weekly and monthly tenant reports plus the periodic dashboard refresh
 * Why: Reports are read far more often than they change, so they are materialized off-peak
 */
package com.logimetrics.coordinator.jobs;

import com.google.common.annotations.VisibleForTesting;
import com.logimetrics.coordinator.config.SchedulerProperties;
import com.logimetrics.coordinator.dashboard.DashboardProjection;
import com.logimetrics.coordinator.dashboard.DashboardRepository;
import com.logimetrics.coordinator.domain.ReportRepository;
import com.logimetrics.coordinator.domain.ShipmentRepository;
import com.logimetrics.coordinator.domain.ShipmentRepository.RevenueStats;
import com.logimetrics.coordinator.domain.ShipmentRepository.ShipmentStats;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.tenant.IterationOptions;
import com.logimetrics.coordinator.tenant.IterationResult;
import com.logimetrics.coordinator.tenant.Tenant;
import com.logimetrics.coordinator.tenant.TenantIterator;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnalyticsJobs {

  private static final Logger logger = LoggerFactory.getLogger(AnalyticsJobs.class);

  private final TenantIterator tenantIterator;
  private final IterationOptions iterationOptions;
  private final ShipmentRepository shipmentRepository;
  private final DashboardRepository dashboardRepository;
  private final ReportRepository reportRepository;
  private final DashboardProjection dashboardProjection;
  private final ZoneId zone;
  private final Clock clock;

  public AnalyticsJobs(
      TenantIterator tenantIterator,
      IterationOptions iterationOptions,
      ShipmentRepository shipmentRepository,
      DashboardRepository dashboardRepository,
      ReportRepository reportRepository,
      DashboardProjection dashboardProjection,
      SchedulerProperties schedulerProperties,
      Clock clock) {
    this.tenantIterator = tenantIterator;
    this.iterationOptions = iterationOptions;
    this.shipmentRepository = shipmentRepository;
    this.dashboardRepository = dashboardRepository;
    this.reportRepository = reportRepository;
    this.dashboardProjection = dashboardProjection;
    this.zone = schedulerProperties.zoneId();
    this.clock = clock;
  }

  public IterationResult generateDailyReports(CancellationToken token) {
    final LocalDate day = today().minusDays(1);
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> dailyReport(tenant, day), iterationOptions, token);
  }

  private void dailyReport(Tenant tenant, LocalDate day) {
    final Instant from = startOf(day);
    final Instant to = startOf(day.plusDays(1));
    final ShipmentStats shipments = shipmentRepository.statsCreatedBetween(tenant.id(), from, to);
    final RevenueStats revenue = shipmentRepository.revenuePaidBetween(tenant.id(), from, to);
    final Document report =
        new Document("_id", tenant.id() + ":" + day)
            .append("companyId", tenant.id().toString())
            .append("date", Date.from(from))
            .append(
                "shipments",
                new Document("total", shipments.total())
                    .append("completed", shipments.completed())
                    .append("cancelled", shipments.cancelled())
                    .append(
                        "completionRate",
                        completionRate(shipments.completed(), shipments.total())))
            .append(
                "revenue",
                new Document("total", money(revenue.total()))
                    .append("invoiceCount", revenue.invoiceCount()))
            .append(
                "fleet",
                new Document(
                        "vehicles",
                        statusCounts(dashboardRepository.vehiclesByStatus(tenant.id())))
                    .append(
                        "drivers", statusCounts(dashboardRepository.driversByStatus(tenant.id()))))
            .append("generatedAt", Date.from(Instant.now(clock)));
    reportRepository.save(ReportRepository.DAILY_REPORTS, report);
    logger.info(
        "daily report generated tenantId={} date={} shipments={} revenue={}",
        tenant.id(),
        day,
        shipments.total(),
        revenue.total());
  }

  private static Document statusCounts(Map<String, Long> counts) {
    final Document document = new Document();
    counts.forEach(document::append);
    return document;
  }

  /** Roll-up of the seven daily reports ending yesterday. */
  public IterationResult generateWeeklyReports(CancellationToken token) {
    final LocalDate weekEnd = today();
    final LocalDate weekStart = weekEnd.minusDays(7);
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final Totals week = totals(tenant, weekStart, weekEnd);
          final Document report =
              new Document("_id", tenant.id() + ":" + weekStart)
                  .append("companyId", tenant.id().toString())
                  .append("weekStart", Date.from(startOf(weekStart)))
                  .append("weekEnd", Date.from(startOf(weekEnd)))
                  .append("generatedAt", Date.from(Instant.now(clock)));
          week.appendTo(report);
          reportRepository.save(ReportRepository.WEEKLY_REPORTS, report);
          logger.info(
              "weekly report generated tenantId={} weekStart={} days={}",
              tenant.id(),
              weekStart,
              week.days());
        },
        iterationOptions,
        token);
  }

  /** Roll-up of the previous calendar month compared with the month before it. */
  public IterationResult generateMonthlyReports(CancellationToken token) {
    final YearMonth month = YearMonth.from(today()).minusMonths(1);
    final YearMonth previousMonth = month.minusMonths(1);
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          final Totals current = totals(tenant, month.atDay(1), month.plusMonths(1).atDay(1));
          final Totals previous = totals(tenant, previousMonth.atDay(1), month.atDay(1));
          final Document report =
              new Document("_id", tenant.id() + ":" + month)
                  .append("companyId", tenant.id().toString())
                  .append("month", month.toString())
                  .append(
                      "comparison",
                      new Document(
                              "shipmentsChange",
                              percentChange(current.shipments(), previous.shipments()))
                          .append(
                              "revenueChange",
                              percentChange(current.revenue(), previous.revenue())))
                  .append("generatedAt", Date.from(Instant.now(clock)));
          current.appendTo(report);
          reportRepository.save(ReportRepository.MONTHLY_REPORTS, report);
          logger.info(
              "monthly report generated tenantId={} month={} days={}",
              tenant.id(),
              month,
              current.days());
        },
        iterationOptions,
        token);
  }

  public IterationResult cacheAnalyticsData(CancellationToken token) {
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> dashboardProjection.refresh(tenant.id()),
        iterationOptions,
        token);
  }

  private Totals totals(Tenant tenant, LocalDate fromInclusive, LocalDate toExclusive) {
    final List<Document> days =
        reportRepository.findDaily(
            tenant.id(), Date.from(startOf(fromInclusive)), Date.from(startOf(toExclusive)));
    return Totals.of(days);
  }

  private LocalDate today() {
    return LocalDate.now(clock.withZone(zone));
  }

  private Instant startOf(LocalDate day) {
    return day.atStartOfDay(zone).toInstant();
  }

  @VisibleForTesting
  static long completionRate(long completed, long total) {
    return total == 0 ? 0 : Math.round(completed * 100.0 / total);
  }

  @VisibleForTesting
  static long percentChange(double current, double previous) {
    if (previous == 0) {
      return current > 0 ? 100 : 0;
    }
    return Math.round((current - previous) / previous * 100);
  }

  private static double money(BigDecimal amount) {
    return amount == null ? 0.0 : amount.setScale(2, RoundingMode.HALF_UP).doubleValue();
  }

  /** Sums over a run of daily report documents. */
  @VisibleForTesting
  record Totals(
      int days, long shipments, long completed, long cancelled, double revenue, long invoices) {

    static Totals of(List<Document> dailyReports) {
      long shipments = 0;
      long completed = 0;
      long cancelled = 0;
      double revenue = 0;
      long invoices = 0;
      for (Document daily : dailyReports) {
        final Document shipmentPart = daily.get("shipments", new Document());
        final Document revenuePart = daily.get("revenue", new Document());
        shipments += number(shipmentPart.get("total")).longValue();
        completed += number(shipmentPart.get("completed")).longValue();
        cancelled += number(shipmentPart.get("cancelled")).longValue();
        revenue += number(revenuePart.get("total")).doubleValue();
        invoices += number(revenuePart.get("invoiceCount")).longValue();
      }
      return new Totals(
          dailyReports.size(),
          shipments,
          completed,
          cancelled,
          Math.round(revenue * 100) / 100.0,
          invoices);
    }

    void appendTo(Document report) {
      report
          .append("days", days)
          .append(
              "shipments",
              new Document("total", shipments)
                  .append("completed", completed)
                  .append("cancelled", cancelled)
                  .append("completionRate", completionRate(completed, shipments)))
          .append("revenue", new Document("total", revenue).append("invoiceCount", invoices));
    }

    private static Number number(Object value) {
      return value instanceof Number n ? n : 0;
    }
  }
}
