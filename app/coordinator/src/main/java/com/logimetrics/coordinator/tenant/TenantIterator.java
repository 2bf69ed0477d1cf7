/*
 * Where: Tenant iteration
 * What: Runs per-tenant work with a bounded timeout and records an outcome for each tenant
 * Why: A failing or slow company must not prevent the remaining companies from being processed
 */
package com.logimetrics.coordinator.tenant;

import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.job.JobCancelledException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

public class TenantIterator {

  static final String MDC_COMPANY_ID = "company_id";

  private static final Logger logger = LoggerFactory.getLogger(TenantIterator.class);

  private final TenantRepository tenantRepository;
  private final ExecutorService tenantExecutor;
  private final Clock clock;

  public TenantIterator(
      TenantRepository tenantRepository, ExecutorService tenantExecutor, Clock clock) {
    this.tenantRepository = tenantRepository;
    this.tenantExecutor = tenantExecutor;
    this.clock = clock;
  }

  public IterationResult forEachTenant(
      Predicate<Tenant> predicate,
      TenantWork work,
      IterationOptions options,
      CancellationToken token) {
    final List<Tenant> tenants = tenantRepository.findActive().stream().filter(predicate).toList();
    final Duration perTenantTimeout = options.resolvePerTenantTimeout(tenants.size());
    final List<TenantOutcome> outcomes = new ArrayList<>(tenants.size());
    boolean stop = false;
    for (Tenant tenant : tenants) {
      if (stop || token.isCancelled()) {
        outcomes.add(new TenantOutcome(tenant.id(), TenantOutcome.Status.NOT_ATTEMPTED, null));
        continue;
      }
      final TenantOutcome outcome = runOne(tenant, work, perTenantTimeout, token);
      outcomes.add(outcome);
      if (outcome.status() != TenantOutcome.Status.OK && !options.continueOnError()) {
        stop = true;
      }
    }
    final IterationResult result = new IterationResult(outcomes);
    logger.info(
        "tenant iteration finished tenants={} ok={} failed={} timedOut={} notAttempted={}",
        tenants.size(),
        result.count(TenantOutcome.Status.OK),
        result.count(TenantOutcome.Status.FAILED),
        result.count(TenantOutcome.Status.TIMED_OUT),
        result.count(TenantOutcome.Status.NOT_ATTEMPTED));
    return result;
  }

  public IterationResult forEachTenant(
      TenantWork work, IterationOptions options, CancellationToken token) {
    return forEachTenant(tenant -> true, work, options, token);
  }

  private TenantOutcome runOne(
      Tenant tenant, TenantWork work, Duration timeout, CancellationToken parent) {
    final CancellationToken child = parent.child(clock, timeout);
    // the tenant thread logs under the calling job's keys plus the company it works on
    final Map<String, String> callerContext = MDC.getCopyOfContextMap();
    final Future<?> future =
        tenantExecutor.submit(
            () -> {
              final Map<String, String> workerContext = MDC.getCopyOfContextMap();
              if (callerContext != null) {
                MDC.setContextMap(callerContext);
              }
              MDC.put(MDC_COMPANY_ID, tenant.id().toString());
              try {
                work.process(tenant, child);
                return null;
              } finally {
                restore(workerContext);
              }
            });
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return TenantOutcome.ok(tenant.id());
    } catch (TimeoutException ex) {
      child.cancel(CancellationToken.Reason.TIMEOUT);
      future.cancel(true);
      logger.warn(
          "tenant work timed out tenantId={} timeoutMs={}", tenant.id(), timeout.toMillis());
      return new TenantOutcome(
          tenant.id(), TenantOutcome.Status.TIMED_OUT, "exceeded " + timeout.toMillis() + "ms");
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause() == null ? ex : ex.getCause();
      if (cause instanceof JobCancelledException cancelled
          && cancelled.reason() == CancellationToken.Reason.TIMEOUT) {
        logger.warn("tenant work cancelled by deadline tenantId={}", tenant.id());
        return new TenantOutcome(tenant.id(), TenantOutcome.Status.TIMED_OUT, cause.getMessage());
      }
      logger.warn("tenant work failed tenantId={}", tenant.id(), cause);
      return new TenantOutcome(tenant.id(), TenantOutcome.Status.FAILED, describe(cause));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      child.cancel(CancellationToken.Reason.PARENT);
      future.cancel(true);
      return new TenantOutcome(tenant.id(), TenantOutcome.Status.FAILED, "interrupted");
    }
  }

  private static void restore(Map<String, String> context) {
    if (context == null) {
      MDC.clear();
    } else {
      MDC.setContextMap(context);
    }
  }

  private String describe(Throwable cause) {
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }
}
