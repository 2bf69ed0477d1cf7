/*
 * Where: Periodic jobs
 * What: External system sync, payment reconciliation, ML ETA refresh and the health probe
 * Why: Outbound calls are slow and fallible, so they are batched off the request path
 */
package com.logimetrics.coordinator.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.domain.Integration;
import com.logimetrics.coordinator.domain.IntegrationRepository;
import com.logimetrics.coordinator.domain.InvoiceRepository;
import com.logimetrics.coordinator.domain.PaymentTransaction;
import com.logimetrics.coordinator.domain.ShipmentRepository;
import com.logimetrics.coordinator.domain.ShipmentRepository.EtaCandidate;
import com.logimetrics.coordinator.domain.TransactionRepository;
import com.logimetrics.coordinator.health.HealthMonitor;
import com.logimetrics.coordinator.health.HealthSnapshot;
import com.logimetrics.coordinator.integration.EtaPrediction;
import com.logimetrics.coordinator.integration.ExternalSystemClient;
import com.logimetrics.coordinator.integration.IntegrationCallException;
import com.logimetrics.coordinator.integration.MlPredictionClient;
import com.logimetrics.coordinator.integration.PaymentGatewayClient;
import com.logimetrics.coordinator.integration.PaymentGatewayClient.GatewayStatus;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationPriority;
import com.logimetrics.coordinator.notification.NotificationPublisher;
import com.logimetrics.coordinator.notification.NotificationType;
import com.logimetrics.coordinator.notification.Recipient;
import com.logimetrics.coordinator.notification.RecipientDirectory;
import com.logimetrics.coordinator.tenant.BatchPager;
import com.logimetrics.coordinator.tenant.IterationOptions;
import com.logimetrics.coordinator.tenant.IterationResult;
import com.logimetrics.coordinator.tenant.Tenant;
import com.logimetrics.coordinator.tenant.TenantIterator;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "Clients, repositories and templates are shared Spring-managed components")
public class SyncJobs {

  static final Duration RECONCILE_LOOKBACK = Duration.ofDays(7);
  static final Duration MISSED_WEBHOOK_AFTER = Duration.ofHours(2);
  static final int ETA_BATCH_SIZE = 100;
  static final String ETA_CACHE_KEY = "ml:eta:predictions";
  static final Duration ETA_CACHE_TTL = Duration.ofHours(1);
  static final List<String> PAYMENT_RECIPIENT_ROLES =
      List.of(RecipientDirectory.ROLE_ADMIN, RecipientDirectory.ROLE_FINANCE);

  private static final Logger logger = LoggerFactory.getLogger(SyncJobs.class);

  private final TenantIterator tenantIterator;
  private final IterationOptions iterationOptions;
  private final IntegrationRepository integrationRepository;
  private final ExternalSystemClient externalSystemClient;
  private final TransactionRepository transactionRepository;
  private final InvoiceRepository invoiceRepository;
  private final PaymentGatewayClient paymentGatewayClient;
  private final ShipmentRepository shipmentRepository;
  private final MlPredictionClient mlPredictionClient;
  private final RecipientDirectory recipientDirectory;
  private final NotificationPublisher publisher;
  private final HealthMonitor healthMonitor;
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public record PredictionSummary(int candidates, int predicted, int stored) {}

  public SyncJobs(
      TenantIterator tenantIterator,
      IterationOptions iterationOptions,
      IntegrationRepository integrationRepository,
      ExternalSystemClient externalSystemClient,
      TransactionRepository transactionRepository,
      InvoiceRepository invoiceRepository,
      PaymentGatewayClient paymentGatewayClient,
      ShipmentRepository shipmentRepository,
      MlPredictionClient mlPredictionClient,
      RecipientDirectory recipientDirectory,
      NotificationPublisher publisher,
      HealthMonitor healthMonitor,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      Clock clock) {
    this.tenantIterator = tenantIterator;
    this.iterationOptions = iterationOptions;
    this.integrationRepository = integrationRepository;
    this.externalSystemClient = externalSystemClient;
    this.transactionRepository = transactionRepository;
    this.invoiceRepository = invoiceRepository;
    this.paymentGatewayClient = paymentGatewayClient;
    this.shipmentRepository = shipmentRepository;
    this.mlPredictionClient = mlPredictionClient;
    this.recipientDirectory = recipientDirectory;
    this.publisher = publisher;
    this.healthMonitor = healthMonitor;
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  public IterationResult syncExternalSystems(CancellationToken token) {
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> {
          for (Integration integration : integrationRepository.findEnabled(tenant.id())) {
            tenantToken.throwIfCancelled();
            sync(integration);
          }
        },
        iterationOptions,
        token);
  }

  private void sync(Integration integration) {
    final Instant startedAt = Instant.now(clock);
    try {
      externalSystemClient.requestSync(integration, integration.lastSyncedAt());
    } catch (IntegrationCallException ex) {
      logger.warn(
          "external sync failed integration={} reason={}", integration, ex.reason(), ex);
      integrationRepository.markFailed(integration.id(), ex.getMessage());
      return;
    }
    integrationRepository.markSynced(integration.id(), startedAt);
    logger.info("external sync requested integration={}", integration);
  }

  public IterationResult reconcilePayments(CancellationToken token) {
    if (!paymentGatewayClient.isConfigured()) {
      logger.info("payment reconciliation skipped reason=gateway_not_configured");
      return new IterationResult(List.of());
    }
    final Instant now = Instant.now(clock);
    final Instant since = now.minus(RECONCILE_LOOKBACK);
    return tenantIterator.forEachTenant(
        (tenant, tenantToken) -> reconcileTenant(tenant, since, now, tenantToken),
        iterationOptions,
        token);
  }

  private void reconcileTenant(
      Tenant tenant, Instant since, Instant now, CancellationToken token) throws Exception {
    final AtomicInteger updated = new AtomicInteger();
    final AtomicInteger failedLookups = new AtomicInteger();
    final long checked =
        BatchPager.forEachPage(
            iterationOptions.batchSize(),
            (UUID afterId, int limit) ->
                transactionRepository.findUnsettledSince(tenant.id(), since, afterId, limit),
            PaymentTransaction::id,
            page -> {
              for (PaymentTransaction transaction : page) {
                final Reconciliation result = reconcile(tenant, transaction);
                if (result == Reconciliation.UPDATED) {
                  updated.incrementAndGet();
                } else if (result == Reconciliation.LOOKUP_FAILED) {
                  failedLookups.incrementAndGet();
                }
              }
            },
            token);
    final int stale =
        transactionRepository.countProcessingBefore(tenant.id(), now.minus(MISSED_WEBHOOK_AFTER));
    if (stale > 0) {
      logger.warn(
          "payments processing without webhook tenantId={} count={} olderThan={}",
          tenant.id(),
          stale,
          MISSED_WEBHOOK_AFTER);
    }
    final int expired = transactionRepository.failUnsettledBefore(tenant.id(), since, now);
    logger.info(
        "payments reconciled tenantId={} checked={} updated={} failedLookups={} expired={}",
        tenant.id(),
        checked,
        updated.get(),
        failedLookups.get(),
        expired);
  }

  enum Reconciliation {
    UNCHANGED,
    UPDATED,
    LOOKUP_FAILED
  }

  private Reconciliation reconcile(Tenant tenant, PaymentTransaction transaction) {
    if (transaction.gatewayReference() == null || transaction.gatewayReference().isBlank()) {
      return Reconciliation.UNCHANGED;
    }
    final GatewayStatus gateway;
    try {
      gateway = paymentGatewayClient.status(transaction.gatewayReference());
    } catch (IntegrationCallException ex) {
      logger.warn(
          "payment status lookup failed transactionId={} reason={}",
          transaction.id(),
          ex.reason(),
          ex);
      return Reconciliation.LOOKUP_FAILED;
    }
    if (gateway.status().equals(transaction.status())) {
      return Reconciliation.UNCHANGED;
    }
    final Instant now = Instant.now(clock);
    transactionRepository.updateStatus(
        transaction.id(), gateway.status(), gateway.rawResponse(), now);
    logger.info(
        "payment status reconciled transactionId={} from={} to={}",
        transaction.id(),
        transaction.status(),
        gateway.status());
    if (PaymentTransaction.COMPLETED.equals(gateway.status())) {
      if (transaction.invoiceId() != null) {
        invoiceRepository.markPaid(transaction.invoiceId(), now);
      }
      notifyPayment(tenant, transaction, NotificationType.PAYMENT_RECEIVED);
    } else if (PaymentTransaction.FAILED.equals(gateway.status())) {
      notifyPayment(tenant, transaction, NotificationType.PAYMENT_FAILED);
    }
    return Reconciliation.UPDATED;
  }

  private void notifyPayment(Tenant tenant, PaymentTransaction transaction, NotificationType type) {
    final boolean received = type == NotificationType.PAYMENT_RECEIVED;
    final String message =
        (received ? "Payment received: " : "Payment failed: ")
            + transaction.amount()
            + " (ref "
            + transaction.gatewayReference()
            + ")";
    for (Recipient recipient :
        recipientDirectory.findByCompanyAndRoles(tenant.id(), PAYMENT_RECIPIENT_ROLES)) {
      final Notification.Builder builder =
          Notification.builder(recipient.id(), type)
              .companyId(tenant.id())
              .title(received ? "Payment Received" : "Payment Failed")
              .message(message)
              .data("transactionId", transaction.id().toString())
              .channels(NotificationChannel.IN_APP)
              .priority(received ? NotificationPriority.NORMAL : NotificationPriority.HIGH);
      if (transaction.invoiceId() != null) {
        builder.data("invoiceId", transaction.invoiceId().toString());
      }
      publisher.publish(builder.build(clock));
    }
  }

  public PredictionSummary syncMLPredictions(CancellationToken token) {
    final List<EtaCandidate> candidates = shipmentRepository.findActiveForEta(ETA_BATCH_SIZE);
    if (candidates.isEmpty()) {
      return new PredictionSummary(0, 0, 0);
    }
    token.throwIfCancelled();
    final List<EtaPrediction> predictions = mlPredictionClient.predictEta(candidates);
    final Instant now = Instant.now(clock);
    int stored = 0;
    final List<Map<String, Object>> cached = new ArrayList<>(predictions.size());
    for (EtaPrediction prediction : predictions) {
      token.throwIfCancelled();
      final String predictionJson;
      try {
        predictionJson = objectMapper.writeValueAsString(prediction.raw());
      } catch (JsonProcessingException ex) {
        logger.warn("eta prediction not serializable shipmentId={}", prediction.shipmentId(), ex);
        continue;
      }
      stored +=
          shipmentRepository.updateEstimatedDelivery(
              prediction.shipmentId(), prediction.eta(), predictionJson, now);
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("shipmentId", prediction.shipmentId().toString());
      entry.put("eta", prediction.eta().toString());
      cached.add(entry);
    }
    cachePredictions(cached, now);
    logger.info(
        "ml predictions synced candidates={} predicted={} stored={}",
        candidates.size(),
        predictions.size(),
        stored);
    return new PredictionSummary(candidates.size(), predictions.size(), stored);
  }

  private void cachePredictions(List<Map<String, Object>> predictions, Instant generatedAt) {
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("generatedAt", generatedAt.toString());
    payload.put("predictions", predictions);
    try {
      redisTemplate
          .opsForValue()
          .set(ETA_CACHE_KEY, objectMapper.writeValueAsString(payload), ETA_CACHE_TTL);
    } catch (JsonProcessingException | DataAccessException ex) {
      logger.warn("eta prediction cache write failed key={}", ETA_CACHE_KEY, ex);
    }
  }

  public HealthSnapshot healthCheck(CancellationToken token) {
    return healthMonitor.check(token);
  }
}
