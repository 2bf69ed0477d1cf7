/*
 * Where: Notification pipeline
 * What: Drains one batch of the pending queue through the channel dispatcher
 * Why: Failed deliveries are retried at the tail a bounded number of times, then dropped with a terminal log
 */
package com.logimetrics.coordinator.notification;

import com.logimetrics.coordinator.config.NotificationQueueProperties;
import com.logimetrics.coordinator.domain.AuditTrail;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.job.JobCancelledException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class NotificationQueueRunner {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueueRunner.class);

  private final NotificationQueue queue;
  private final ChannelDispatcher dispatcher;
  private final NotificationMetrics metrics;
  private final NotificationQueueProperties properties;
  private final AuditTrail auditTrail;
  private final Clock clock;

  public NotificationQueueRunner(
      NotificationQueue queue,
      ChannelDispatcher dispatcher,
      NotificationMetrics metrics,
      NotificationQueueProperties properties,
      AuditTrail auditTrail,
      Clock clock) {
    this.queue = queue;
    this.dispatcher = dispatcher;
    this.metrics = metrics;
    this.properties = properties;
    this.auditTrail = auditTrail;
    this.clock = clock;
  }

  public DrainSummary drainOnce(CancellationToken token) {
    final NotificationQueue.DrainBatch batch;
    try {
      batch = queue.drain(properties.batchSize());
    } catch (QueueUnavailableException ex) {
      logger.warn("notification queue unavailable, skipping drain", ex);
      return DrainSummary.unavailable();
    }
    metrics.recordQueueItems(NotificationMetrics.RESULT_MALFORMED, batch.malformed());

    final List<QueueItem> items = batch.items();
    int delivered = 0;
    int retried = 0;
    int dropped = 0;
    int returned = 0;
    for (int i = 0; i < items.size(); i++) {
      if (token.isCancelled()) {
        returned = putBack(items.subList(i, items.size()));
        break;
      }
      final QueueItem item = items.get(i);
      try {
        dispatcher.dispatch(item.notification());
        delivered++;
      } catch (JobCancelledException ex) {
        returned = putBack(items.subList(i, items.size()));
        break;
      } catch (RuntimeException ex) {
        if (handleFailure(item, ex)) {
          retried++;
        } else {
          dropped++;
        }
      }
    }

    metrics.recordQueueItems(NotificationMetrics.RESULT_DELIVERED, delivered);
    metrics.recordQueueItems(NotificationMetrics.RESULT_RETRIED, retried);
    metrics.recordQueueItems(NotificationMetrics.RESULT_DROPPED, dropped);
    updateDepth();
    final DrainSummary summary =
        new DrainSummary(
            true, items.size(), delivered, retried, dropped, batch.malformed(), returned);
    if (summary.popped() > 0 || summary.malformed() > 0) {
      logger.info(
          "notification queue drained popped={} delivered={} retried={} dropped={}"
              + " malformed={} returned={}",
          summary.popped(),
          delivered,
          retried,
          dropped,
          batch.malformed(),
          returned);
    }
    return summary;
  }

  /** Returns true when the item went back on the queue. */
  private boolean handleFailure(QueueItem item, RuntimeException cause) {
    final Notification notification = item.notification();
    if (item.retryCount() >= properties.maxRetries()) {
      logger.error(
          "notification dropped after max retries id={} type={} recipientId={} retryCount={}",
          notification.id(),
          notification.type().value(),
          notification.recipientId(),
          item.retryCount(),
          cause);
      auditDrop(item, cause);
      return false;
    }
    final QueueItem next = item.nextAttempt(Instant.now(clock));
    try {
      queue.enqueue(next);
    } catch (QueueUnavailableException ex) {
      logger.error(
          "notification lost: re-enqueue failed id={} type={} retryCount={}",
          notification.id(),
          notification.type().value(),
          next.retryCount(),
          ex);
      return false;
    }
    logger.warn(
        "notification delivery failed, re-enqueued id={} type={} retryCount={} reason={}",
        notification.id(),
        notification.type().value(),
        next.retryCount(),
        cause.getMessage());
    return true;
  }

  private void auditDrop(QueueItem item, RuntimeException cause) {
    final Notification notification = item.notification();
    final Map<String, Object> details = new LinkedHashMap<>();
    details.put("type", notification.type().value());
    details.put("recipientId", notification.recipientId().toString());
    details.put("retryCount", item.retryCount());
    details.put("error", String.valueOf(cause.getMessage()));
    auditTrail.record(
        "notification.dropped",
        "notification",
        notification.id(),
        notification.companyId(),
        details);
  }

  private int putBack(List<QueueItem> remaining) {
    if (remaining.isEmpty()) {
      return 0;
    }
    try {
      queue.returnUnprocessed(remaining);
      return remaining.size();
    } catch (QueueUnavailableException ex) {
      logger.error("notification drain cancelled and requeue failed lost={}", remaining.size(), ex);
      return 0;
    }
  }

  private void updateDepth() {
    try {
      metrics.updateQueueDepth(queue.depth());
    } catch (QueueUnavailableException ex) {
      logger.debug("notification queue depth unavailable", ex);
    }
  }
}
