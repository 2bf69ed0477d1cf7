/*
 * Where: Notification pipeline
 * What: Entry point for producers; enqueues, or dispatches once directly when the queue is down
 * Why: Critical user-facing notifications must not vanish because Redis is unreachable
 */
package com.logimetrics.coordinator.notification;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationPublisher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationPublisher.class);

  private final NotificationQueue queue;
  private final ChannelDispatcher dispatcher;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public PublishResult publish(Notification notification) {
    try {
      queue.enqueue(QueueItem.first(notification, Instant.now(clock)));
      return PublishResult.QUEUED;
    } catch (QueueUnavailableException ex) {
      logger.warn(
          "notification queue unavailable, dispatching directly id={} type={}",
          notification.id(),
          notification.type().value(),
          ex);
    }
    try {
      dispatcher.dispatch(notification);
      metrics.recordQueueItems(NotificationMetrics.RESULT_DIRECT, 1);
      return PublishResult.DISPATCHED_DIRECTLY;
    } catch (RuntimeException ex) {
      metrics.recordQueueItems(NotificationMetrics.RESULT_LOST, 1);
      logger.error(
          "notification lost: direct dispatch failed id={} type={} recipientId={}",
          notification.id(),
          notification.type().value(),
          notification.recipientId(),
          ex);
      return PublishResult.LOST;
    }
  }

  public int publishAll(List<Notification> notifications) {
    int accepted = 0;
    for (Notification notification : notifications) {
      if (publish(notification) != PublishResult.LOST) {
        accepted++;
      }
    }
    return accepted;
  }
}
