package com.logimetrics.coordinator.notification;

import java.time.Instant;

/** Envelope stored in the pending list. retryCount never exceeds the configured cap. */
public record QueueItem(Notification notification, int retryCount, Instant enqueuedAt) {

  public static QueueItem first(Notification notification, Instant enqueuedAt) {
    return new QueueItem(notification, 0, enqueuedAt);
  }

  public QueueItem nextAttempt(Instant at) {
    return new QueueItem(notification, retryCount + 1, at);
  }
}
