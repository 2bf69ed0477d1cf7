package com.logimetrics.coordinator.notification;

import java.util.List;

/** FIFO of pending notification deliveries shared by every producer. */
public interface NotificationQueue {

  /** Appends at the tail. Throws {@link QueueUnavailableException} when the backend is down. */
  void enqueue(QueueItem item);

  /** Pops up to {@code max} items from the head. Unparseable entries are dropped and counted. */
  DrainBatch drain(int max);

  /** Puts items back at the head in their original order. */
  void returnUnprocessed(List<QueueItem> items);

  long depth();

  record DrainBatch(List<QueueItem> items, int malformed) {
    public DrainBatch {
      items = List.copyOf(items);
    }
  }
}
