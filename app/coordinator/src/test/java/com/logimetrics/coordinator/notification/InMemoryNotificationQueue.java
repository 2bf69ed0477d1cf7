package com.logimetrics.coordinator.notification;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** List-backed queue with the same head and tail semantics as the Redis one. */
class InMemoryNotificationQueue implements NotificationQueue {

  private final Deque<QueueItem> items = new ArrayDeque<>();
  private boolean available = true;

  void available(boolean value) {
    this.available = value;
  }

  List<QueueItem> contents() {
    return new ArrayList<>(items);
  }

  @Override
  public synchronized void enqueue(QueueItem item) {
    requireAvailable();
    items.addLast(item);
  }

  @Override
  public synchronized DrainBatch drain(int max) {
    requireAvailable();
    final List<QueueItem> popped = new ArrayList<>();
    while (popped.size() < max && !items.isEmpty()) {
      popped.add(items.pollFirst());
    }
    return new DrainBatch(popped, 0);
  }

  @Override
  public synchronized void returnUnprocessed(List<QueueItem> returned) {
    requireAvailable();
    for (int i = returned.size() - 1; i >= 0; i--) {
      items.addFirst(returned.get(i));
    }
  }

  @Override
  public synchronized long depth() {
    requireAvailable();
    return items.size();
  }

  private void requireAvailable() {
    if (!available) {
      throw new QueueUnavailableException("queue offline", null);
    }
  }
}
