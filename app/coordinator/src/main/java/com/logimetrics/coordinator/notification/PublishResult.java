package com.logimetrics.coordinator.notification;

public enum PublishResult {
  QUEUED,
  DISPATCHED_DIRECTLY,
  LOST
}
