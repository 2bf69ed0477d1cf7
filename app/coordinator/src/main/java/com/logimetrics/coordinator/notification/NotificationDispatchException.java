package com.logimetrics.coordinator.notification;

/** Raised when no requested channel delivered and at least one failed, so the item is retryable. */
public class NotificationDispatchException extends RuntimeException {

  private final transient DispatchResult result;

  public NotificationDispatchException(DispatchResult result) {
    super("notification delivery failed on every channel id=" + result.notificationId()
        + " outcomes=" + result.outcomes());
    this.result = result;
  }

  public DispatchResult result() {
    return result;
  }
}
