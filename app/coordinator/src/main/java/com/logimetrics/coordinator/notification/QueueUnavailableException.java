package com.logimetrics.coordinator.notification;

public class QueueUnavailableException extends RuntimeException {

  public QueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
