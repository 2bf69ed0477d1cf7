package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Delivery media. Declaration order is the order channels are attempted in. */
public enum NotificationChannel {
  IN_APP("in_app"),
  EMAIL("email"),
  SMS("sms"),
  PUSH("push");

  private final String value;

  NotificationChannel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static NotificationChannel fromValue(String channel) {
    for (NotificationChannel candidate : values()) {
      if (candidate.value.equalsIgnoreCase(channel)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported notification channel: " + channel);
  }
}
