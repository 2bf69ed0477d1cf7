package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationPriority {
  LOW("low"),
  NORMAL("normal"),
  HIGH("high"),
  URGENT("urgent");

  private final String value;

  NotificationPriority(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static NotificationPriority fromValue(String priority) {
    for (NotificationPriority candidate : values()) {
      if (candidate.value.equalsIgnoreCase(priority)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("unsupported notification priority: " + priority);
  }
}
