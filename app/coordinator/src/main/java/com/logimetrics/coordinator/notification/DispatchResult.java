package com.logimetrics.coordinator.notification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/** Outcome per requested channel. Every requested channel has an entry. */
public record DispatchResult(
    UUID notificationId, Map<NotificationChannel, ChannelOutcome> outcomes) {

  public DispatchResult {
    final Map<NotificationChannel, ChannelOutcome> copy = new EnumMap<>(NotificationChannel.class);
    copy.putAll(outcomes);
    outcomes = Collections.unmodifiableMap(copy);
  }

  public ChannelOutcome outcome(NotificationChannel channel) {
    return outcomes.get(channel);
  }

  public boolean anyDelivered() {
    return outcomes.containsValue(ChannelOutcome.OK);
  }

  public boolean anyFailed() {
    return outcomes.containsValue(ChannelOutcome.FAILED);
  }
}
