package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.notification.NotificationChannel;

public class ChannelFailedException extends RuntimeException {

  private final NotificationChannel channel;

  public ChannelFailedException(NotificationChannel channel, String message, Throwable cause) {
    super(channel.value() + ": " + message, cause);
    this.channel = channel;
  }

  public NotificationChannel channel() {
    return channel;
  }
}
