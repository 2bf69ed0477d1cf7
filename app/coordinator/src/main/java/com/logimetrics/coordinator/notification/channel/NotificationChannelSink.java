package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.notification.ChannelOutcome;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.Recipient;
import java.util.Optional;

/**
 * One delivery medium. Returns {@link ChannelOutcome#SKIPPED} when there is nothing to deliver to
 * and throws {@link ChannelFailedException} when the provider rejected or could not be reached.
 */
public interface NotificationChannelSink {

  NotificationChannel channel();

  ChannelOutcome deliver(Notification notification, Optional<Recipient> recipient);
}
