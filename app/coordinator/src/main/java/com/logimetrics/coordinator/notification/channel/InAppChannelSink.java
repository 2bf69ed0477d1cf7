/*
 * Where: Notification channels
 * What: Persists the notification row and pushes it to the user's live connections
 * Why: In-app is the channel every notification falls back on, so it must not depend on contact details
 */
package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.notification.ChannelOutcome;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationRepository;
import com.logimetrics.coordinator.notification.Recipient;
import com.logimetrics.coordinator.realtime.RealtimeBus;
import com.logimetrics.coordinator.realtime.RoomKey;
import com.logimetrics.coordinator.realtime.RoomScope;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InAppChannelSink implements NotificationChannelSink {

  static final String EVENT_NEW = "notification:new";

  private final NotificationRepository notificationRepository;
  private final RealtimeBus realtimeBus;

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.IN_APP;
  }

  @Override
  public ChannelOutcome deliver(Notification notification, Optional<Recipient> recipient) {
    try {
      notificationRepository.insert(notification);
    } catch (DataAccessException ex) {
      throw new ChannelFailedException(channel(), "notification insert failed", ex);
    }
    realtimeBus.emitToUser(notification.recipientId(), EVENT_NEW, notification);
    realtimeBus.emitToRoom(
        RoomKey.of(RoomScope.NOTIFICATIONS, notification.recipientId()), EVENT_NEW, notification);
    return ChannelOutcome.OK;
  }
}
