package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.notification.ChannelOutcome;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationTemplates;
import com.logimetrics.coordinator.notification.Recipient;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SmsChannelSink implements NotificationChannelSink {

  private final SmsGatewayClient gatewayClient;
  private final NotificationTemplates templates;

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.SMS;
  }

  @Override
  public ChannelOutcome deliver(Notification notification, Optional<Recipient> recipient) {
    if (!gatewayClient.isConfigured()) {
      return ChannelOutcome.SKIPPED;
    }
    if (recipient.isEmpty() || !recipient.get().hasPhone()) {
      return ChannelOutcome.SKIPPED;
    }
    gatewayClient.send(recipient.get().phone(), templates.sms(notification));
    return ChannelOutcome.OK;
  }
}
