/*
 * Where: Notification channels
 * What: Fans a notification out to every push endpoint of the recipient
 * Why: One dead device must not fail the channel while another received the message
 */
package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.notification.ChannelOutcome;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationTemplates;
import com.logimetrics.coordinator.notification.PushSubscription;
import com.logimetrics.coordinator.notification.PushSubscriptionRepository;
import com.logimetrics.coordinator.notification.Recipient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PushChannelSink implements NotificationChannelSink {

  private static final Logger logger = LoggerFactory.getLogger(PushChannelSink.class);

  private final PushSubscriptionRepository subscriptionRepository;
  private final PushGatewayClient gatewayClient;
  private final NotificationTemplates templates;

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.PUSH;
  }

  @Override
  public ChannelOutcome deliver(Notification notification, Optional<Recipient> recipient) {
    if (!gatewayClient.isConfigured()) {
      return ChannelOutcome.SKIPPED;
    }
    final List<PushSubscription> subscriptions =
        subscriptionRepository.find(notification.recipientId());
    if (subscriptions.isEmpty()) {
      return ChannelOutcome.SKIPPED;
    }
    final Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("id", notification.id());
    payload.put("type", notification.type().value());
    payload.put("title", templates.titleOf(notification));
    payload.put("body", notification.message());
    payload.put("priority", notification.priority().value());
    payload.put("data", notification.data());

    int delivered = 0;
    int failed = 0;
    ChannelFailedException lastFailure = null;
    for (PushSubscription subscription : subscriptions) {
      try {
        if (gatewayClient.send(subscription, payload) == PushGatewayClient.Delivery.GONE) {
          subscriptionRepository.unsubscribe(notification.recipientId(), subscription.endpoint());
          logger.info(
              "push subscription removed: endpoint gone userId={}", notification.recipientId());
        } else {
          delivered++;
        }
      } catch (ChannelFailedException ex) {
        failed++;
        lastFailure = ex;
      }
    }
    logger.debug(
        "push fan-out id={} endpoints={} delivered={} failed={}",
        notification.id(),
        subscriptions.size(),
        delivered,
        failed);
    if (delivered > 0) {
      return ChannelOutcome.OK;
    }
    if (lastFailure != null) {
      throw lastFailure;
    }
    return ChannelOutcome.SKIPPED;
  }
}
