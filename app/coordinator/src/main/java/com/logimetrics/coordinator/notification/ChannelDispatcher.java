/*
 * Where: Notification pipeline
 * What: Delivers one notification over each requested channel and reports an outcome per channel
 * Why: A failing provider must not stop the other channels, and in-app is always attempted
 */
package com.logimetrics.coordinator.notification;

import com.logimetrics.coordinator.job.JobCancelledException;
import com.logimetrics.coordinator.notification.channel.NotificationChannelSink;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class ChannelDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(ChannelDispatcher.class);

  private final RecipientDirectory recipientDirectory;
  private final Map<NotificationChannel, NotificationChannelSink> sinks =
      new EnumMap<>(NotificationChannel.class);
  private final NotificationMetrics metrics;

  public ChannelDispatcher(
      RecipientDirectory recipientDirectory,
      List<NotificationChannelSink> channelSinks,
      NotificationMetrics metrics) {
    this.recipientDirectory = recipientDirectory;
    this.metrics = metrics;
    for (NotificationChannelSink sink : channelSinks) {
      if (sinks.putIfAbsent(sink.channel(), sink) != null) {
        throw new IllegalStateException("duplicate sink for channel " + sink.channel().value());
      }
    }
  }

  /**
   * Returns an outcome for every requested channel. Throws {@link NotificationDispatchException}
   * when nothing was delivered and at least one channel failed, so callers can retry.
   */
  public DispatchResult dispatch(Notification notification) {
    Optional<Recipient> recipient;
    boolean lookupFailed = false;
    try {
      recipient = recipientDirectory.find(notification.recipientId());
    } catch (DataAccessException ex) {
      logger.warn(
          "recipient lookup failed id={} recipientId={}",
          notification.id(),
          notification.recipientId(),
          ex);
      recipient = Optional.empty();
      lookupFailed = true;
    }

    final Map<NotificationChannel, ChannelOutcome> outcomes =
        new EnumMap<>(NotificationChannel.class);
    for (NotificationChannel channel : NotificationChannel.values()) {
      if (!notification.channels().contains(channel)) {
        continue;
      }
      final ChannelOutcome outcome = deliver(channel, notification, recipient, lookupFailed);
      outcomes.put(channel, outcome);
      metrics.recordChannelOutcome(channel, outcome);
    }

    final DispatchResult result = new DispatchResult(notification.id(), outcomes);
    if (!result.anyDelivered() && result.anyFailed()) {
      throw new NotificationDispatchException(result);
    }
    logger.debug("notification dispatched id={} outcomes={}", notification.id(), outcomes);
    return result;
  }

  private ChannelOutcome deliver(
      NotificationChannel channel,
      Notification notification,
      Optional<Recipient> recipient,
      boolean lookupFailed) {
    final NotificationChannelSink sink = sinks.get(channel);
    if (sink == null) {
      return ChannelOutcome.SKIPPED;
    }
    if (lookupFailed && needsContactDetails(channel)) {
      return ChannelOutcome.FAILED;
    }
    try {
      return sink.deliver(notification, recipient);
    } catch (JobCancelledException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn(
          "notification channel failed id={} channel={} type={}",
          notification.id(),
          channel.value(),
          notification.type().value(),
          ex);
      return ChannelOutcome.FAILED;
    }
  }

  private static boolean needsContactDetails(NotificationChannel channel) {
    return switch (channel) {
      case EMAIL, SMS -> true;
      case IN_APP, PUSH -> false;
    };
  }
}
