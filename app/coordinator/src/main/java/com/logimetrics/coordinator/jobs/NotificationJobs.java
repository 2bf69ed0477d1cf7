package com.logimetrics.coordinator.jobs;

import com.logimetrics.coordinator.config.RetentionProperties;
import com.logimetrics.coordinator.job.CancellationToken;
import com.logimetrics.coordinator.notification.DrainSummary;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationQueueRunner;
import com.logimetrics.coordinator.notification.NotificationRepository;
import com.logimetrics.coordinator.notification.NotificationTemplates;
import com.logimetrics.coordinator.notification.Recipient;
import com.logimetrics.coordinator.notification.RecipientDirectory;
import com.logimetrics.coordinator.notification.channel.ChannelFailedException;
import com.logimetrics.coordinator.notification.channel.EmailChannelSink;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Queue drain, inbox retention and the daily digest mail. */
@Component
@RequiredArgsConstructor
public class NotificationJobs {

  static final int DIGEST_ITEM_LIMIT = 10;

  private static final Logger logger = LoggerFactory.getLogger(NotificationJobs.class);

  private final NotificationQueueRunner queueRunner;
  private final NotificationRepository notificationRepository;
  private final RecipientDirectory recipientDirectory;
  private final NotificationTemplates templates;
  private final EmailChannelSink emailSink;
  private final RetentionProperties retention;
  private final Clock clock;

  public record DigestSummary(int subscribers, int sent, int failed) {}

  public DrainSummary processNotificationQueue(CancellationToken token) {
    return queueRunner.drainOnce(token);
  }

  /** Only read notifications are removed; unread ones stay regardless of age. */
  public int cleanupOldNotifications(CancellationToken token) {
    final Instant cutoff = Instant.now(clock).minus(retention.notifications());
    final int deleted = notificationRepository.deleteReadBefore(cutoff);
    logger.info("read notifications deleted cutoff={} count={}", cutoff, deleted);
    return deleted;
  }

  public DigestSummary sendDigestNotifications(CancellationToken token) {
    final List<Recipient> subscribers = recipientDirectory.findDigestSubscribers();
    int sent = 0;
    int failed = 0;
    for (Recipient recipient : subscribers) {
      token.throwIfCancelled();
      final int unread = notificationRepository.countUnread(recipient.id());
      if (unread == 0) {
        continue;
      }
      final List<Notification> recent =
          notificationRepository.findRecentUnread(recipient.id(), DIGEST_ITEM_LIMIT);
      try {
        if (emailSink.sendRendered(recipient, templates.digest(recipient, unread, recent))) {
          sent++;
        }
      } catch (ChannelFailedException ex) {
        failed++;
        logger.warn("digest mail failed userId={}", recipient.id(), ex);
      }
    }
    logger.info(
        "digest notifications finished subscribers={} sent={} failed={}",
        subscribers.size(),
        sent,
        failed);
    return new DigestSummary(subscribers.size(), sent, failed);
  }
}
