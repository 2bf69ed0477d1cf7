/*
 * Where: Notification channels
 * What: Sends templated HTML mail through Spring's JavaMailSender
 * Why: Mail is optional per deployment; without a configured sender the channel reports skipped
 */
package com.logimetrics.coordinator.notification.channel;

import com.logimetrics.coordinator.config.ChannelProperties;
import com.logimetrics.coordinator.notification.ChannelOutcome;
import com.logimetrics.coordinator.notification.Notification;
import com.logimetrics.coordinator.notification.NotificationChannel;
import com.logimetrics.coordinator.notification.NotificationTemplates;
import com.logimetrics.coordinator.notification.Recipient;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
public class EmailChannelSink implements NotificationChannelSink {

  private static final Logger logger = LoggerFactory.getLogger(EmailChannelSink.class);

  private final ObjectProvider<JavaMailSender> mailSender;
  private final NotificationTemplates templates;
  private final ChannelProperties channelProperties;

  public EmailChannelSink(
      ObjectProvider<JavaMailSender> mailSender,
      NotificationTemplates templates,
      ChannelProperties channelProperties) {
    this.mailSender = mailSender;
    this.templates = templates;
    this.channelProperties = channelProperties;
  }

  @Override
  public NotificationChannel channel() {
    return NotificationChannel.EMAIL;
  }

  @Override
  public ChannelOutcome deliver(Notification notification, Optional<Recipient> recipient) {
    final JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null) {
      return ChannelOutcome.SKIPPED;
    }
    if (recipient.isEmpty() || !recipient.get().hasEmail()) {
      return ChannelOutcome.SKIPPED;
    }
    final NotificationTemplates.RenderedEmail rendered =
        templates.email(notification, recipient.get());
    send(sender, recipient.get().email(), rendered);
    logger.debug(
        "email sent id={} type={} recipientId={}",
        notification.id(),
        notification.type().value(),
        notification.recipientId());
    return ChannelOutcome.OK;
  }

  /** Sends a rendered mail outside the dispatcher, e.g. for the daily digest. */
  public boolean sendRendered(Recipient recipient, NotificationTemplates.RenderedEmail rendered) {
    final JavaMailSender sender = mailSender.getIfAvailable();
    if (sender == null || !recipient.hasEmail()) {
      return false;
    }
    send(sender, recipient.email(), rendered);
    return true;
  }

  private void send(
      JavaMailSender sender, String to, NotificationTemplates.RenderedEmail rendered) {
    try {
      final MimeMessage message = sender.createMimeMessage();
      final MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
      helper.setFrom(channelProperties.email().from());
      helper.setTo(to);
      helper.setSubject(rendered.subject());
      helper.setText(rendered.htmlBody(), true);
      sender.send(message);
    } catch (MessagingException | MailException ex) {
      throw new ChannelFailedException(channel(), "mail submission failed", ex);
    }
  }
}
