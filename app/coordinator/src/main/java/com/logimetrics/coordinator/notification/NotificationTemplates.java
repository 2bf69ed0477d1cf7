/*
 * Where: Notification pipeline
 * What: Renders email and SMS bodies per notification type
 * Why: Each provider needs its own format while producers only supply title, message and data
 */
package com.logimetrics.coordinator.notification;

import com.logimetrics.coordinator.config.ChannelProperties;
import java.util.List;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
public class NotificationTemplates {

  static final int SMS_MAX_LENGTH = 160;

  private final ChannelProperties channelProperties;

  public NotificationTemplates(ChannelProperties channelProperties) {
    this.channelProperties = channelProperties;
  }

  public record RenderedEmail(String subject, String htmlBody) {}

  public enum Category {
    SHIPMENT("#2563eb"),
    BILLING("#059669"),
    FLEET("#d97706"),
    ALERT("#dc2626"),
    SYSTEM("#4b5563");

    private final String color;

    Category(String color) {
      this.color = color;
    }

    public String color() {
      return color;
    }
  }

  public static Category categoryOf(NotificationType type) {
    return switch (type) {
      case SHIPMENT_CREATED,
          SHIPMENT_PICKED_UP,
          SHIPMENT_IN_TRANSIT,
          SHIPMENT_OUT_FOR_DELIVERY,
          SHIPMENT_DELIVERED,
          SHIPMENT_DELAYED,
          DRIVER_ASSIGNED -> Category.SHIPMENT;
      case PAYMENT_RECEIVED,
          PAYMENT_FAILED,
          PAYMENT_REMINDER,
          INVOICE_GENERATED,
          INVOICE_OVERDUE -> Category.BILLING;
      case VEHICLE_MAINTENANCE, LICENSE_EXPIRY, DOCUMENT_EXPIRY -> Category.FLEET;
      case ALERT -> Category.ALERT;
      case SYSTEM, DIGEST -> Category.SYSTEM;
    };
  }

  public RenderedEmail email(Notification notification, Recipient recipient) {
    final Category category = categoryOf(notification.type());
    final String title = titleOf(notification);
    final String subject =
        notification.priority() == NotificationPriority.URGENT
            ? "[Urgent] " + title
            : "[LogiMetrics] " + title;
    final String body =
        String.format(
            """
            <html>
            <body style="font-family: Arial, sans-serif;">
                <div style="background-color: %s; color: white; padding: 16px; border-radius: 4px;">
                    <h2 style="margin: 0;">%s</h2>
                </div>
                <div style="padding: 16px;">
                    <p>Hello %s,</p>
                    <p>%s</p>
                    %s
                </div>
                <div style="padding: 8px 16px; font-size: 12px; color: #6b7280;">
                    You received this because of your LogiMetrics notification settings.
                </div>
            </body>
            </html>
            """,
            category.color(),
            HtmlUtils.htmlEscape(title),
            HtmlUtils.htmlEscape(recipient.name() == null ? "there" : recipient.name()),
            HtmlUtils.htmlEscape(nullToEmpty(notification.message())),
            link());
    return new RenderedEmail(subject, body);
  }

  /** Digest mail listing the most recent unread notifications. */
  public RenderedEmail digest(Recipient recipient, int unreadCount, List<Notification> recent) {
    final StringBuilder items = new StringBuilder();
    for (Notification notification : recent) {
      items
          .append("<li><strong>")
          .append(HtmlUtils.htmlEscape(titleOf(notification)))
          .append("</strong> ")
          .append(HtmlUtils.htmlEscape(nullToEmpty(notification.message())))
          .append("</li>");
    }
    final String body =
        String.format(
            """
            <html>
            <body style="font-family: Arial, sans-serif;">
                <h2>Your daily summary</h2>
                <p>Hello %s, you have %d unread notifications.</p>
                <ul>%s</ul>
                %s
            </body>
            </html>
            """,
            HtmlUtils.htmlEscape(recipient.name() == null ? "there" : recipient.name()),
            unreadCount,
            items,
            link());
    return new RenderedEmail("[LogiMetrics] Daily summary: " + unreadCount + " unread", body);
  }

  public String sms(Notification notification) {
    final String prefix =
        notification.priority() == NotificationPriority.URGENT ? "URGENT: " : "LogiMetrics: ";
    final String message = notification.message();
    final String text =
        message == null || message.isBlank()
            ? prefix + titleOf(notification)
            : prefix + titleOf(notification) + " - " + message;
    return text.length() <= SMS_MAX_LENGTH ? text : text.substring(0, SMS_MAX_LENGTH - 3) + "...";
  }

  public String titleOf(Notification notification) {
    final String title = notification.title();
    if (title != null && !title.isBlank()) {
      return title;
    }
    return defaultTitle(notification.type());
  }

  static String defaultTitle(NotificationType type) {
    return switch (type) {
      case SHIPMENT_CREATED -> "Shipment created";
      case SHIPMENT_PICKED_UP -> "Shipment picked up";
      case SHIPMENT_IN_TRANSIT -> "Shipment in transit";
      case SHIPMENT_OUT_FOR_DELIVERY -> "Shipment out for delivery";
      case SHIPMENT_DELIVERED -> "Shipment delivered";
      case SHIPMENT_DELAYED -> "Shipment delayed";
      case PAYMENT_RECEIVED -> "Payment received";
      case PAYMENT_FAILED -> "Payment failed";
      case PAYMENT_REMINDER -> "Payment reminder";
      case INVOICE_GENERATED -> "Invoice generated";
      case INVOICE_OVERDUE -> "Invoice overdue";
      case DRIVER_ASSIGNED -> "Driver assigned";
      case VEHICLE_MAINTENANCE -> "Vehicle maintenance due";
      case LICENSE_EXPIRY -> "License expiry";
      case DOCUMENT_EXPIRY -> "Document expiry";
      case ALERT -> "Alert";
      case SYSTEM -> "System notice";
      case DIGEST -> "Daily summary";
    };
  }

  private String link() {
    final String appUrl = channelProperties.email().appUrl();
    if (appUrl.isBlank()) {
      return "";
    }
    final String escaped = HtmlUtils.htmlEscape(appUrl);
    return "<p><a href=\"" + escaped + "\">Open LogiMetrics</a></p>";
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
