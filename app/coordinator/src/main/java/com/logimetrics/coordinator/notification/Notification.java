/*
 * Where: Notification model
 * What: A message addressed to one user over a set of channels
 * Why: The same value travels through the Redis queue, the dispatcher and the in-app store
 */
package com.logimetrics.coordinator.notification;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

public record Notification(
    UUID id,
    UUID recipientId,
    UUID companyId,
    NotificationType type,
    String title,
    String message,
    Map<String, Object> data,
    Set<NotificationChannel> channels,
    NotificationPriority priority,
    Instant createdAt,
    Instant readAt) {

  public Notification {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(type, "type");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    channels =
        channels == null || channels.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.of(NotificationChannel.IN_APP))
            : Collections.unmodifiableSet(EnumSet.copyOf(channels));
    priority = priority == null ? NotificationPriority.NORMAL : priority;
  }

  public static Builder builder(UUID recipientId, NotificationType type) {
    return new Builder(recipientId, type);
  }

  public static final class Builder {

    private final UUID recipientId;
    private final NotificationType type;
    private UUID companyId;
    private String title;
    private String message;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private final Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);
    private NotificationPriority priority = NotificationPriority.NORMAL;

    private Builder(UUID recipientId, NotificationType type) {
      this.recipientId = recipientId;
      this.type = type;
    }

    public Builder companyId(UUID companyId) {
      this.companyId = companyId;
      return this;
    }

    public Builder title(String title) {
      this.title = title;
      return this;
    }

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder data(String key, Object value) {
      if (value != null) {
        this.data.put(key, value);
      }
      return this;
    }

    public Builder channels(NotificationChannel first, NotificationChannel... rest) {
      this.channels.add(first);
      Collections.addAll(this.channels, rest);
      return this;
    }

    public Builder channels(Set<NotificationChannel> channels) {
      this.channels.addAll(channels);
      return this;
    }

    public Builder priority(NotificationPriority priority) {
      this.priority = priority;
      return this;
    }

    public Notification build(Clock clock) {
      return new Notification(
          UUID.randomUUID(),
          recipientId,
          companyId,
          type,
          title,
          message,
          data,
          channels,
          priority,
          Instant.now(clock),
          null);
    }
  }
}
