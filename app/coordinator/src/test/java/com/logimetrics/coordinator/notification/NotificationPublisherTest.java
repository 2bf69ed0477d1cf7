package com.logimetrics.coordinator.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class NotificationPublisherTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);

  private final InMemoryNotificationQueue queue = new InMemoryNotificationQueue();
  private final ChannelDispatcher dispatcher = mock(ChannelDispatcher.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final NotificationPublisher publisher =
      new NotificationPublisher(queue, dispatcher, new NotificationMetrics(meterRegistry), CLOCK);

  @Test
  void enqueuesWhenQueueIsAvailable() {
    final Notification notification = notification();

    assertThat(publisher.publish(notification)).isEqualTo(PublishResult.QUEUED);
    assertThat(queue.contents())
        .singleElement()
        .satisfies(
            item -> {
              assertThat(item.notification()).isEqualTo(notification);
              assertThat(item.retryCount()).isZero();
            });
    verify(dispatcher, never()).dispatch(any());
  }

  @Test
  void dispatchesDirectlyWhenQueueIsDown() {
    queue.available(false);
    final Notification notification = notification();

    assertThat(publisher.publish(notification)).isEqualTo(PublishResult.DISPATCHED_DIRECTLY);
    verify(dispatcher).dispatch(notification);
    assertThat(
            meterRegistry.get("coordinator.queue.items").tag("result", "direct").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void reportsLostWhenDirectDispatchFailsToo() {
    queue.available(false);
    when(dispatcher.dispatch(any())).thenThrow(new IllegalStateException("all channels down"));

    final int accepted = publisher.publishAll(List.of(notification(), notification()));

    assertThat(accepted).isZero();
    assertThat(meterRegistry.get("coordinator.queue.items").tag("result", "lost").counter().count())
        .isEqualTo(2.0d);
  }

  private static Notification notification() {
    return Notification.builder(UUID.randomUUID(), NotificationType.PAYMENT_RECEIVED)
        .title("Payment received")
        .channels(NotificationChannel.IN_APP)
        .build(CLOCK);
  }
}
