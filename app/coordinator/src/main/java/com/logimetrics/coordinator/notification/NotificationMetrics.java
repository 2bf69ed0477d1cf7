/*
 * Where: Notification pipeline
 * What: Counts queue item fates and per-channel delivery outcomes
 * Why: Retry storms and a silently disabled channel show up on dashboards before users complain
 */
package com.logimetrics.coordinator.notification;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  public static final String RESULT_DELIVERED = "delivered";
  public static final String RESULT_RETRIED = "retried";
  public static final String RESULT_DROPPED = "dropped";
  public static final String RESULT_MALFORMED = "malformed";
  public static final String RESULT_DIRECT = "direct";
  public static final String RESULT_LOST = "lost";

  private static final String METRIC_QUEUE_ITEMS = "coordinator.queue.items";
  private static final String METRIC_QUEUE_DEPTH = "coordinator.queue.depth";
  private static final String METRIC_CHANNEL_OUTCOMES = "coordinator.channel.outcomes";

  private final MeterRegistry meterRegistry;
  private final AtomicLong queueDepth = new AtomicLong(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_QUEUE_DEPTH, queueDepth, AtomicLong::get)
        .description("Pending notification queue length observed at the last drain")
        .register(meterRegistry);
  }

  public void recordQueueItems(String result, int count) {
    if (count <= 0) {
      return;
    }
    counters
        .computeIfAbsent(
            "queue|" + result,
            ignored ->
                Counter.builder(METRIC_QUEUE_ITEMS)
                    .description("Notification queue item fates")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordChannelOutcome(NotificationChannel channel, ChannelOutcome outcome) {
    counters
        .computeIfAbsent(
            "channel|" + channel.value() + "|" + outcome.value(),
            ignored ->
                Counter.builder(METRIC_CHANNEL_OUTCOMES)
                    .description("Per-channel notification delivery outcomes")
                    .tags(Tags.of("channel", channel.value(), "outcome", outcome.value()))
                    .register(meterRegistry))
        .increment();
  }

  public void updateQueueDepth(long depth) {
    queueDepth.set(Math.max(depth, 0));
  }
}
