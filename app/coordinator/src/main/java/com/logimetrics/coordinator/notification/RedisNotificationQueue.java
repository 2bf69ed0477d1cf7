/*
 * Where: Notification pipeline
 * What: Redis list backed notification queue (RPUSH to enqueue, repeated LPOP to drain)
 * Why: Producers on any thread enqueue atomically and a single scheduled runner drains in order
 */
package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.logimetrics.coordinator.config.NotificationQueueProperties;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate and ObjectMapper are shared Spring-managed components")
public class RedisNotificationQueue implements NotificationQueue {

  private static final Logger logger = LoggerFactory.getLogger(RedisNotificationQueue.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String key;

  public RedisNotificationQueue(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      NotificationQueueProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.key = properties.key();
  }

  @Override
  public void enqueue(QueueItem item) {
    final String payload = serialize(item);
    try {
      redisTemplate.opsForList().rightPush(key, payload);
    } catch (DataAccessException ex) {
      throw new QueueUnavailableException("notification queue enqueue failed key=" + key, ex);
    }
  }

  @Override
  public DrainBatch drain(int max) {
    final List<QueueItem> items = new ArrayList<>();
    int malformed = 0;
    for (int i = 0; i < max; i++) {
      final String raw;
      try {
        raw = redisTemplate.opsForList().leftPop(key);
      } catch (DataAccessException ex) {
        if (items.isEmpty() && malformed == 0) {
          throw new QueueUnavailableException("notification queue drain failed key=" + key, ex);
        }
        // keep what was already popped; the rest stays queued for the next tick
        logger.warn("notification queue drain interrupted key={} popped={}", key, items.size(), ex);
        break;
      }
      if (raw == null) {
        break;
      }
      try {
        items.add(objectMapper.readValue(raw, QueueItem.class));
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        malformed++;
        logger.warn(
            "notification queue item dropped: parse error key={} length={}", key, raw.length(), ex);
      }
    }
    return new DrainBatch(items, malformed);
  }

  @Override
  public void returnUnprocessed(List<QueueItem> items) {
    if (items.isEmpty()) {
      return;
    }
    final List<String> payloads = new ArrayList<>(items.size());
    for (int i = items.size() - 1; i >= 0; i--) {
      payloads.add(serialize(items.get(i)));
    }
    try {
      // LPUSH inserts one by one, so pushing in reverse restores the original head order
      redisTemplate.opsForList().leftPushAll(key, payloads);
    } catch (DataAccessException ex) {
      throw new QueueUnavailableException("notification queue requeue failed key=" + key, ex);
    }
  }

  @Override
  public long depth() {
    try {
      final Long size = redisTemplate.opsForList().size(key);
      return size == null ? 0 : size;
    } catch (DataAccessException ex) {
      throw new QueueUnavailableException("notification queue size failed key=" + key, ex);
    }
  }

  private String serialize(QueueItem item) {
    try {
      return objectMapper.writeValueAsString(item);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("queue item is not serializable", ex);
    }
  }
}
