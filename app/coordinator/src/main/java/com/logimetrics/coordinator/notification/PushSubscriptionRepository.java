/*
 * Where: Notification data access
 * What: Per-user push subscriptions kept as a JSON array in Redis
 * Why: The push channel fans out to every registered endpoint and prunes ones the provider reports gone
 */
package com.logimetrics.coordinator.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "StringRedisTemplate and ObjectMapper are shared Spring-managed components")
public class PushSubscriptionRepository {

  private static final Logger logger = LoggerFactory.getLogger(PushSubscriptionRepository.class);
  private static final String KEY_PREFIX = "push:subscriptions:";
  private static final TypeReference<List<PushSubscription>> LIST_TYPE = new TypeReference<>() {};

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;

  public PushSubscriptionRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  public static String key(UUID userId) {
    return KEY_PREFIX + userId;
  }

  public List<PushSubscription> find(UUID userId) {
    final String raw = redisTemplate.opsForValue().get(key(userId));
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(raw, LIST_TYPE);
    } catch (JsonProcessingException ex) {
      logger.warn("push subscriptions unreadable, ignoring userId={}", userId, ex);
      return List.of();
    }
  }

  /** Adds the subscription unless its endpoint is already registered. Returns true when added. */
  public boolean subscribe(UUID userId, PushSubscription subscription) {
    final List<PushSubscription> current = new ArrayList<>(find(userId));
    for (PushSubscription existing : current) {
      if (existing.endpoint().equals(subscription.endpoint())) {
        return false;
      }
    }
    current.add(subscription);
    write(userId, current);
    return true;
  }

  public boolean unsubscribe(UUID userId, String endpoint) {
    final List<PushSubscription> current = new ArrayList<>(find(userId));
    final boolean removed = current.removeIf(existing -> existing.endpoint().equals(endpoint));
    if (removed) {
      write(userId, current);
    }
    return removed;
  }

  private void write(UUID userId, List<PushSubscription> subscriptions) {
    if (subscriptions.isEmpty()) {
      redisTemplate.delete(key(userId));
      return;
    }
    try {
      redisTemplate.opsForValue().set(key(userId), objectMapper.writeValueAsString(subscriptions));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("push subscriptions are not serializable", ex);
    }
  }
}
