package com.logimetrics.coordinator.health;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RedisProbe implements StoreProbe {

  private final RedisConnectionFactory connectionFactory;

  @Override
  public String name() {
    return "redis";
  }

  @Override
  public void probe() {
    try (RedisConnection connection = connectionFactory.getConnection()) {
      connection.ping();
    }
  }
}
