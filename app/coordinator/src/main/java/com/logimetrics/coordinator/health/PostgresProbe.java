package com.logimetrics.coordinator.health;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PostgresProbe implements StoreProbe {

  private final JdbcTemplate jdbcTemplate;

  @Override
  public String name() {
    return "postgres";
  }

  @Override
  public void probe() {
    jdbcTemplate.queryForObject("SELECT 1", Integer.class);
  }
}
