package com.logimetrics.coordinator.health;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MongoProbe implements StoreProbe {

  private final MongoTemplate mongoTemplate;

  @Override
  public String name() {
    return "mongodb";
  }

  @Override
  public void probe() {
    mongoTemplate.executeCommand(new Document("ping", 1));
  }
}
