package com.logimetrics.coordinator.health;

/** Liveness check of one backing store or external service. Implementations may throw. */
public interface StoreProbe {

  String name();

  void probe() throws Exception;
}
