package com.logimetrics.coordinator.domain;

import org.springframework.dao.DataAccessException;

/** A backing store could not be reached. Jobs record the failure and wait for the next tick. */
public class StoreUnavailableException extends RuntimeException {

  public static final String POSTGRES = "postgres";
  public static final String MONGODB = "mongodb";
  public static final String REDIS = "redis";

  private final String store;

  public StoreUnavailableException(String store, String message, Throwable cause) {
    super(store + ": " + message, cause);
    this.store = store;
  }

  /** Names the store from the driver classes in the cause chain. */
  public static StoreUnavailableException from(DataAccessException ex) {
    final String store = storeOf(ex);
    final String message = ex.getMostSpecificCause().getMessage();
    return new StoreUnavailableException(
        store, message == null ? ex.getClass().getSimpleName() : message, ex);
  }

  static String storeOf(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      final String type = current.getClass().getName();
      if (type.startsWith("com.mongodb.") || type.startsWith("org.springframework.data.mongodb.")) {
        return MONGODB;
      }
      if (type.startsWith("io.lettuce.") || type.startsWith("org.springframework.data.redis.")) {
        return REDIS;
      }
      current = current.getCause();
    }
    return POSTGRES;
  }

  public String store() {
    return store;
  }
}
