/*
 * Where: Job model
 * What: Decides what happens when a trigger arrives while the same job is still running
 * Why: Some jobs must never overlap while others may safely queue or run side by side
 */
package com.logimetrics.coordinator.job;

public enum ConcurrencyPolicy {
  SKIP_IF_RUNNING("skip-if-running"),
  QUEUE_ONE("queue-one"),
  ALLOW_CONCURRENT("allow-concurrent");

  private final String value;

  ConcurrencyPolicy(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
