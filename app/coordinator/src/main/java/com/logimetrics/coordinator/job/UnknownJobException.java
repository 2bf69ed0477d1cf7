package com.logimetrics.coordinator.job;

public class UnknownJobException extends RuntimeException {

  public UnknownJobException(String name) {
    super("job not found: " + name);
  }
}
