package com.logimetrics.coordinator.job;

public class DuplicateJobException extends RuntimeException {

  public DuplicateJobException(String name) {
    super("job already registered: " + name);
  }
}
