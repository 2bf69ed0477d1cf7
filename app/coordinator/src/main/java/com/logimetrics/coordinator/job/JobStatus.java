package com.logimetrics.coordinator.job;

public enum JobStatus {
  RUNNING,
  IDLE,
  PAUSED
}
