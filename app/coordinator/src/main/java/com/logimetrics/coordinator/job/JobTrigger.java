package com.logimetrics.coordinator.job;

/** Origin of a run: the cron timer, an operator request, or a trigger parked by queue-one. */
public enum JobTrigger {
  SCHEDULED,
  MANUAL,
  QUEUED
}
