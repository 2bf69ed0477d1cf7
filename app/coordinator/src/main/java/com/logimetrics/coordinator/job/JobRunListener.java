package com.logimetrics.coordinator.job;

@FunctionalInterface
public interface JobRunListener {

  void onRunFinished(JobRun run);
}
