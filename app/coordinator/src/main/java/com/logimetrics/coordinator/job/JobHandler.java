/*
 * Where: Job model
 * What: Unit of periodic work executed by the scheduler
 * Why: Handlers only see a cancellation token, so timeouts and shutdown reach every long call
 */
package com.logimetrics.coordinator.job;

@FunctionalInterface
public interface JobHandler {

  /**
   * Runs one cycle of the job. Throwing marks the run as failed; the scheduler keeps going.
   * Long-running loops must poll {@link CancellationToken#throwIfCancelled()}.
   */
  void run(CancellationToken token) throws Exception;
}
