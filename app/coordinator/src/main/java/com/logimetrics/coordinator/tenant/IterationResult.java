package com.logimetrics.coordinator.tenant;

import java.util.List;

/** Per-tenant outcomes of one iteration, in tenant order. */
public record IterationResult(List<TenantOutcome> outcomes) {

  public IterationResult {
    outcomes = List.copyOf(outcomes);
  }

  public long attempted() {
    return outcomes.stream().filter(TenantOutcome::attempted).count();
  }

  public long count(TenantOutcome.Status status) {
    return outcomes.stream().filter(outcome -> outcome.status() == status).count();
  }

  public boolean allSucceeded() {
    return count(TenantOutcome.Status.OK) == outcomes.size();
  }
}
