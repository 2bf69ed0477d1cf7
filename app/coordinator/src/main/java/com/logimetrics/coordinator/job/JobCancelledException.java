package com.logimetrics.coordinator.job;

import java.util.Locale;

public class JobCancelledException extends RuntimeException {

  private final CancellationToken.Reason reason;

  public JobCancelledException(CancellationToken.Reason reason) {
    super("run cancelled: " + reason.name().toLowerCase(Locale.ROOT));
    this.reason = reason;
  }

  public CancellationToken.Reason reason() {
    return reason;
  }
}
