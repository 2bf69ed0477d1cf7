package com.logimetrics.common;

import java.util.UUID;

public final class TraceIds {

  public static final String MDC_TRACE_ID = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
