package com.logimetrics.coordinator.dashboard;

import java.util.Map;
import java.util.UUID;

public record DashboardAlertRaised(
    UUID companyId, String severity, String title, String message, Map<String, Object> data) {

  public DashboardAlertRaised {
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
