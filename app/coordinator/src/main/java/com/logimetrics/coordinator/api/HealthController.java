package com.logimetrics.coordinator.api;

import com.logimetrics.coordinator.api.response.HealthResponse;
import com.logimetrics.coordinator.health.HealthMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class HealthController {

  private final HealthMonitor healthMonitor;

  /** Latest snapshot from the healthCheck job; 204 until the first check has run. */
  @GetMapping("/admin/health")
  public ResponseEntity<HealthResponse> latest() {
    return healthMonitor
        .latest()
        .map(snapshot -> ResponseEntity.ok(HealthResponse.from(snapshot)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
