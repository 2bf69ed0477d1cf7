/*
 * Where: Coordinator admin API
 * What: Lists jobs and exposes enable, disable, pause, resume and run-now
 * Why: Operators steer jobs at runtime without redeploying or touching cron tables
 */
package com.logimetrics.coordinator.api;

import com.logimetrics.coordinator.api.response.JobResponse;
import com.logimetrics.coordinator.api.response.JobRunResponse;
import com.logimetrics.coordinator.job.JobRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/jobs")
@RequiredArgsConstructor
public class JobAdminController {

  private final JobRegistry jobRegistry;

  @GetMapping
  public ResponseEntity<List<JobResponse>> list() {
    return ResponseEntity.ok(jobRegistry.list().stream().map(JobResponse::from).toList());
  }

  @GetMapping("/{name}")
  public ResponseEntity<JobResponse> get(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobResponse.from(jobRegistry.get(name)));
  }

  @PostMapping("/{name}/enable")
  public ResponseEntity<JobResponse> enable(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobResponse.from(jobRegistry.enable(name)));
  }

  @PostMapping("/{name}/disable")
  public ResponseEntity<JobResponse> disable(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobResponse.from(jobRegistry.disable(name)));
  }

  @PostMapping("/{name}/pause")
  public ResponseEntity<JobResponse> pause(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobResponse.from(jobRegistry.pause(name)));
  }

  @PostMapping("/{name}/resume")
  public ResponseEntity<JobResponse> resume(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobResponse.from(jobRegistry.resume(name)));
  }

  /** Blocks until the run finishes; a busy job answers with a skipped run. */
  @PostMapping("/{name}/run")
  public ResponseEntity<JobRunResponse> run(@PathVariable("name") String name) {
    return ResponseEntity.ok(JobRunResponse.from(jobRegistry.runNow(name)));
  }
}
