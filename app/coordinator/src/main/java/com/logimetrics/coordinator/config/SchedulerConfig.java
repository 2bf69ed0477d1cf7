/*
 * Where: Coordinator configuration
 * What: Wires the job registry, runner, scheduler timer and the worker and tenant pools
 * Why: Pool sizes and the timezone come from configuration; the job model stays framework-free
 */
package com.logimetrics.coordinator.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.logimetrics.coordinator.job.JobMetrics;
import com.logimetrics.coordinator.job.JobRegistry;
import com.logimetrics.coordinator.job.JobRunListener;
import com.logimetrics.coordinator.job.JobRunner;
import com.logimetrics.coordinator.job.JobScheduler;
import com.logimetrics.coordinator.job.SingleFlightGate;
import com.logimetrics.coordinator.tenant.IterationOptions;
import com.logimetrics.coordinator.tenant.TenantIterator;
import com.logimetrics.coordinator.tenant.TenantRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService jobWorkerPool(SchedulerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.workerPoolSize(),
        new ThreadFactoryBuilder().setNameFormat("job-worker-%d").setDaemon(true).build());
  }

  @Bean(destroyMethod = "shutdownNow")
  ExecutorService tenantPool(SchedulerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.tenantPoolSize(),
        new ThreadFactoryBuilder().setNameFormat("tenant-worker-%d").setDaemon(true).build());
  }

  // single thread: the scheduler timer must never fire two ticks at once
  @Bean
  ThreadPoolTaskScheduler jobTimer() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("job-timer-");
    scheduler.setDaemon(true);
    return scheduler;
  }

  @Bean
  ThreadPoolTaskScheduler jobTimeoutScheduler() {
    final ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("job-timeout-");
    scheduler.setDaemon(true);
    return scheduler;
  }

  @Bean
  SingleFlightGate singleFlightGate() {
    return new SingleFlightGate();
  }

  @Bean
  JobMetrics jobMetrics(MeterRegistry meterRegistry, SingleFlightGate gate) {
    return new JobMetrics(meterRegistry, gate);
  }

  @Bean
  JobRunner jobRunner(
      SingleFlightGate gate,
      @Qualifier("jobWorkerPool") ExecutorService workers,
      @Qualifier("jobTimeoutScheduler") ThreadPoolTaskScheduler timeoutScheduler,
      Clock clock,
      List<JobRunListener> listeners) {
    return new JobRunner(gate, workers, timeoutScheduler, clock, listeners);
  }

  @Bean
  JobRegistry jobRegistry(JobRunner runner, SingleFlightGate gate) {
    return new JobRegistry(runner, gate);
  }

  @Bean
  JobScheduler jobScheduler(
      JobRegistry registry,
      JobRunner runner,
      @Qualifier("jobTimer") ThreadPoolTaskScheduler timer,
      Clock clock,
      SchedulerProperties properties) {
    return new JobScheduler(
        registry, runner, timer, clock, properties.shutdownGrace(), properties.enabled());
  }

  @Bean
  TenantIterator tenantIterator(
      TenantRepository tenantRepository,
      @Qualifier("tenantPool") ExecutorService tenantPool,
      Clock clock) {
    return new TenantIterator(tenantRepository, tenantPool, clock);
  }

  @Bean
  IterationOptions iterationOptions(SchedulerProperties properties) {
    return IterationOptions.builder()
        .jobTimeout(properties.defaultTimeout())
        .minTenantTimeout(properties.minTenantTimeout())
        .build();
  }
}
