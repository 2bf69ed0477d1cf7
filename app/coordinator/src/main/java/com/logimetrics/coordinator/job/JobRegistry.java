/*
 * Where: Job registry
 * What: Holds registered jobs by slot index and exposes operator controls
 * Why: Operators need to list, gate and trigger jobs while the scheduler keeps driving cadences
 */
package com.logimetrics.coordinator.job;

import com.logimetrics.coordinator.cron.CronSchedule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

  private final List<JobSlot> slots = new CopyOnWriteArrayList<>();
  private final Map<String, Integer> slotIndexByName = new ConcurrentHashMap<>();
  private final JobRunner runner;
  private final SingleFlightGate gate;

  public JobRegistry(JobRunner runner, SingleFlightGate gate) {
    this.runner = runner;
    this.gate = gate;
  }

  /**
   * Registers a job. The cron expression is parsed and the enable predicate evaluated here.
   *
   * @throws DuplicateJobException if the name is taken
   * @throws com.logimetrics.coordinator.cron.InvalidScheduleException if the schedule is invalid
   */
  public synchronized JobSnapshot register(JobDescriptor descriptor) {
    if (slotIndexByName.containsKey(descriptor.name())) {
      throw new DuplicateJobException(descriptor.name());
    }
    final CronSchedule schedule = CronSchedule.parse(descriptor.cron(), descriptor.zone());
    final boolean enabled = descriptor.enabledWhen().getAsBoolean();
    final JobSlot slot = new JobSlot(slots.size(), descriptor, schedule, enabled);
    slots.add(slot);
    slotIndexByName.put(descriptor.name(), slot.index());
    logger.info(
        "job registered name={} cron={} zone={} policy={} enabled={}",
        descriptor.name(),
        schedule.expression(),
        schedule.zone(),
        descriptor.concurrencyPolicy().value(),
        enabled);
    return snapshot(slot);
  }

  public List<JobSnapshot> list() {
    final List<JobSnapshot> snapshots = new ArrayList<>(slots.size());
    for (JobSlot slot : slots) {
      snapshots.add(snapshot(slot));
    }
    return snapshots;
  }

  public JobSnapshot get(String name) {
    return snapshot(slot(name));
  }

  public JobSnapshot enable(String name) {
    final JobSlot slot = slot(name);
    if (!slot.enabled()) {
      slot.enabled(true);
      slot.nextFireAt(null);
      logger.info("job enabled name={}", name);
    }
    return snapshot(slot);
  }

  public JobSnapshot disable(String name) {
    final JobSlot slot = slot(name);
    if (slot.enabled()) {
      slot.enabled(false);
      logger.info("job disabled name={}", name);
    }
    return snapshot(slot);
  }

  public JobSnapshot pause(String name) {
    final JobSlot slot = slot(name);
    if (!slot.paused()) {
      slot.paused(true);
      logger.info("job paused name={}", name);
    }
    return snapshot(slot);
  }

  public JobSnapshot resume(String name) {
    final JobSlot slot = slot(name);
    if (slot.paused()) {
      slot.paused(false);
      slot.nextFireAt(null);
      logger.info("job resumed name={}", name);
    }
    return snapshot(slot);
  }

  /**
   * Runs the job now on the calling thread's behalf and waits for its outcome. Goes through the
   * same gate as scheduled runs and ignores pause; a busy job yields a skipped run.
   */
  public JobRun runNow(String name) {
    final JobSlot slot = slot(name);
    logger.info("job run requested manually name={}", name);
    return runner.launch(slot, JobTrigger.MANUAL).join();
  }

  List<JobSlot> slots() {
    return slots;
  }

  JobSlot slotAt(int index) {
    return slots.get(index);
  }

  private JobSlot slot(String name) {
    final Integer index = name == null ? null : slotIndexByName.get(name);
    if (index == null) {
      throw new UnknownJobException(name);
    }
    return slots.get(index);
  }

  private JobSnapshot snapshot(JobSlot slot) {
    final JobStatus status;
    if (gate.isRunning(slot.name())) {
      status = JobStatus.RUNNING;
    } else if (slot.paused()) {
      status = JobStatus.PAUSED;
    } else {
      status = JobStatus.IDLE;
    }
    final JobDescriptor descriptor = slot.descriptor();
    return new JobSnapshot(
        slot.name(),
        slot.schedule().expression(),
        slot.schedule().zone().getId(),
        descriptor.timeout(),
        descriptor.concurrencyPolicy(),
        slot.enabled(),
        status,
        slot.nextFireAt(),
        slot.lastRun());
  }
}
