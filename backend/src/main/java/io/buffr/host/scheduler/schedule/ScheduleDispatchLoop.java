package io.buffr.host.scheduler.schedule;

import io.buffr.host.scheduler.config.SchedulerProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Polls for due schedules at a fixed rate and hands each one to the {@link ScheduleExecutor} on
 * the dispatch pool. A tick never waits for handlers to finish.
 *
 * <p>Each due schedule is claimed before it is dispatched, so a tick that overlaps a still running
 * attempt skips that schedule instead of starting it twice. A dispatch that waited in the pool
 * queue renews its claim before running and is dropped if the claim has passed to a later tick.
 */
@Component
public class ScheduleDispatchLoop implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(ScheduleDispatchLoop.class);

  private final ScheduleStore scheduleStore;
  private final ScheduleExecutor scheduleExecutor;
  private final TaskScheduler ticker;
  private final TaskExecutor dispatchExecutor;
  private final Clock clock;
  private final SchedulerProperties properties;

  private final Object lifecycleMonitor = new Object();
  private ScheduledFuture<?> tickHandle;

  public ScheduleDispatchLoop(
      ScheduleStore scheduleStore,
      ScheduleExecutor scheduleExecutor,
      @Qualifier("scheduleDispatchTicker") TaskScheduler ticker,
      @Qualifier("scheduleDispatchExecutor") TaskExecutor dispatchExecutor,
      Clock clock,
      SchedulerProperties properties) {
    this.scheduleStore = scheduleStore;
    this.scheduleExecutor = scheduleExecutor;
    this.ticker = ticker;
    this.dispatchExecutor = dispatchExecutor;
    this.clock = clock;
    this.properties = properties;
  }

  /** Starts ticking. Calling it while already running has no effect. */
  @Override
  public void start() {
    synchronized (lifecycleMonitor) {
      if (tickHandle != null) {
        return;
      }
      tickHandle = ticker.scheduleAtFixedRate(this::runTick, properties.pollInterval());
      log.info("Schedule dispatch loop started, polling every {}", properties.pollInterval());
    }
  }

  /** Stops ticking. Attempts already handed to the dispatch pool run to completion. */
  @Override
  public void stop() {
    synchronized (lifecycleMonitor) {
      if (tickHandle == null) {
        return;
      }
      tickHandle.cancel(false);
      tickHandle = null;
      log.info("Schedule dispatch loop stopped");
    }
  }

  @Override
  public boolean isRunning() {
    synchronized (lifecycleMonitor) {
      return tickHandle != null;
    }
  }

  @Override
  public boolean isAutoStartup() {
    return properties.autoStart();
  }

  /**
   * Runs one polling cycle on the calling thread.
   *
   * @return the number of schedules handed to the dispatch pool
   */
  public int tick() {
    Instant now = clock.instant();
    List<Schedule> due;
    try {
      due = scheduleStore.queryDueSchedules(now);
    } catch (RuntimeException e) {
      log.error("Could not query due schedules", e);
      return 0;
    }
    if (due.isEmpty()) {
      log.debug("No schedules due at {}", now);
      return 0;
    }

    var leaseUntil = leaseFrom(now);
    int dispatched = 0;
    for (var schedule : due) {
      try {
        if (!scheduleStore.claim(schedule.getId(), now, leaseUntil)) {
          log.debug("Schedule {} already claimed or no longer due, skipping", schedule.getId());
          continue;
        }
        if (dispatch(schedule.getId(), leaseUntil)) {
          dispatched++;
        }
      } catch (RuntimeException e) {
        log.error("Could not dispatch schedule {}", schedule.getId(), e);
      }
    }

    log.info("Dispatched {} of {} due schedules", dispatched, due.size());
    return dispatched;
  }

  private boolean dispatch(UUID scheduleId, Instant heldLease) {
    try {
      dispatchExecutor.execute(() -> executeIsolated(scheduleId, heldLease));
      return true;
    } catch (RejectedExecutionException e) {
      log.warn("Dispatch pool is full, schedule {} left for a later tick", scheduleId);
      scheduleStore.updateSchedule(
          scheduleId,
          current -> {
            current.releaseClaim();
            return current;
          });
      return false;
    }
  }

  // Runs on a dispatch worker, possibly long after the tick that claimed the schedule
  private void executeIsolated(UUID scheduleId, Instant heldLease) {
    try {
      Instant startedAt = clock.instant();
      var claimed =
          scheduleStore.updateSchedule(
              scheduleId,
              schedule ->
                  schedule.renewClaim(heldLease, startedAt, leaseFrom(startedAt))
                      ? schedule
                      : null);
      if (claimed.isEmpty()) {
        log.info("Schedule {} lost its dispatch claim while queued, skipping", scheduleId);
        return;
      }
      scheduleExecutor.execute(claimed.get());
    } catch (RuntimeException e) {
      log.error("Execution of schedule {} failed unexpectedly", scheduleId, e);
    }
  }

  // Millisecond leases survive the round trip through a timestamptz column unchanged
  private Instant leaseFrom(Instant now) {
    return now.plus(properties.claimLease()).truncatedTo(ChronoUnit.MILLIS);
  }

  // An exception escaping a fixed-rate task would cancel all later ticks
  private void runTick() {
    try {
      tick();
    } catch (RuntimeException e) {
      log.error("Schedule dispatch tick failed", e);
    }
  }
}
