package io.buffr.host.scheduler.schedule;

import io.buffr.host.scheduler.action.ActionExecutionException;
import io.buffr.host.scheduler.action.ActionRegistry;
import io.buffr.host.scheduler.config.SchedulerProperties;
import io.buffr.host.scheduler.schedule.event.ScheduleCompletedEvent;
import io.buffr.host.scheduler.schedule.event.ScheduleExecutionFailedEvent;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Runs one dispatch attempt of a claimed schedule: records the execution, invokes the action
 * handler with a timeout, settles the execution and moves the schedule on.
 *
 * <p>Each step is isolated. A storage failure in one step is logged and the remaining steps still
 * run, so nothing thrown here reaches the dispatch loop.
 */
@Component
public class ScheduleExecutor {

  private static final Logger log = LoggerFactory.getLogger(ScheduleExecutor.class);

  /** Caps the backoff doubling so the multiplier cannot overflow. */
  private static final int MAX_BACKOFF_DOUBLINGS = 20;

  /** Longest delay before a retry, whatever the policy's base backoff. */
  static final Duration MAX_BACKOFF = Duration.ofDays(30);

  private final ScheduleStore scheduleStore;
  private final ActionRegistry actionRegistry;
  private final RecurrenceCalculator recurrenceCalculator;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final SchedulerProperties properties;

  public ScheduleExecutor(
      ScheduleStore scheduleStore,
      ActionRegistry actionRegistry,
      RecurrenceCalculator recurrenceCalculator,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      SchedulerProperties properties) {
    this.scheduleStore = scheduleStore;
    this.actionRegistry = actionRegistry;
    this.recurrenceCalculator = recurrenceCalculator;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.properties = properties;
  }

  /**
   * @param schedule the schedule as it was when claimed; only read, never written
   * @return the settled execution, or null if the attempt could not be recorded at all
   */
  public ScheduleExecution execute(Schedule schedule) {
    UUID scheduleId = schedule.getId();
    String actionType = schedule.getActionType();
    Map<String, Object> actionConfig = schedule.getActionConfig();
    Instant startedAt = clock.instant();
    Instant scheduledAt = schedule.getNextRun() != null ? schedule.getNextRun() : startedAt;

    ScheduleExecution execution;
    try {
      execution =
          scheduleStore.insertExecution(
              ScheduleExecution.running(scheduleId, scheduledAt, startedAt));
    } catch (RuntimeException e) {
      log.error("Could not record execution for schedule {}, releasing claim", scheduleId, e);
      releaseClaim(scheduleId);
      return null;
    }

    log.debug(
        "Executing schedule {} (action {}), execution {}",
        scheduleId,
        actionType,
        execution.getId());

    try {
      var result = invokeHandler(actionType, actionConfig);
      Instant finishedAt = clock.instant();
      execution = settle(execution, e -> e.complete(result, finishedAt));
      onSuccess(scheduleId, finishedAt);
      log.info(
          "Schedule {} executed in {} ms",
          scheduleId,
          Duration.between(startedAt, finishedAt).toMillis());
    } catch (ActionExecutionException e) {
      Instant finishedAt = clock.instant();
      String message = e.getMessage();
      if (e.isTimedOut()) {
        log.warn("Schedule {} timed out: {}", scheduleId, message);
        execution = settle(execution, ex -> ex.timeOut(message, finishedAt));
      } else {
        log.warn("Schedule {} failed: {}", scheduleId, message, e.getCause());
        execution = settle(execution, ex -> ex.fail(message, finishedAt));
      }
      onFailure(scheduleId, execution, actionType, message, finishedAt);
    }
    return execution;
  }

  private Map<String, Object> invokeHandler(String actionType, Map<String, Object> actionConfig) {
    var handler =
        actionRegistry
            .resolve(actionType)
            .orElseThrow(() -> ActionExecutionException.noHandler(actionType));

    CompletableFuture<Map<String, Object>> future;
    try {
      future = handler.handle(actionConfig);
    } catch (RuntimeException e) {
      throw new ActionExecutionException(messageOf(e), e);
    }
    if (future == null) {
      throw new ActionExecutionException("Handler for " + actionType + " returned no result");
    }

    var timeout = properties.handlerTimeout();
    try {
      var result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return result != null ? result : Map.of();
    } catch (TimeoutException e) {
      future.cancel(true);
      throw ActionExecutionException.timedOut(actionType, timeout);
    } catch (ExecutionException e) {
      var cause = e.getCause() != null ? e.getCause() : e;
      throw new ActionExecutionException(messageOf(cause), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ActionExecutionException("Interrupted while waiting for " + actionType, e);
    }
  }

  private ScheduleExecution settle(
      ScheduleExecution execution, Consumer<ScheduleExecution> outcome) {
    try {
      return scheduleStore.updateExecution(execution.getId(), outcome).orElse(execution);
    } catch (RuntimeException e) {
      log.error("Could not settle execution {}", execution.getId(), e);
      return execution;
    }
  }

  private void onSuccess(UUID scheduleId, Instant at) {
    try {
      var update =
          scheduleStore.updateSchedule(
              scheduleId,
              schedule -> {
                schedule.recordAttempt(at);
                if (schedule.getStatus().isTerminal()) {
                  return null;
                }
                var nextRun = recurrenceCalculator.computeNextRun(schedule, at);
                if (nextRun != null && !isRunCapReached(schedule)) {
                  schedule.advanceTo(nextRun, at);
                  return null;
                }
                schedule.transitionTo(ScheduleStatus.COMPLETED, at);
                return new ScheduleCompletedEvent(
                    scheduleId, schedule.getName(), schedule.getRunCount(), at);
              });
      update.ifPresent(this::publishCompleted);
    } catch (RuntimeException e) {
      log.error("Could not advance schedule {} after a successful run", scheduleId, e);
    }
  }

  /**
   * Without a retry policy the next run is left as it is, so the schedule stays due and the next
   * tick retries it. With one, retries back off exponentially until {@code maxRetries} is
   * exceeded, then the schedule skips to its next occurrence.
   */
  private void onFailure(
      UUID scheduleId,
      ScheduleExecution execution,
      String actionType,
      String message,
      Instant at) {
    try {
      var update =
          scheduleStore.updateSchedule(
              scheduleId,
              schedule -> {
                schedule.recordAttempt(at);
                if (schedule.getStatus().isTerminal()) {
                  return new FailureOutcome(schedule.getConsecutiveFailures(), null);
                }
                int consecutive = schedule.getConsecutiveFailures() + 1;
                var retryPolicy =
                    schedule.getConfig() != null ? schedule.getConfig().retryPolicy() : null;
                if (retryPolicy == null) {
                  schedule.recordFailure(null, at);
                } else if (consecutive <= retryPolicy.maxRetries()) {
                  schedule.recordFailure(at.plus(backoff(retryPolicy, consecutive)), at);
                } else {
                  return new FailureOutcome(consecutive, skipToNextOccurrence(schedule, at));
                }
                return new FailureOutcome(consecutive, null);
              });

      if (update.isEmpty()) {
        log.warn("Schedule {} disappeared while execution {} ran", scheduleId, execution.getId());
        return;
      }
      var outcome = update.get();
      eventPublisher.publishEvent(
          new ScheduleExecutionFailedEvent(
              scheduleId,
              execution.getId(),
              actionType,
              execution.getStatus(),
              message,
              outcome.consecutiveFailures(),
              at));
      if (outcome.completed() != null) {
        publishCompleted(outcome.completed());
      }
    } catch (RuntimeException e) {
      log.error("Could not record failure of schedule {}", scheduleId, e);
    }
  }

  /** Returns the completion event to publish once the row lock is released, or null. */
  private ScheduleCompletedEvent skipToNextOccurrence(Schedule schedule, Instant at) {
    var nextRun = recurrenceCalculator.computeNextRun(schedule, at);
    if (nextRun != null && !isRunCapReached(schedule)) {
      log.warn(
          "Schedule {} exhausted its retries, skipping to next occurrence {}",
          schedule.getId(),
          nextRun);
      schedule.advanceTo(nextRun, at);
      return null;
    }
    log.warn("Schedule {} exhausted its retries with no further occurrence", schedule.getId());
    schedule.transitionTo(ScheduleStatus.COMPLETED, at);
    return new ScheduleCompletedEvent(
        schedule.getId(), schedule.getName(), schedule.getRunCount(), at);
  }

  // run_count has already been incremented for the attempt that just finished
  private static boolean isRunCapReached(Schedule schedule) {
    var cap = schedule.effectiveMaxRuns();
    return cap != null && schedule.getRunCount() >= cap;
  }

  /** {@code backoffSeconds * 2^(consecutiveFailures - 1)}, saturating at {@link #MAX_BACKOFF}. */
  static Duration backoff(ScheduleConfig.RetryPolicy retryPolicy, int consecutiveFailures) {
    int doublings = Math.min(Math.max(consecutiveFailures - 1, 0), MAX_BACKOFF_DOUBLINGS);
    long seconds = Math.max(retryPolicy.backoffSeconds(), 0L);
    if (seconds > MAX_BACKOFF.getSeconds() >> doublings) {
      return MAX_BACKOFF;
    }
    return Duration.ofSeconds(seconds << doublings);
  }

  private record FailureOutcome(int consecutiveFailures, ScheduleCompletedEvent completed) {}

  private void publishCompleted(ScheduleCompletedEvent event) {
    log.info("Schedule {} completed after {} runs", event.scheduleId(), event.runCount());
    eventPublisher.publishEvent(event);
  }

  private void releaseClaim(UUID scheduleId) {
    try {
      scheduleStore.updateSchedule(
          scheduleId,
          schedule -> {
            schedule.releaseClaim();
            return schedule;
          });
    } catch (RuntimeException e) {
      log.error("Could not release claim on schedule {}", scheduleId, e);
    }
  }

  private static String messageOf(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
