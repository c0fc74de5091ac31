package io.buffr.host.scheduler.schedule;

import io.buffr.host.scheduler.action.ActionRegistry;
import io.buffr.host.scheduler.config.SchedulerProperties;
import io.buffr.host.scheduler.exception.InvalidStateException;
import io.buffr.host.scheduler.exception.ResourceNotFoundException;
import io.buffr.host.scheduler.exception.ScheduleValidationException;
import io.buffr.host.scheduler.schedule.dto.CreateScheduleRequest;
import io.buffr.host.scheduler.schedule.dto.ScheduleExecutionResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleResponse;
import io.buffr.host.scheduler.schedule.dto.ScheduleStatistics;
import io.buffr.host.scheduler.schedule.dto.UpdateScheduleRequest;
import io.buffr.host.scheduler.schedule.event.ScheduleCompletedEvent;
import io.buffr.host.scheduler.schedule.event.SchedulePausedEvent;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Caller-facing schedule API: creation, partial updates and the pause/resume/cancel lifecycle,
 * plus read-side queries. Every write goes through {@link ScheduleStore#updateSchedule} so it is
 * applied under the schedule's row lock.
 */
@Service
public class ScheduleService {

  private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

  static final String DEFAULT_CREATED_BY = "system";

  /** Largest recurrence interval; keeps calendar arithmetic within representable dates. */
  static final int MAX_INTERVAL = 1000;

  /** One week. Longer base backoffs are rejected rather than silently capped. */
  static final long MAX_BACKOFF_SECONDS = 604_800L;

  private final ScheduleStore scheduleStore;
  private final RecurrenceCalculator recurrenceCalculator;
  private final ActionRegistry actionRegistry;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;
  private final SchedulerProperties properties;

  public ScheduleService(
      ScheduleStore scheduleStore,
      RecurrenceCalculator recurrenceCalculator,
      ActionRegistry actionRegistry,
      ApplicationEventPublisher eventPublisher,
      Clock clock,
      SchedulerProperties properties) {
    this.scheduleStore = scheduleStore;
    this.recurrenceCalculator = recurrenceCalculator;
    this.actionRegistry = actionRegistry;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
    this.properties = properties;
  }

  public ScheduleResponse create(CreateScheduleRequest request, String createdBy) {
    var errors = new ArrayList<String>();
    if (request.name() == null || request.name().isBlank()) {
      errors.add("name is required");
    }
    if (request.type() == null) {
      errors.add("type is required");
    }
    if (request.actionType() == null || request.actionType().isBlank()) {
      errors.add("actionType is required");
    }
    if (request.maxRuns() != null && request.maxRuns() < 1) {
      errors.add("maxRuns must be at least 1");
    }
    var config =
        (request.config() != null ? request.config() : ScheduleConfig.defaults()).withDefaults();
    if (request.type() != null) {
      validateConfig(request.type(), config, errors);
    }
    if (!errors.isEmpty()) {
      throw new ScheduleValidationException(errors);
    }

    Instant now = clock.instant();
    var schedule =
        new Schedule(
            request.name().trim(),
            request.description(),
            request.type(),
            config,
            request.actionType().trim(),
            copyOf(request.actionConfig()),
            request.maxRuns(),
            createdBy != null && !createdBy.isBlank() ? createdBy : DEFAULT_CREATED_BY,
            now);

    Instant nextRun = recurrenceCalculator.computeNextRun(schedule, now);
    if (nextRun != null) {
      schedule.advanceTo(nextRun, now);
    } else {
      // Nothing to run, ever: store it as finished rather than as an ACTIVE schedule never due
      schedule.transitionTo(ScheduleStatus.COMPLETED, now);
    }

    schedule = scheduleStore.insertSchedule(schedule);

    if (actionRegistry.resolve(schedule.getActionType()).isEmpty()) {
      log.warn(
          "Schedule {} uses action type {} which has no registered handler",
          schedule.getId(),
          schedule.getActionType());
    }
    log.info(
        "Created {} schedule {} ({}), status={}, nextRun={}",
        schedule.getType(),
        schedule.getId(),
        schedule.getName(),
        schedule.getStatus(),
        schedule.getNextRun());

    return ScheduleResponse.from(schedule);
  }

  /**
   * Applies the non-null fields of the request. A new type or config recomputes the next run from
   * now before the schedule can be dispatched again.
   */
  public ScheduleResponse update(UUID id, UpdateScheduleRequest request) {
    var errors = new ArrayList<String>();
    if (request.name() != null && request.name().isBlank()) {
      errors.add("name must not be blank");
    }
    if (request.actionType() != null && request.actionType().isBlank()) {
      errors.add("actionType must not be blank");
    }
    if (request.maxRuns() != null && request.maxRuns() < 1) {
      errors.add("maxRuns must be at least 1");
    }
    if (!errors.isEmpty()) {
      throw new ScheduleValidationException(errors);
    }

    var response =
        scheduleStore
            .updateSchedule(id, schedule -> applyUpdate(schedule, request))
            .orElseThrow(() -> new ResourceNotFoundException("Schedule", id));

    log.info("Updated schedule {}, nextRun={}", id, response.nextRun());
    return response;
  }

  private ScheduleResponse applyUpdate(Schedule schedule, UpdateScheduleRequest request) {
    if (schedule.getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Cannot update schedule",
          "Schedule is "
              + schedule.getStatus()
              + " and can no longer be updated. Create a new schedule instead.");
    }

    Instant now = clock.instant();
    if (request.type() != null || request.config() != null) {
      var type = request.type() != null ? request.type() : schedule.getType();
      var config =
          (request.config() != null ? request.config() : schedule.getConfig()).withDefaults();
      var errors = new ArrayList<String>();
      validateConfig(type, config, errors);
      if (!errors.isEmpty()) {
        throw new ScheduleValidationException(errors);
      }
      var nextRun = recurrenceCalculator.computeNextRun(type, config, now);
      schedule.reconfigure(type, config, nextRun, now);
      if (nextRun == null && schedule.getStatus() == ScheduleStatus.ACTIVE) {
        schedule.transitionTo(ScheduleStatus.COMPLETED, now);
        log.info("Schedule {} has no further occurrences, completed on update", schedule.getId());
      }
    }

    schedule.updateDetails(
        request.name() != null ? request.name().trim() : schedule.getName(),
        request.description() != null ? request.description() : schedule.getDescription(),
        request.actionType() != null ? request.actionType().trim() : schedule.getActionType(),
        request.actionConfig() != null
            ? copyOf(request.actionConfig())
            : schedule.getActionConfig(),
        request.maxRuns() != null ? request.maxRuns() : schedule.getMaxRuns(),
        now);
    return ScheduleResponse.from(schedule);
  }

  /**
   * Pauses an ACTIVE schedule. Pausing a schedule that is already paused succeeds without
   * changing it.
   *
   * @return false if the schedule does not exist or is COMPLETED or CANCELLED
   */
  public boolean pause(UUID id) {
    Instant now = clock.instant();
    var transition = transition(id, ScheduleStatus.PAUSED, now);
    if (transition == null) {
      return false;
    }
    if (transition.outcome() == TransitionOutcome.CHANGED) {
      log.info("Paused schedule {}", id);
      eventPublisher.publishEvent(new SchedulePausedEvent(id, transition.scheduleName(), now));
    }
    return transition.outcome() != TransitionOutcome.REJECTED;
  }

  /**
   * Reactivates a PAUSED schedule with a next run computed from the current time. A paused
   * schedule whose rule yields no further occurrence is completed instead.
   *
   * @return true if the schedule is ACTIVE again
   */
  public boolean resume(UUID id) {
    Instant now = clock.instant();
    var result =
        scheduleStore.updateSchedule(
            id,
            schedule -> {
              if (schedule.getStatus() != ScheduleStatus.PAUSED) {
                return new Transition(TransitionOutcome.REJECTED, schedule.getName());
              }
              var nextRun = recurrenceCalculator.computeNextRun(schedule, now);
              if (nextRun == null) {
                schedule.transitionTo(ScheduleStatus.COMPLETED, now);
                return new Transition(
                    TransitionOutcome.COMPLETED, schedule.getName(), schedule.getRunCount());
              }
              schedule.resume(nextRun, now);
              return new Transition(TransitionOutcome.CHANGED, schedule.getName());
            });

    if (result.isEmpty()) {
      return false;
    }
    var transition = result.get();
    switch (transition.outcome()) {
      case CHANGED -> log.info("Resumed schedule {}", id);
      case COMPLETED -> {
        log.info("Schedule {} has no further occurrences, completed on resume", id);
        // published after the row lock is released
        eventPublisher.publishEvent(
            new ScheduleCompletedEvent(id, transition.scheduleName(), transition.runCount(), now));
      }
      default -> log.debug("Schedule {} is not paused, resume ignored", id);
    }
    return transition.outcome() == TransitionOutcome.CHANGED;
  }

  /**
   * Cancels a schedule permanently. Cancelling twice succeeds.
   *
   * @return false if the schedule does not exist or has already COMPLETED
   */
  public boolean cancel(UUID id) {
    var transition = transition(id, ScheduleStatus.CANCELLED, clock.instant());
    if (transition == null) {
      return false;
    }
    if (transition.outcome() == TransitionOutcome.CHANGED) {
      log.info("Cancelled schedule {}", id);
    }
    return transition.outcome() != TransitionOutcome.REJECTED;
  }

  public ScheduleResponse get(UUID id) {
    return scheduleStore
        .getSchedule(id)
        .map(ScheduleResponse::from)
        .orElseThrow(() -> new ResourceNotFoundException("Schedule", id));
  }

  public List<ScheduleResponse> getSchedules(
      ScheduleStatus status, ScheduleType type, Integer limit) {
    return scheduleStore.listSchedules(status, type, effectiveLimit(limit)).stream()
        .map(ScheduleResponse::from)
        .toList();
  }

  /** Execution history, newest first. A null schedule id lists executions of every schedule. */
  public List<ScheduleExecutionResponse> getScheduleExecutions(UUID scheduleId, Integer limit) {
    if (scheduleId != null && scheduleStore.getSchedule(scheduleId).isEmpty()) {
      throw new ResourceNotFoundException("Schedule", scheduleId);
    }
    return scheduleStore.listExecutions(scheduleId, effectiveLimit(limit)).stream()
        .map(ScheduleExecutionResponse::from)
        .toList();
  }

  public ScheduleStatistics getScheduleStatistics() {
    long totalExecutions = scheduleStore.countExecutions();
    long successfulExecutions = scheduleStore.countExecutions(ExecutionStatus.COMPLETED);
    double successRate =
        totalExecutions > 0 ? (double) successfulExecutions / totalExecutions * 100 : 0;
    return new ScheduleStatistics(
        scheduleStore.countSchedules(),
        scheduleStore.countActiveSchedules(),
        totalExecutions,
        successfulExecutions,
        successRate);
  }

  private Transition transition(UUID id, ScheduleStatus target, Instant now) {
    return scheduleStore
        .updateSchedule(
            id,
            schedule -> {
              if (schedule.getStatus() == target) {
                return new Transition(TransitionOutcome.UNCHANGED, schedule.getName());
              }
              var outcome =
                  schedule.transitionTo(target, now)
                      ? TransitionOutcome.CHANGED
                      : TransitionOutcome.REJECTED;
              return new Transition(outcome, schedule.getName());
            })
        .orElse(null);
  }

  private int effectiveLimit(Integer limit) {
    return limit != null && limit > 0 ? limit : properties.defaultListLimit();
  }

  void validateConfig(ScheduleType type, ScheduleConfig config, List<String> errors) {
    try {
      ZoneId.of(config.timezone());
    } catch (DateTimeException e) {
      errors.add("Unknown timezone: " + config.timezone());
    }
    if (config.interval() < 1 || config.interval() > MAX_INTERVAL) {
      errors.add("interval must be between 1 and " + MAX_INTERVAL);
    }
    if (config.maxOccurrences() != null && config.maxOccurrences() < 1) {
      errors.add("maxOccurrences must be at least 1");
    }
    if (config.startDate() != null
        && config.endDate() != null
        && config.endDate().isBefore(config.startDate())) {
      errors.add("endDate must not be before startDate");
    }
    for (Integer day : config.customDays()) {
      if (day == null || day < 0 || day > 6) {
        errors.add("customDays must be weekday indices 0 (Monday) to 6 (Sunday), got " + day);
      }
    }

    switch (type) {
      case ONCE -> {
        if (config.startDate() == null) {
          errors.add("ONCE schedules require config.startDate");
        }
      }
      case DAILY -> {
        if (config.recurrencePattern() == RecurrencePattern.CUSTOM_DAYS
            && config.customDays().isEmpty()) {
          errors.add("CUSTOM_DAYS pattern requires at least one entry in customDays");
        }
      }
      case CRON -> {
        if (config.cronExpression() == null || config.cronExpression().isBlank()) {
          errors.add("CRON schedules require config.cronExpression");
        } else if (!recurrenceCalculator.isValidCronExpression(config.cronExpression())) {
          errors.add("Invalid cron expression: " + config.cronExpression());
        }
      }
      default -> {}
    }

    var retryPolicy = config.retryPolicy();
    if (retryPolicy != null) {
      if (retryPolicy.maxRetries() == null || retryPolicy.maxRetries() < 0) {
        errors.add("retryPolicy.maxRetries must be zero or more");
      }
      if (retryPolicy.backoffSeconds() == null
          || retryPolicy.backoffSeconds() < 1
          || retryPolicy.backoffSeconds() > MAX_BACKOFF_SECONDS) {
        errors.add("retryPolicy.backoffSeconds must be between 1 and " + MAX_BACKOFF_SECONDS);
      }
    }
  }

  private static Map<String, Object> copyOf(Map<String, Object> actionConfig) {
    return actionConfig != null ? new LinkedHashMap<>(actionConfig) : new LinkedHashMap<>();
  }

  private enum TransitionOutcome {
    CHANGED,
    UNCHANGED,
    REJECTED,
    COMPLETED
  }

  private record Transition(TransitionOutcome outcome, String scheduleName, int runCount) {

    Transition(TransitionOutcome outcome, String scheduleName) {
      this(outcome, scheduleName, 0);
    }
  }
}
