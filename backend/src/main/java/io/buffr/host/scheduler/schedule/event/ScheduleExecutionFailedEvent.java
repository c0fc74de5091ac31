package io.buffr.host.scheduler.schedule.event;

import io.buffr.host.scheduler.schedule.ExecutionStatus;
import java.time.Instant;
import java.util.UUID;

/** Published for every FAILED or TIMED_OUT execution. */
public record ScheduleExecutionFailedEvent(
    UUID scheduleId,
    UUID executionId,
    String actionType,
    ExecutionStatus status,
    String errorMessage,
    int consecutiveFailures,
    Instant occurredAt) {}
