package io.buffr.host.scheduler.schedule.dto;

import io.buffr.host.scheduler.schedule.ExecutionStatus;
import io.buffr.host.scheduler.schedule.ScheduleExecution;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScheduleExecutionResponse(
    UUID id,
    UUID scheduleId,
    Instant scheduledAt,
    Instant startedAt,
    Instant completedAt,
    ExecutionStatus status,
    Map<String, Object> result,
    String errorMessage) {

  public static ScheduleExecutionResponse from(ScheduleExecution execution) {
    return new ScheduleExecutionResponse(
        execution.getId(),
        execution.getScheduleId(),
        execution.getScheduledAt(),
        execution.getStartedAt(),
        execution.getCompletedAt(),
        execution.getStatus(),
        execution.getResult(),
        execution.getErrorMessage());
  }
}
