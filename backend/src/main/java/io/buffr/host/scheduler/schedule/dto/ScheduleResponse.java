package io.buffr.host.scheduler.schedule.dto;

import io.buffr.host.scheduler.schedule.Schedule;
import io.buffr.host.scheduler.schedule.ScheduleConfig;
import io.buffr.host.scheduler.schedule.ScheduleStatus;
import io.buffr.host.scheduler.schedule.ScheduleType;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record ScheduleResponse(
    UUID id,
    String name,
    String description,
    ScheduleType type,
    ScheduleStatus status,
    ScheduleConfig config,
    String actionType,
    Map<String, Object> actionConfig,
    Instant nextRun,
    Instant lastRun,
    int runCount,
    Integer maxRuns,
    boolean isActive,
    int consecutiveFailures,
    String createdBy,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduleResponse from(Schedule schedule) {
    return new ScheduleResponse(
        schedule.getId(),
        schedule.getName(),
        schedule.getDescription(),
        schedule.getType(),
        schedule.getStatus(),
        schedule.getConfig(),
        schedule.getActionType(),
        schedule.getActionConfig(),
        schedule.getNextRun(),
        schedule.getLastRun(),
        schedule.getRunCount(),
        schedule.getMaxRuns(),
        schedule.isActive(),
        schedule.getConsecutiveFailures(),
        schedule.getCreatedBy(),
        schedule.getCreatedAt(),
        schedule.getUpdatedAt());
  }
}
