package io.buffr.host.scheduler.schedule.dto;

import io.buffr.host.scheduler.schedule.ScheduleConfig;
import io.buffr.host.scheduler.schedule.ScheduleType;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;

/** Partial update. Null fields keep their current value. */
public record UpdateScheduleRequest(
    @Size(max = 200) String name,
    String description,
    ScheduleType type,
    ScheduleConfig config,
    @Size(max = 100) String actionType,
    Map<String, Object> actionConfig,
    @Positive Integer maxRuns) {}
