package io.buffr.host.scheduler.schedule.dto;

import io.buffr.host.scheduler.schedule.ScheduleConfig;
import io.buffr.host.scheduler.schedule.ScheduleType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.Map;

public record CreateScheduleRequest(
    @NotBlank @Size(max = 200) String name,
    String description,
    @NotNull ScheduleType type,
    ScheduleConfig config,
    @NotBlank @Size(max = 100) String actionType,
    Map<String, Object> actionConfig,
    @Positive Integer maxRuns) {}
