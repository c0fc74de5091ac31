package io.buffr.host.scheduler.schedule.dto;

/**
 * Aggregate counters across all schedules.
 *
 * @param successRate percentage of executions that COMPLETED, 0 when there are none
 */
public record ScheduleStatistics(
    long totalSchedules,
    long activeSchedules,
    long totalExecutions,
    long successfulExecutions,
    double successRate) {}
