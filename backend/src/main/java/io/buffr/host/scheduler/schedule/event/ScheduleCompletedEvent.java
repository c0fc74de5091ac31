package io.buffr.host.scheduler.schedule.event;

import java.time.Instant;
import java.util.UUID;

/** Published when a schedule reaches its run cap or runs out of occurrences. */
public record ScheduleCompletedEvent(
    UUID scheduleId, String scheduleName, int runCount, Instant occurredAt) {}
