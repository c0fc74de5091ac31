package io.buffr.host.scheduler.schedule.event;

import java.time.Instant;
import java.util.UUID;

public record SchedulePausedEvent(UUID scheduleId, String scheduleName, Instant occurredAt) {}
