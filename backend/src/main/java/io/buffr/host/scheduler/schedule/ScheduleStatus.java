package io.buffr.host.scheduler.schedule;

import java.util.Map;
import java.util.Set;

/** Schedule lifecycle status with validated transitions. */
public enum ScheduleStatus {
  ACTIVE,
  PAUSED,
  COMPLETED,
  CANCELLED;

  private static final Map<ScheduleStatus, Set<ScheduleStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          ACTIVE, Set.of(PAUSED, CANCELLED, COMPLETED),
          PAUSED, Set.of(ACTIVE, CANCELLED, COMPLETED),
          COMPLETED, Set.of(),
          CANCELLED, Set.of());

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(ScheduleStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == CANCELLED;
  }

  /** Only ACTIVE schedules are picked up by the dispatch loop. */
  public boolean isDispatchEligible() {
    return this == ACTIVE;
  }
}
