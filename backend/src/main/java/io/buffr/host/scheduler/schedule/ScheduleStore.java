package io.buffr.host.scheduler.schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Persistence boundary for schedules and their execution history. Implementations must apply each
 * {@code update*} mutation atomically with respect to other writers of the same row.
 */
public interface ScheduleStore {

  Schedule insertSchedule(Schedule schedule);

  Optional<Schedule> getSchedule(UUID id);

  /**
   * Applies {@code mutation} to the current state of the schedule under a row lock and persists
   * the result.
   *
   * @return the mutation's return value, or empty if no schedule has this id
   */
  <T> Optional<T> updateSchedule(UUID id, Function<Schedule, T> mutation);

  /** ACTIVE schedules whose next run is at or before {@code now} and that hold no live claim. */
  List<Schedule> queryDueSchedules(Instant now);

  /**
   * Atomically takes the dispatch lease on a due schedule so overlapping ticks cannot dispatch it
   * twice while an attempt is in flight.
   */
  default boolean claim(UUID id, Instant now, Instant leaseUntil) {
    return updateSchedule(id, schedule -> schedule.claim(now, leaseUntil)).orElse(false);
  }

  ScheduleExecution insertExecution(ScheduleExecution execution);

  Optional<ScheduleExecution> updateExecution(UUID id, Consumer<ScheduleExecution> mutation);

  /** Newest first; either filter may be null. */
  List<Schedule> listSchedules(ScheduleStatus status, ScheduleType type, int limit);

  /** Newest {@code scheduledAt} first; a null schedule id lists executions of all schedules. */
  List<ScheduleExecution> listExecutions(UUID scheduleId, int limit);

  long countSchedules();

  long countActiveSchedules();

  long countExecutions();

  long countExecutions(ExecutionStatus status);
}
