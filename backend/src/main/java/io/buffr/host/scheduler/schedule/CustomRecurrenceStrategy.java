package io.buffr.host.scheduler.schedule;

import java.time.ZonedDateTime;

/**
 * Computes the next run of a {@link ScheduleType#CUSTOM} schedule. Supply a bean of this type to
 * replace the default one-day step.
 */
@FunctionalInterface
public interface CustomRecurrenceStrategy {

  /**
   * @param config the schedule's merged configuration
   * @param reference the reference time in the schedule's timezone
   * @return the next run strictly after {@code reference}, or null if there is none
   */
  ZonedDateTime nextAfter(ScheduleConfig config, ZonedDateTime reference);

  static CustomRecurrenceStrategy daily() {
    return (config, reference) -> reference.plusDays(1);
  }
}
