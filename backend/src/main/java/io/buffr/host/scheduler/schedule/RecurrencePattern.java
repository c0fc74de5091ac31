package io.buffr.host.scheduler.schedule;

/** Sub-selector for {@link ScheduleType#DAILY} schedules. */
public enum RecurrencePattern {
  EVERY_DAY,
  WEEKDAYS,
  WEEKENDS,
  CUSTOM_DAYS,
  EVERY_N_DAYS,
  EVERY_WEEK,
  EVERY_MONTH,
  EVERY_YEAR
}
