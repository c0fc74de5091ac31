package io.buffr.host.scheduler.schedule;

/** Selects which recurrence algorithm computes a schedule's next run. */
public enum ScheduleType {
  ONCE,
  DAILY,
  WEEKLY,
  MONTHLY,
  YEARLY,
  CRON,
  CUSTOM
}
