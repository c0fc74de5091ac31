package io.buffr.host.scheduler.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recurrence configuration stored as jsonb on the schedule row. Every component is optional on
 * input; {@link #withDefaults()} fills the documented defaults before a schedule is persisted.
 *
 * @param timezone IANA zone id used for calendar and cron arithmetic, defaults to {@code UTC}
 * @param startDate first instant of a ONCE schedule, first occurrence of a recurring one
 * @param endDate no run is scheduled after this instant
 * @param maxOccurrences run cap used when the schedule itself has no {@code maxRuns}
 * @param recurrencePattern DAILY sub-selector, defaults to {@link RecurrencePattern#EVERY_DAY}
 * @param customDays weekday indices, 0=Monday..6=Sunday
 * @param interval repeat-every-N multiplier, defaults to 1
 * @param cronExpression five-field Unix cron expression, required for CRON schedules
 * @param metadata free-form caller data, also read by custom recurrence strategies
 * @param retryPolicy optional bounded retry with exponential backoff after failed runs
 */
public record ScheduleConfig(
    String timezone,
    Instant startDate,
    Instant endDate,
    Integer maxOccurrences,
    RecurrencePattern recurrencePattern,
    List<Integer> customDays,
    Integer interval,
    String cronExpression,
    Map<String, Object> metadata,
    RetryPolicy retryPolicy) {

  public static final String DEFAULT_TIMEZONE = "UTC";

  /**
   * Bounded retry for failed runs. Without a policy a failed schedule stays due and is retried on
   * the next tick.
   *
   * @param maxRetries consecutive failures tolerated before skipping to the next occurrence
   * @param backoffSeconds delay before the first retry, doubled for each further failure
   */
  public record RetryPolicy(Integer maxRetries, Long backoffSeconds) {}

  public static ScheduleConfig defaults() {
    return new ScheduleConfig(null, null, null, null, null, null, null, null, null, null)
        .withDefaults();
  }

  /** Returns a copy with every unset component replaced by its documented default. */
  public ScheduleConfig withDefaults() {
    return new ScheduleConfig(
        timezone != null && !timezone.isBlank() ? timezone : DEFAULT_TIMEZONE,
        startDate,
        endDate,
        maxOccurrences,
        recurrencePattern != null ? recurrencePattern : RecurrencePattern.EVERY_DAY,
        customDays != null
            ? Collections.unmodifiableList(new ArrayList<>(customDays))
            : List.of(),
        interval != null ? interval : 1,
        cronExpression,
        metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of(),
        retryPolicy);
  }
}
