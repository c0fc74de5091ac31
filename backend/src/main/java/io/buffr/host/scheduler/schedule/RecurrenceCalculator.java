package io.buffr.host.scheduler.schedule;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the next execution instant of a schedule. Pure: the result depends only on the
 * schedule's type and config and on the reference time passed in.
 *
 * <p>Calendar arithmetic happens in the schedule's configured timezone, so a daily 09:00 run stays
 * at 09:00 local time across DST changes.
 */
public class RecurrenceCalculator {

  private static final Logger log = LoggerFactory.getLogger(RecurrenceCalculator.class);

  /** Day-by-day scans give up after this many days (covers any weekday set). */
  private static final int MAX_DAY_SCAN = 7;

  /** Runs later than this cannot be stored in a timestamptz column. */
  static final Instant LATEST_RUN = Instant.parse("9999-12-31T23:59:59Z");

  private static final CronParser CRON_PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private final CustomRecurrenceStrategy customStrategy;

  public RecurrenceCalculator() {
    this(CustomRecurrenceStrategy.daily());
  }

  public RecurrenceCalculator(CustomRecurrenceStrategy customStrategy) {
    this.customStrategy = customStrategy;
  }

  /**
   * @return the next run strictly after {@code referenceTime}, or {@code config.startDate} when
   *     that is still ahead and matches the rule; null if the schedule will never fire again or
   *     its rule cannot be evaluated
   */
  public Instant computeNextRun(Schedule schedule, Instant referenceTime) {
    return computeNextRun(schedule.getType(), schedule.getConfig(), referenceTime);
  }

  public Instant computeNextRun(
      ScheduleType type, ScheduleConfig rawConfig, Instant referenceTime) {
    var config = rawConfig != null ? rawConfig.withDefaults() : ScheduleConfig.defaults();

    if (type == ScheduleType.ONCE) {
      var start = config.startDate();
      return start != null && start.isAfter(referenceTime) ? start : null;
    }

    ZoneId zone;
    try {
      zone = ZoneId.of(config.timezone());
    } catch (DateTimeException e) {
      log.warn("Cannot compute next run: unknown timezone '{}'", config.timezone());
      return null;
    }

    ZonedDateTime next;
    try {
      // A future startDate is itself the first occurrence when the rule allows it
      if (config.startDate() != null && config.startDate().isAfter(referenceTime)) {
        next = firstOnOrAfter(type, config, config.startDate().atZone(zone));
      } else {
        next = nextAfter(type, config, referenceTime.atZone(zone));
      }
    } catch (DateTimeException | ArithmeticException e) {
      log.warn("Cannot compute next {} run after {}: {}", type, referenceTime, e.getMessage());
      return null;
    }

    if (next == null) {
      return null;
    }
    var nextInstant = next.toInstant();
    if (config.endDate() != null && nextInstant.isAfter(config.endDate())) {
      return null;
    }
    if (nextInstant.isAfter(LATEST_RUN)) {
      log.warn("Next {} run {} is beyond the supported range", type, nextInstant);
      return null;
    }
    return nextInstant;
  }

  /** True if the expression parses as a five-field Unix cron expression. */
  public boolean isValidCronExpression(String expression) {
    if (expression == null || expression.isBlank()) {
      return false;
    }
    try {
      CRON_PARSER.parse(expression.trim()).validate();
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  private ZonedDateTime nextAfter(
      ScheduleType type, ScheduleConfig config, ZonedDateTime reference) {
    return switch (type) {
      case DAILY -> nextDaily(config, reference);
      case WEEKLY -> reference.plusWeeks(config.interval());
      case MONTHLY -> reference.plusMonths(config.interval());
      case YEARLY -> reference.plusYears(config.interval());
      case CRON -> nextCron(config, reference, false);
      case CUSTOM -> customStrategy.nextAfter(config, reference);
      case ONCE -> null;
    };
  }

  private ZonedDateTime firstOnOrAfter(
      ScheduleType type, ScheduleConfig config, ZonedDateTime start) {
    if (type == ScheduleType.CRON) {
      return nextCron(config, start, true);
    }
    if (type == ScheduleType.DAILY) {
      return switch (config.recurrencePattern()) {
        // day scans start the day after their reference
        case WEEKDAYS, WEEKENDS, CUSTOM_DAYS -> nextDaily(config, start.minusDays(1));
        default -> start;
      };
    }
    return start;
  }

  private ZonedDateTime nextDaily(ScheduleConfig config, ZonedDateTime reference) {
    return switch (config.recurrencePattern()) {
      case EVERY_DAY, EVERY_N_DAYS -> reference.plusDays(config.interval());
      case WEEKDAYS -> nextMatchingDay(reference, day -> !isWeekend(day));
      case WEEKENDS -> nextMatchingDay(reference, RecurrenceCalculator::isWeekend);
      case CUSTOM_DAYS -> nextCustomDay(config.customDays(), reference);
      case EVERY_WEEK -> reference.plusWeeks(config.interval());
      case EVERY_MONTH -> reference.plusMonths(config.interval());
      case EVERY_YEAR -> reference.plusYears(config.interval());
    };
  }

  private ZonedDateTime nextCustomDay(List<Integer> customDays, ZonedDateTime reference) {
    if (customDays.isEmpty()) {
      log.warn("Cannot compute next run: CUSTOM_DAYS pattern without custom days");
      return null;
    }
    // 0=Monday..6=Sunday, DayOfWeek.getValue() is 1=Monday..7=Sunday
    return nextMatchingDay(reference, day -> customDays.contains(day.getValue() - 1));
  }

  private static ZonedDateTime nextMatchingDay(
      ZonedDateTime reference, Predicate<DayOfWeek> matches) {
    var candidate = reference.plusDays(1);
    for (int i = 0; i < MAX_DAY_SCAN; i++) {
      if (matches.test(candidate.getDayOfWeek())) {
        return candidate;
      }
      candidate = candidate.plusDays(1);
    }
    return null;
  }

  private static boolean isWeekend(DayOfWeek day) {
    return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
  }

  private ZonedDateTime nextCron(
      ScheduleConfig config, ZonedDateTime reference, boolean includeReference) {
    var expression = config.cronExpression();
    if (expression == null || expression.isBlank()) {
      log.warn("Cannot compute next run: CRON schedule without cron expression");
      return null;
    }
    try {
      var cron = CRON_PARSER.parse(expression.trim());
      cron.validate();
      var executionTime = ExecutionTime.forCron(cron);
      if (includeReference && executionTime.isMatch(reference)) {
        return reference;
      }
      return executionTime.nextExecution(reference).orElse(null);
    } catch (IllegalArgumentException e) {
      log.warn("Invalid cron expression '{}': {}", expression, e.getMessage());
      return null;
    }
  }
}
