package io.buffr.host.scheduler.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A persisted recurring-job definition. All state changes go through the mutator methods below so
 * that {@code is_active} is always derived from {@code status} and {@code run_count} only grows.
 */
@Entity
@Table(name = "schedules")
public class Schedule {

  @Id private UUID id;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private ScheduleType type;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ScheduleStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "config", nullable = false, columnDefinition = "jsonb")
  private ScheduleConfig config;

  @Column(name = "action_type", nullable = false, length = 100)
  private String actionType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "action_config", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> actionConfig;

  @Column(name = "next_run")
  private Instant nextRun;

  @Column(name = "last_run")
  private Instant lastRun;

  @Column(name = "run_count", nullable = false)
  private int runCount;

  @Column(name = "max_runs")
  private Integer maxRuns;

  // Mirrors status == ACTIVE, kept as a column for the due-schedule index
  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "consecutive_failures", nullable = false)
  private int consecutiveFailures;

  @Column(name = "claimed_until")
  private Instant claimedUntil;

  @Column(name = "created_by", nullable = false, length = 100)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Schedule() {}

  public Schedule(
      String name,
      String description,
      ScheduleType type,
      ScheduleConfig config,
      String actionType,
      Map<String, Object> actionConfig,
      Integer maxRuns,
      String createdBy,
      Instant createdAt) {
    this.id = UUID.randomUUID();
    this.name = name;
    this.description = description;
    this.type = type;
    this.config = config;
    this.actionType = actionType;
    this.actionConfig = actionConfig;
    this.maxRuns = maxRuns;
    this.createdBy = createdBy;
    this.status = ScheduleStatus.ACTIVE;
    this.active = true;
    this.runCount = 0;
    this.consecutiveFailures = 0;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /**
   * Moves the schedule to the target status. Re-applying the current status is a no-op that
   * succeeds; a transition the state machine forbids leaves the schedule untouched.
   *
   * @return true if the schedule is in the target status afterwards
   */
  public boolean transitionTo(ScheduleStatus target, Instant at) {
    if (status == target) {
      return true;
    }
    if (!status.canTransitionTo(target)) {
      return false;
    }
    this.status = target;
    this.active = target.isDispatchEligible();
    if (target.isTerminal()) {
      this.nextRun = null;
      this.claimedUntil = null;
    }
    this.updatedAt = at;
    return true;
  }

  /** Reactivates a paused schedule with a next run computed at resume time. */
  public boolean resume(Instant nextRun, Instant at) {
    if (status != ScheduleStatus.PAUSED) {
      return false;
    }
    this.status = ScheduleStatus.ACTIVE;
    this.active = true;
    this.nextRun = nextRun;
    this.consecutiveFailures = 0;
    this.claimedUntil = null;
    this.updatedAt = at;
    return true;
  }

  /** A schedule is due when it is ACTIVE and its next run is at or before {@code now}. */
  public boolean isDue(Instant now) {
    return status.isDispatchEligible() && active && nextRun != null && !nextRun.isAfter(now);
  }

  public boolean isClaimed(Instant now) {
    return claimedUntil != null && claimedUntil.isAfter(now);
  }

  /**
   * Takes the dispatch lease for this schedule. Fails if the schedule is no longer due or another
   * dispatch still holds an unexpired lease.
   */
  public boolean claim(Instant now, Instant leaseUntil) {
    if (!isDue(now) || isClaimed(now)) {
      return false;
    }
    this.claimedUntil = leaseUntil;
    return true;
  }

  /**
   * Extends the lease of a dispatch that is about to run. Fails if the schedule is no longer due or
   * its lease is no longer {@code heldLease}, which means the lease lapsed and a later dispatch
   * claimed the schedule.
   */
  public boolean renewClaim(Instant heldLease, Instant now, Instant leaseUntil) {
    if (!isDue(now) || claimedUntil == null || !claimedUntil.equals(heldLease)) {
      return false;
    }
    this.claimedUntil = leaseUntil;
    return true;
  }

  public void releaseClaim() {
    this.claimedUntil = null;
  }

  /** Counts one dispatch attempt, whatever its outcome, and releases the dispatch lease. */
  public void recordAttempt(Instant at) {
    this.runCount++;
    this.lastRun = at;
    this.claimedUntil = null;
    this.updatedAt = at;
  }

  /** Advances to the next occurrence after a successful run. */
  public void advanceTo(Instant nextRun, Instant at) {
    this.nextRun = nextRun;
    this.consecutiveFailures = 0;
    this.updatedAt = at;
  }

  /**
   * Notes a failed run. With a null {@code retryAt} the next run is left unchanged so the schedule
   * stays due.
   */
  public void recordFailure(Instant retryAt, Instant at) {
    this.consecutiveFailures++;
    if (retryAt != null) {
      this.nextRun = retryAt;
    }
    this.updatedAt = at;
  }

  /** Replaces the recurrence rule; the caller supplies the next run computed from it. */
  public void reconfigure(ScheduleType type, ScheduleConfig config, Instant nextRun, Instant at) {
    this.type = type;
    this.config = config;
    this.nextRun = nextRun;
    this.updatedAt = at;
  }

  public void updateDetails(
      String name,
      String description,
      String actionType,
      Map<String, Object> actionConfig,
      Integer maxRuns,
      Instant at) {
    this.name = name;
    this.description = description;
    this.actionType = actionType;
    this.actionConfig = actionConfig;
    this.maxRuns = maxRuns;
    this.updatedAt = at;
  }

  /** The run cap in force: {@code maxRuns}, falling back to {@code config.maxOccurrences}. */
  public Integer effectiveMaxRuns() {
    if (maxRuns != null) {
      return maxRuns;
    }
    return config != null ? config.maxOccurrences() : null;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public ScheduleType getType() {
    return type;
  }

  public ScheduleStatus getStatus() {
    return status;
  }

  public ScheduleConfig getConfig() {
    return config;
  }

  public String getActionType() {
    return actionType;
  }

  public Map<String, Object> getActionConfig() {
    return actionConfig;
  }

  public Instant getNextRun() {
    return nextRun;
  }

  public Instant getLastRun() {
    return lastRun;
  }

  public int getRunCount() {
    return runCount;
  }

  public Integer getMaxRuns() {
    return maxRuns;
  }

  public boolean isActive() {
    return active;
  }

  public int getConsecutiveFailures() {
    return consecutiveFailures;
  }

  public Instant getClaimedUntil() {
    return claimedUntil;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
