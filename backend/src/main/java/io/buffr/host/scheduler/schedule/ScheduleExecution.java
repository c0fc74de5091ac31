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
 * Execution history for a schedule. Each row is one dispatch attempt. Created RUNNING, settled
 * exactly once to COMPLETED, FAILED or TIMED_OUT, and never mutated after that.
 */
@Entity
@Table(name = "schedule_executions")
public class ScheduleExecution {

  @Id private UUID id;

  @Column(name = "schedule_id", nullable = false)
  private UUID scheduleId;

  @Column(name = "scheduled_at", nullable = false)
  private Instant scheduledAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExecutionStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "result", columnDefinition = "jsonb")
  private Map<String, Object> result;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  protected ScheduleExecution() {}

  private ScheduleExecution(
      UUID scheduleId, Instant scheduledAt, Instant startedAt, ExecutionStatus status) {
    this.id = UUID.randomUUID();
    this.scheduleId = scheduleId;
    this.scheduledAt = scheduledAt;
    this.startedAt = startedAt;
    this.status = status;
  }

  /** Opens an attempt for the given schedule occurrence. */
  public static ScheduleExecution running(UUID scheduleId, Instant scheduledAt, Instant startedAt) {
    return new ScheduleExecution(scheduleId, scheduledAt, startedAt, ExecutionStatus.RUNNING);
  }

  public void complete(Map<String, Object> result, Instant at) {
    settle(ExecutionStatus.COMPLETED, at);
    this.result = result;
  }

  public void fail(String errorMessage, Instant at) {
    settle(ExecutionStatus.FAILED, at);
    this.errorMessage = errorMessage;
  }

  public void timeOut(String errorMessage, Instant at) {
    settle(ExecutionStatus.TIMED_OUT, at);
    this.errorMessage = errorMessage;
  }

  private void settle(ExecutionStatus outcome, Instant at) {
    if (status.isSettled()) {
      throw new IllegalStateException(
          "Execution " + id + " already settled as " + status + ", cannot move to " + outcome);
    }
    this.status = outcome;
    this.completedAt = at;
  }

  public UUID getId() {
    return id;
  }

  public UUID getScheduleId() {
    return scheduleId;
  }

  public Instant getScheduledAt() {
    return scheduledAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public Map<String, Object> getResult() {
    return result;
  }

  public String getErrorMessage() {
    return errorMessage;
  }
}
