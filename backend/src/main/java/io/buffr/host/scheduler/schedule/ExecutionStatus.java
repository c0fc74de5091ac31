package io.buffr.host.scheduler.schedule;

/** Outcome of a single dispatch attempt. Everything but PENDING and RUNNING is terminal. */
public enum ExecutionStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  TIMED_OUT;

  public boolean isSettled() {
    return this != PENDING && this != RUNNING;
  }
}
