package io.buffr.host.scheduler.action;

import java.time.Duration;

/** A schedule's action could not be run, reported failure, or did not finish in time. */
public class ActionExecutionException extends RuntimeException {

  private final boolean timedOut;

  public ActionExecutionException(String message) {
    this(message, null, false);
  }

  public ActionExecutionException(String message, Throwable cause) {
    this(message, cause, false);
  }

  private ActionExecutionException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public static ActionExecutionException noHandler(String actionType) {
    return new ActionExecutionException("No handler for action type: " + actionType);
  }

  public static ActionExecutionException timedOut(String actionType, Duration timeout) {
    return new ActionExecutionException(
        "Action " + actionType + " did not complete within " + timeout, null, true);
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
