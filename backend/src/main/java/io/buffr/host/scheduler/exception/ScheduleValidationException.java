package io.buffr.host.scheduler.exception;

import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A create or update request carries an unusable schedule definition. Every problem found is
 * listed in the {@code errors} property of the problem detail.
 */
public class ScheduleValidationException extends ErrorResponseException {

  private final List<String> errors;

  public ScheduleValidationException(List<String> errors) {
    super(HttpStatus.BAD_REQUEST, createProblem(errors), null);
    this.errors = List.copyOf(errors);
  }

  public ScheduleValidationException(String error) {
    this(List.of(error));
  }

  public List<String> getErrors() {
    return errors;
  }

  @Override
  public String getMessage() {
    return "Invalid schedule: " + String.join("; ", errors);
  }

  private static ProblemDetail createProblem(List<String> errors) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid schedule");
    problem.setDetail(String.join("; ", errors));
    problem.setProperty("errors", List.copyOf(errors));
    return problem;
  }
}
