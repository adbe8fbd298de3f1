package io.b2mash.b2b.inteltask.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a task cannot make the requested status change, for example approving a task that was
 * never submitted. Manual by-point-type execution of a template without target point types raises
 * it too. The detail names the offending status or template.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  /** Rejects a task status change, naming the status the task is currently in. */
  public static InvalidStateException taskTransition(String action, Enum<?> current) {
    return new InvalidStateException(
        "Invalid task state", "Cannot " + action + " task in status " + current);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
