package io.procura.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A workflow precondition was violated: wrong status, out-of-order step, missing role
 * authorization. Never retried automatically.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
