package io.procura.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A concurrent mutation won the race. The caller may re-read and retry. */
public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("retryable", true);
    return problem;
  }
}
