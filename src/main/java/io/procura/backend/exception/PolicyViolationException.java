package io.procura.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a caller tries to force autonomous approval outside the configured policy bounds.
 * Always rejected. The attempt itself is recorded in the submission's audit ledger before this is
 * thrown.
 */
public class PolicyViolationException extends ErrorResponseException {

  private final String policyReason;

  public PolicyViolationException(String policyReason) {
    super(HttpStatus.FORBIDDEN, createProblem(policyReason), null);
    this.policyReason = policyReason;
  }

  public String getPolicyReason() {
    return policyReason;
  }

  private static ProblemDetail createProblem(String policyReason) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Autonomy policy violation");
    problem.setDetail("Autonomous approval cannot be forced: " + policyReason);
    problem.setProperty("policyReason", policyReason);
    return problem;
  }
}
