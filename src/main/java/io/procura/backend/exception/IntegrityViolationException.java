package io.procura.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A signature or hash-chain link in the audit ledger failed to validate. Never auto-repaired.
 * Rendered with {@code integrityViolation=true} so compliance tooling can alarm on it separately
 * from "not found".
 */
public class IntegrityViolationException extends ErrorResponseException {

  private final UUID submissionId;
  private final Long brokenAtSequence;

  public IntegrityViolationException(UUID submissionId, Long brokenAtSequence, String detail) {
    super(
        HttpStatus.UNPROCESSABLE_ENTITY,
        createProblem(submissionId, brokenAtSequence, detail),
        null);
    this.submissionId = submissionId;
    this.brokenAtSequence = brokenAtSequence;
  }

  public UUID getSubmissionId() {
    return submissionId;
  }

  public Long getBrokenAtSequence() {
    return brokenAtSequence;
  }

  private static ProblemDetail createProblem(
      UUID submissionId, Long brokenAtSequence, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Audit integrity violation");
    problem.setDetail(detail);
    problem.setProperty("integrityViolation", true);
    problem.setProperty("submissionId", submissionId);
    problem.setProperty("brokenAtSequence", brokenAtSequence);
    return problem;
  }
}
