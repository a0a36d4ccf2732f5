package io.procura.backend.workflow;

import io.procura.backend.submission.ApprovalMode;
import io.procura.backend.submission.ApprovalStatus;
import io.procura.backend.submission.Submission;
import io.procura.backend.submission.SubmissionStatus;
import java.util.List;
import java.util.UUID;

/**
 * State of a submission after an accepted workflow operation, with the audit entry it produced.
 *
 * @param reason autonomy decision reason for approval requests, null otherwise
 * @param steps the chain created by an approval request; empty for other operations and for
 *     autonomous approval
 * @param decidedStep the step an approve or reject decided, null otherwise
 * @param auditSequence sequence of the entry written by the operation
 */
public record WorkflowResult(
    UUID submissionId,
    SubmissionStatus status,
    ApprovalStatus approvalStatus,
    ApprovalMode approvalMode,
    int chainGeneration,
    String reason,
    List<StepSummary> steps,
    StepSummary decidedStep,
    long auditSequence) {

  public WorkflowResult {
    steps = steps == null ? List.of() : List.copyOf(steps);
  }

  static WorkflowResult of(Submission submission, String reason, long auditSequence) {
    return of(submission, reason, List.of(), null, auditSequence);
  }

  static WorkflowResult of(
      Submission submission,
      String reason,
      List<StepSummary> steps,
      StepSummary decidedStep,
      long auditSequence) {
    return new WorkflowResult(
        submission.getId(),
        submission.getStatus(),
        submission.getApprovalStatus(),
        submission.getApprovalMode(),
        submission.getChainGeneration(),
        reason,
        steps,
        decidedStep,
        auditSequence);
  }
}
