package io.procura.backend.workflow;

import io.procura.backend.approval.ApprovalStep;
import io.procura.backend.approval.ApprovalStepStatus;
import java.time.Instant;

/** Compact view of one approval step as returned by workflow operations. */
public record StepSummary(
    String stepName,
    int stepOrder,
    String approverRole,
    String assignedApproverId,
    ApprovalStepStatus status,
    String decidedById,
    Instant decidedAt) {

  static StepSummary from(ApprovalStep step) {
    return new StepSummary(
        step.getStepName(),
        step.getStepOrder(),
        step.getApproverRole(),
        step.getAssignedApproverId(),
        step.getStatus(),
        step.getDecidedById(),
        step.getDecidedAt());
  }
}
