package io.procura.backend.approval;

/** Status of one step in an approval chain. */
public enum ApprovalStepStatus {
  /** Waiting for a decision. Only the lowest-order pending step is actionable. */
  PENDING,

  /** Approved by an authorized approver. */
  APPROVED,

  /** Rejected; the submission is rejected with it. */
  REJECTED,

  /** Not required for this submission (conditional template step). */
  SKIPPED;

  /** True for APPROVED and REJECTED: a person made a decision on the step. */
  public boolean isDecided() {
    return this == APPROVED || this == REJECTED;
  }
}
