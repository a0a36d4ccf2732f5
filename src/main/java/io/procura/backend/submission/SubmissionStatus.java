package io.procura.backend.submission;

/**
 * Submission lifecycle status.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → PENDING_APPROVAL (approval requested, chain created)
 *   <li>DRAFT → COMPLETE (autonomous approval)
 *   <li>PENDING_APPROVAL → COMPLETE (last pending step approved)
 *   <li>PENDING_APPROVAL → REJECTED (any step rejected)
 *   <li>PENDING_APPROVAL → DRAFT (withdrawn)
 *   <li>COMPLETE → SUBMITTED (finalized)
 *   <li>REJECTED and SUBMITTED are terminal
 * </ul>
 */
public enum SubmissionStatus {
  /** Being prepared by its owner; the only editable status. */
  DRAFT,

  /** An approval chain is active. */
  PENDING_APPROVAL,

  /** Approved, either by the full chain or autonomously; ready to finalize. */
  COMPLETE,

  /** A step was rejected. Terminal. */
  REJECTED,

  /** Handed off to the portal. Terminal. */
  SUBMITTED;

  public boolean canTransitionTo(SubmissionStatus target) {
    return switch (this) {
      case DRAFT -> target == PENDING_APPROVAL || target == COMPLETE;
      case PENDING_APPROVAL -> target == COMPLETE || target == REJECTED || target == DRAFT;
      case COMPLETE -> target == SUBMITTED;
      case REJECTED, SUBMITTED -> false;
    };
  }

  public boolean isTerminal() {
    return this == REJECTED || this == SUBMITTED;
  }
}
