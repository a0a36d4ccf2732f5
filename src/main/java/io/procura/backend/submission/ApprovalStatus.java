package io.procura.backend.submission;

/**
 * Progress of the current approval request, kept next to {@link SubmissionStatus} so lists can be
 * filtered by how far review has got.
 */
public enum ApprovalStatus {
  NOT_REQUESTED,
  PENDING,
  /** At least one step of the open chain is approved and more remain. */
  IN_REVIEW,
  APPROVED,
  REJECTED
}
