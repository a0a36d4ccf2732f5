package io.procura.backend.integration.notification;

/** Why an approver or owner is being notified. */
public enum NotificationKind {
  /** A step became actionable and waits for the recipient. */
  APPROVAL_REQUESTED,

  /** A step passed its SLA deadline. */
  ESCALATED,

  /** The submission was rejected. */
  REJECTED,

  /** The submission completed approval. */
  COMPLETED
}
