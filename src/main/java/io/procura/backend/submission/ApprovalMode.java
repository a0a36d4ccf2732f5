package io.procura.backend.submission;

/** How a completed submission obtained its approval. */
public enum ApprovalMode {
  /** Every non-skipped step of the chain was approved by a person. */
  MANUAL,

  /** The autonomy policy approved it without a chain. */
  AUTONOMOUS
}
