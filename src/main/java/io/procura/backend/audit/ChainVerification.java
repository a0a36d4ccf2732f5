package io.procura.backend.audit;

import java.util.List;
import java.util.UUID;

/**
 * Result of walking one submission's chain.
 *
 * @param submissionId the submission the chain belongs to
 * @param valid true when every entry verified
 * @param brokenAtSequence first sequence at which verification failed, or null when valid
 * @param entries per-entry outcomes in sequence order
 */
public record ChainVerification(
    UUID submissionId, boolean valid, Long brokenAtSequence, List<EntryVerification> entries) {

  public ChainVerification {
    entries = List.copyOf(entries);
  }
}
