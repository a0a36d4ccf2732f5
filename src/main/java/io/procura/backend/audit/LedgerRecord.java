package io.procura.backend.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Detached, JPA-free view of an audit entry. Verification and export work on this type so that a
 * previously exported chain can be re-verified without touching the database.
 *
 * @param id entry id; may be null for entries that were never persisted
 * @param submissionId the submission whose chain this entry belongs to
 * @param sequence 1-based position in the chain
 * @param occurredAt microsecond-precision timestamp covered by the digest
 * @param actor human identity or a {@code system:*} actor
 * @param action dotted action name, e.g. {@code approval_step.approved}
 * @param payload canonical JSON of the caller-supplied payload
 * @param evidenceRefs external references (automation run ids, receipt ids)
 * @param digest SHA-256 of the canonical entry document, hex
 * @param priorHash signature of the previous entry, or {@link AuditEntrySigner#GENESIS_HASH}
 * @param signature HMAC over {@code keyVersion, priorHash, digest, sequence}, hex
 * @param keyVersion signing key version used for {@code signature}
 */
public record LedgerRecord(
    UUID id,
    UUID submissionId,
    long sequence,
    Instant occurredAt,
    String actor,
    String action,
    String payload,
    List<String> evidenceRefs,
    String digest,
    String priorHash,
    String signature,
    String keyVersion) {

  public LedgerRecord {
    evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
  }
}
