package io.procura.backend.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Recomputes digests, signatures and links over detached {@link LedgerRecord}s. Has no storage
 * dependency, so live chains and imported exports verify through the same code.
 */
@Component
public class AuditChainVerifier {

  private final AuditPayloadCanonicalizer canonicalizer;
  private final AuditEntrySigner signer;

  public AuditChainVerifier(AuditPayloadCanonicalizer canonicalizer, AuditEntrySigner signer) {
    this.canonicalizer = canonicalizer;
    this.signer = signer;
  }

  /** Recomputes the digest and signature of one entry in isolation. Never throws on bad data. */
  public boolean verifyEntry(LedgerRecord entry) {
    if (entry.occurredAt() == null
        || entry.submissionId() == null
        || !signer.knowsKeyVersion(entry.keyVersion())) {
      return false;
    }
    var document = canonicalizer.entryDocument(entry);
    var digest = signer.digest(document);
    if (!AuditEntrySigner.hexEquals(digest, entry.digest())) {
      return false;
    }
    var signature =
        signer.sign(entry.keyVersion(), entry.priorHash(), entry.digest(), entry.sequence());
    return AuditEntrySigner.hexEquals(signature, entry.signature());
  }

  /**
   * Walks a chain in the given order. The first entry whose sequence, signature or link fails
   * marks the break; that entry and every later one are reported as not verified.
   */
  public ChainVerification verifyChain(UUID submissionId, List<LedgerRecord> entries) {
    var results = new ArrayList<EntryVerification>(entries.size());
    long expectedSequence = 1;
    String expectedPriorHash = AuditEntrySigner.GENESIS_HASH;
    Long brokenAt = null;

    for (var entry : entries) {
      boolean sequenceContinuous = entry.sequence() == expectedSequence;
      boolean signatureValid = verifyEntry(entry);
      boolean linkValid =
          sequenceContinuous && AuditEntrySigner.hexEquals(expectedPriorHash, entry.priorHash());
      if (brokenAt == null && !(signatureValid && linkValid)) {
        brokenAt = Math.min(expectedSequence, entry.sequence());
      }
      results.add(
          new EntryVerification(
              entry.id(), entry.sequence(), signatureValid, linkValid, brokenAt == null));
      expectedSequence = entry.sequence() + 1;
      expectedPriorHash = entry.signature();
    }
    return new ChainVerification(submissionId, brokenAt == null, brokenAt, results);
  }
}
