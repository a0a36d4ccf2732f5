package io.procura.backend.audit;

import io.procura.backend.exception.IntegrityViolationException;
import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.submission.SubmissionRepository;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only, per-submission hash chain of signed audit entries.
 *
 * <p>Transaction semantics: {@link #append} is {@link Propagation#MANDATORY}. An entry is only ever
 * written inside the transaction that performs the state change it records, so the two commit or
 * roll back together. Callers serialize appends per submission by holding the submission row lock;
 * the unique {@code (submission_id, sequence)} constraint fails any append that slips past it.
 */
@Service
public class AuditLedger {

  private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);

  private final AuditEntryRepository auditEntryRepository;
  private final SubmissionRepository submissionRepository;
  private final AuditPayloadCanonicalizer canonicalizer;
  private final AuditEntrySigner signer;
  private final AuditChainVerifier chainVerifier;

  public AuditLedger(
      AuditEntryRepository auditEntryRepository,
      SubmissionRepository submissionRepository,
      AuditPayloadCanonicalizer canonicalizer,
      AuditEntrySigner signer,
      AuditChainVerifier chainVerifier) {
    this.auditEntryRepository = auditEntryRepository;
    this.submissionRepository = submissionRepository;
    this.canonicalizer = canonicalizer;
    this.signer = signer;
    this.chainVerifier = chainVerifier;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public LedgerRecord append(
      UUID submissionId,
      String actor,
      String action,
      Map<String, ?> payload,
      List<String> evidenceRefs) {
    var previous = auditEntryRepository.findTopBySubmissionIdOrderBySequenceDesc(submissionId);
    long sequence = previous.map(AuditEntry::getSequence).orElse(0L) + 1;
    String priorHash = previous.map(AuditEntry::getSignature).orElse(AuditEntrySigner.GENESIS_HASH);
    var refs = evidenceRefs == null ? List.<String>of() : List.copyOf(evidenceRefs);
    var occurredAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    var canonicalPayload = canonicalizer.canonicalize(payload);
    var keyVersion = signer.activeKeyVersion();

    var header =
        new LedgerRecord(
            null,
            submissionId,
            sequence,
            occurredAt,
            actor,
            action,
            canonicalPayload,
            refs,
            null,
            priorHash,
            null,
            keyVersion);
    var digest = signer.digest(canonicalizer.entryDocument(header));
    var signature = signer.sign(keyVersion, priorHash, digest, sequence);

    var entry =
        auditEntryRepository.save(
            new AuditEntry(
                new LedgerRecord(
                    null,
                    submissionId,
                    sequence,
                    occurredAt,
                    actor,
                    action,
                    canonicalPayload,
                    refs,
                    digest,
                    priorHash,
                    signature,
                    keyVersion)));
    log.debug(
        "Appended audit entry: submission={}, sequence={}, action={}, actor={}",
        submissionId,
        sequence,
        action,
        actor);
    return entry.toRecord();
  }

  /**
   * Entries of one submission's chain in sequence order.
   *
   * @throws ResourceNotFoundException if the submission does not exist
   */
  @Transactional(readOnly = true)
  public List<LedgerRecord> getEntries(UUID submissionId) {
    requireSubmission(submissionId);
    return loadChain(submissionId);
  }

  /**
   * The chain with each entry's verification status, from a single walk.
   *
   * @throws ResourceNotFoundException if the submission does not exist
   */
  @Transactional(readOnly = true)
  public AuditTrail getAuditTrail(UUID submissionId) {
    requireSubmission(submissionId);
    var records = loadChain(submissionId);
    return AuditTrail.of(chainVerifier.verifyChain(submissionId, records), records);
  }

  /** Recomputes digest and signature of one entry in isolation. */
  public boolean verifyEntry(LedgerRecord entry) {
    return chainVerifier.verifyEntry(entry);
  }

  /**
   * Walks the chain. A submission without entries has a valid, empty chain.
   *
   * @throws ResourceNotFoundException if the submission does not exist
   */
  @Transactional(readOnly = true)
  public ChainVerification verifyChain(UUID submissionId) {
    requireSubmission(submissionId);
    return chainVerifier.verifyChain(submissionId, loadChain(submissionId));
  }

  /**
   * Verifies the chain and fails when any entry is broken.
   *
   * @throws IntegrityViolationException carrying the first broken sequence
   */
  @Transactional(readOnly = true)
  public ChainVerification requireValidChain(UUID submissionId) {
    var verification = verifyChain(submissionId);
    if (!verification.valid()) {
      log.error(
          "Audit chain broken: submission={}, brokenAtSequence={}",
          submissionId,
          verification.brokenAtSequence());
      throw new IntegrityViolationException(
          submissionId,
          verification.brokenAtSequence(),
          "Audit chain for submission "
              + submissionId
              + " is broken at sequence "
              + verification.brokenAtSequence());
    }
    return verification;
  }

  /**
   * Verifies a single entry by id: its own digest and signature plus the link to its predecessor.
   *
   * @throws ResourceNotFoundException if no entry has this id
   * @throws IntegrityViolationException if the entry or its link does not verify
   */
  @Transactional(readOnly = true)
  public EntryVerification verifyEntryById(UUID entryId) {
    var entry =
        auditEntryRepository
            .findById(entryId)
            .map(AuditEntry::toRecord)
            .orElseThrow(() -> ResourceNotFoundException.auditEntry(entryId));

    boolean signatureValid = chainVerifier.verifyEntry(entry);
    String expectedPriorHash =
        entry.sequence() == 1
            ? AuditEntrySigner.GENESIS_HASH
            : auditEntryRepository
                .findBySubmissionIdAndSequence(entry.submissionId(), entry.sequence() - 1)
                .map(AuditEntry::getSignature)
                .orElse(null);
    boolean linkValid = AuditEntrySigner.hexEquals(expectedPriorHash, entry.priorHash());

    if (!signatureValid || !linkValid) {
      log.error(
          "Audit entry failed verification: entry={}, submission={}, sequence={},"
              + " signatureValid={}, linkValid={}",
          entryId,
          entry.submissionId(),
          entry.sequence(),
          signatureValid,
          linkValid);
      throw new IntegrityViolationException(
          entry.submissionId(),
          entry.sequence(),
          signatureValid
              ? "Audit entry " + entryId + " does not link to its predecessor"
              : "Audit entry " + entryId + " has an invalid digest or signature");
    }
    return new EntryVerification(entry.id(), entry.sequence(), true, true, true);
  }

  /** Whether an entry with this sequence exists in the submission's chain. */
  @Transactional(readOnly = true)
  public boolean hasEntry(UUID submissionId, long sequence) {
    return auditEntryRepository.findBySubmissionIdAndSequence(submissionId, sequence).isPresent();
  }

  @Transactional(readOnly = true)
  public List<LedgerRecord> getAllEntries() {
    return auditEntryRepository.findAllByOrderBySubmissionIdAscSequenceAsc().stream()
        .map(AuditEntry::toRecord)
        .toList();
  }

  /** Entries across all submissions, newest first. Every filter is optional. */
  @Transactional(readOnly = true)
  public Page<LedgerRecord> listEntries(
      UUID submissionId, String portal, String action, Pageable pageable) {
    return auditEntryRepository
        .findFiltered(submissionId, portal, action, pageable)
        .map(AuditEntry::toRecord);
  }

  private List<LedgerRecord> loadChain(UUID submissionId) {
    return auditEntryRepository.findBySubmissionIdOrderBySequenceAsc(submissionId).stream()
        .map(AuditEntry::toRecord)
        .toList();
  }

  private void requireSubmission(UUID submissionId) {
    if (!submissionRepository.existsById(submissionId)) {
      throw ResourceNotFoundException.submission(submissionId);
    }
  }
}
