package io.procura.backend.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * One signed fact in a submission's audit chain, persisted to the {@code audit_entries} table.
 * Entries are append-only: the entity is {@link Immutable}, {@link AuditEntryRepository} exposes no
 * delete, and a database trigger rejects UPDATE/DELETE/TRUNCATE on the table. No setters.
 *
 * @see LedgerRecord
 */
@Entity
@Immutable
@Table(name = "audit_entries")
public class AuditEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "submission_id", nullable = false, updatable = false)
  private UUID submissionId;

  @Column(name = "sequence", nullable = false, updatable = false)
  private long sequence;

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  @Column(name = "actor", nullable = false, updatable = false, length = 200)
  private String actor;

  @Column(name = "action", nullable = false, updatable = false, length = 100)
  private String action;

  @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "text")
  private String payload;

  @Column(name = "evidence_refs", nullable = false, updatable = false, columnDefinition = "text[]")
  private String[] evidenceRefs;

  @Column(name = "digest", nullable = false, updatable = false, length = 64)
  private String digest;

  @Column(name = "prior_hash", nullable = false, updatable = false, length = 64)
  private String priorHash;

  @Column(name = "signature", nullable = false, updatable = false, length = 64)
  private String signature;

  @Column(name = "key_version", nullable = false, updatable = false, length = 40)
  private String keyVersion;

  /** Protected no-arg constructor required by JPA. */
  protected AuditEntry() {}

  AuditEntry(LedgerRecord record) {
    this.submissionId = record.submissionId();
    this.sequence = record.sequence();
    this.occurredAt = record.occurredAt();
    this.actor = record.actor();
    this.action = record.action();
    this.payload = record.payload();
    this.evidenceRefs = record.evidenceRefs().toArray(new String[0]);
    this.digest = record.digest();
    this.priorHash = record.priorHash();
    this.signature = record.signature();
    this.keyVersion = record.keyVersion();
  }

  /** Detached value copy used by verification and export. */
  public LedgerRecord toRecord() {
    return new LedgerRecord(
        id,
        submissionId,
        sequence,
        occurredAt,
        actor,
        action,
        payload,
        getEvidenceRefs(),
        digest,
        priorHash,
        signature,
        keyVersion);
  }

  public UUID getId() {
    return id;
  }

  public UUID getSubmissionId() {
    return submissionId;
  }

  public long getSequence() {
    return sequence;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }

  public String getActor() {
    return actor;
  }

  public String getAction() {
    return action;
  }

  public String getPayload() {
    return payload;
  }

  public List<String> getEvidenceRefs() {
    return evidenceRefs == null ? List.of() : List.copyOf(Arrays.asList(evidenceRefs));
  }

  public String getDigest() {
    return digest;
  }

  public String getPriorHash() {
    return priorHash;
  }

  public String getSignature() {
    return signature;
  }

  public String getKeyVersion() {
    return keyVersion;
  }
}
