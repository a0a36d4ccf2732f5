package io.procura.backend.approval;

import io.procura.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One step of a submission's approval chain. A chain is the ordered set of steps sharing a
 * {@code (submissionId, generation)}; withdrawing closes a generation and the next request opens a
 * new one. Steps are never deleted.
 */
@Entity
@Table(name = "approval_steps")
public class ApprovalStep {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "submission_id", nullable = false, updatable = false)
  private UUID submissionId;

  @Column(name = "generation", nullable = false, updatable = false)
  private int generation;

  @Column(name = "step_name", nullable = false, updatable = false, length = 100)
  private String stepName;

  @Column(name = "step_order", nullable = false, updatable = false)
  private int stepOrder;

  @Column(name = "approver_role", nullable = false, updatable = false, length = 50)
  private String approverRole;

  @Column(name = "assigned_approver_id", length = 200)
  private String assignedApproverId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ApprovalStepStatus status;

  @Column(name = "decided_by_id", length = 200)
  private String decidedById;

  @Column(name = "decided_at")
  private Instant decidedAt;

  @Column(name = "notes", columnDefinition = "text")
  private String notes;

  @Column(name = "sla_seconds", nullable = false, updatable = false)
  private long slaSeconds;

  @Column(name = "due_at")
  private Instant dueAt;

  @Column(name = "escalated_at")
  private Instant escalatedAt;

  @Column(name = "escalated_to", length = 200)
  private String escalatedTo;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  /** JPA-required no-arg constructor. */
  protected ApprovalStep() {}

  public ApprovalStep(
      UUID submissionId,
      int generation,
      String stepName,
      int stepOrder,
      String approverRole,
      String assignedApproverId,
      Duration sla,
      boolean skipped) {
    this.submissionId = Objects.requireNonNull(submissionId, "submissionId must not be null");
    this.generation = generation;
    this.stepName = Objects.requireNonNull(stepName, "stepName must not be null");
    this.stepOrder = stepOrder;
    this.approverRole = Objects.requireNonNull(approverRole, "approverRole must not be null");
    this.assignedApproverId = assignedApproverId;
    this.slaSeconds = Objects.requireNonNull(sla, "sla must not be null").toSeconds();
    this.status = skipped ? ApprovalStepStatus.SKIPPED : ApprovalStepStatus.PENDING;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  // --- Lifecycle methods ---

  /** Starts the SLA timer once the step is actionable. Re-arming keeps the first deadline. */
  public void arm(Instant now) {
    if (status == ApprovalStepStatus.PENDING && dueAt == null) {
      this.dueAt = now.plusSeconds(slaSeconds);
    }
  }

  public void approve(String deciderId, String notes, Instant now) {
    decide(ApprovalStepStatus.APPROVED, deciderId, notes, now);
  }

  public void reject(String deciderId, String reason, Instant now) {
    decide(ApprovalStepStatus.REJECTED, deciderId, reason, now);
  }

  /** Records an SLA escalation. Does not change the step's status. */
  public void markEscalated(String escalatedTo, Instant now) {
    if (status != ApprovalStepStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid approval step state", "Cannot escalate step " + stepName + " in " + status);
    }
    this.escalatedTo = escalatedTo;
    this.escalatedAt = now;
  }

  public boolean isPending() {
    return status == ApprovalStepStatus.PENDING;
  }

  public boolean isOverdue(Instant now) {
    return isPending() && escalatedAt == null && dueAt != null && dueAt.isBefore(now);
  }

  private void decide(ApprovalStepStatus target, String deciderId, String notes, Instant now) {
    if (status != ApprovalStepStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid approval step state",
          "Cannot decide step " + stepName + " in status " + status);
    }
    this.status = target;
    this.decidedById = Objects.requireNonNull(deciderId, "deciderId must not be null");
    this.decidedAt = now;
    this.notes = notes;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getSubmissionId() {
    return submissionId;
  }

  public int getGeneration() {
    return generation;
  }

  public String getStepName() {
    return stepName;
  }

  public int getStepOrder() {
    return stepOrder;
  }

  public String getApproverRole() {
    return approverRole;
  }

  public String getAssignedApproverId() {
    return assignedApproverId;
  }

  public ApprovalStepStatus getStatus() {
    return status;
  }

  public String getDecidedById() {
    return decidedById;
  }

  public Instant getDecidedAt() {
    return decidedAt;
  }

  public String getNotes() {
    return notes;
  }

  public Duration getSla() {
    return Duration.ofSeconds(slaSeconds);
  }

  public Instant getDueAt() {
    return dueAt;
  }

  public Instant getEscalatedAt() {
    return escalatedAt;
  }

  public String getEscalatedTo() {
    return escalatedTo;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public int getVersion() {
    return version;
  }
}
