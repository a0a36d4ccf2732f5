package io.procura.backend.submission;

import io.procura.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A proposal submission for a government-contract opportunity.
 *
 * <p>Status has no setter. It moves only through the transition methods below, which the workflow
 * engine calls after deciding the target from the approval chain; each transition is checked
 * against {@link SubmissionStatus#canTransitionTo}. Draft fields are editable only in DRAFT.
 */
@Entity
@Table(name = "submissions")
public class Submission {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "opportunity_id", nullable = false)
  private UUID opportunityId;

  @Column(name = "owner_id", nullable = false, length = 200)
  private String ownerId;

  @Column(name = "title", nullable = false, length = 300)
  private String title;

  @Column(name = "portal", length = 100)
  private String portal;

  @Column(name = "category", length = 100)
  private String category;

  @Column(name = "estimated_value", precision = 14, scale = 2)
  private BigDecimal estimatedValue;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private SubmissionStatus status;

  @Enumerated(EnumType.STRING)
  @Column(name = "approval_mode", length = 20)
  private ApprovalMode approvalMode;

  @Enumerated(EnumType.STRING)
  @Column(name = "approval_status", nullable = false, length = 20)
  private ApprovalStatus approvalStatus;

  @Column(name = "chain_generation", nullable = false)
  private int chainGeneration;

  @Column(name = "chain_active", nullable = false)
  private boolean chainActive;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  /** JPA-required no-arg constructor. */
  protected Submission() {}

  public Submission(UUID opportunityId, String ownerId, String title) {
    this.opportunityId = Objects.requireNonNull(opportunityId, "opportunityId must not be null");
    this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.status = SubmissionStatus.DRAFT;
    this.approvalStatus = ApprovalStatus.NOT_REQUESTED;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Transitions ---

  /**
   * Opens approval generation {@code chainGeneration + 1} and moves to PENDING_APPROVAL.
   *
   * @return the new generation number
   */
  public int startApprovalChain() {
    requireTransition(SubmissionStatus.PENDING_APPROVAL, "request approval for");
    if (chainActive) {
      throw new InvalidStateException(
          "Approval chain already active",
          "Submission " + id + " already has an active approval chain");
    }
    this.chainGeneration++;
    this.chainActive = true;
    this.status = SubmissionStatus.PENDING_APPROVAL;
    this.approvalStatus = ApprovalStatus.PENDING;
    this.updatedAt = Instant.now();
    return chainGeneration;
  }

  /** A step of the open chain was approved and at least one more is still pending. */
  public void recordStepApproved() {
    if (status != SubmissionStatus.PENDING_APPROVAL) {
      throw new InvalidStateException(
          "Invalid submission state", "Cannot approve a step of submission in status " + status);
    }
    this.approvalStatus = ApprovalStatus.IN_REVIEW;
    this.updatedAt = Instant.now();
  }

  /** Completes the submission with the given approval mode. */
  public void markComplete(ApprovalMode mode) {
    requireTransition(SubmissionStatus.COMPLETE, "complete");
    this.approvalMode = Objects.requireNonNull(mode, "mode must not be null");
    this.status = SubmissionStatus.COMPLETE;
    this.approvalStatus = ApprovalStatus.APPROVED;
    this.updatedAt = Instant.now();
  }

  public void markRejected() {
    requireTransition(SubmissionStatus.REJECTED, "reject");
    this.status = SubmissionStatus.REJECTED;
    this.approvalStatus = ApprovalStatus.REJECTED;
    this.updatedAt = Instant.now();
  }

  /** Closes the active generation and returns to DRAFT. */
  public void withdrawToDraft() {
    requireTransition(SubmissionStatus.DRAFT, "withdraw");
    this.chainActive = false;
    this.status = SubmissionStatus.DRAFT;
    this.approvalStatus = ApprovalStatus.NOT_REQUESTED;
    this.updatedAt = Instant.now();
  }

  public void markSubmitted() {
    requireTransition(SubmissionStatus.SUBMITTED, "finalize");
    this.status = SubmissionStatus.SUBMITTED;
    this.updatedAt = Instant.now();
  }

  // --- Guards ---

  public boolean isEditable() {
    return status == SubmissionStatus.DRAFT;
  }

  public boolean isOwnedBy(String actorId) {
    return ownerId.equals(actorId);
  }

  public void requireEditable() {
    if (!isEditable()) {
      throw new InvalidStateException(
          "Invalid submission state", "Cannot edit submission in status " + status);
    }
  }

  // --- Guarded setters for draft fields ---

  public void setTitle(String title) {
    requireEditable();
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.updatedAt = Instant.now();
  }

  public void setPortal(String portal) {
    requireEditable();
    this.portal = portal;
    this.updatedAt = Instant.now();
  }

  public void setCategory(String category) {
    requireEditable();
    this.category = category;
    this.updatedAt = Instant.now();
  }

  public void setEstimatedValue(BigDecimal estimatedValue) {
    requireEditable();
    this.estimatedValue = estimatedValue;
    this.updatedAt = Instant.now();
  }

  public void setDueDate(LocalDate dueDate) {
    requireEditable();
    this.dueDate = dueDate;
    this.updatedAt = Instant.now();
  }

  private void requireTransition(SubmissionStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid submission state", "Cannot " + action + " submission in status " + status);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getOpportunityId() {
    return opportunityId;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getTitle() {
    return title;
  }

  public String getPortal() {
    return portal;
  }

  public String getCategory() {
    return category;
  }

  public BigDecimal getEstimatedValue() {
    return estimatedValue;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public SubmissionStatus getStatus() {
    return status;
  }

  public ApprovalMode getApprovalMode() {
    return approvalMode;
  }

  public ApprovalStatus getApprovalStatus() {
    return approvalStatus;
  }

  public int getChainGeneration() {
    return chainGeneration;
  }

  public boolean isChainActive() {
    return chainActive;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public int getVersion() {
    return version;
  }
}
