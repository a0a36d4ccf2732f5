package io.procura.backend.task;

import io.procura.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One item of a submission's preparation checklist. Unlocked items are ticked by the owner while
 * the submission is a draft; locked items mirror approval progress and are completed only by the
 * workflow.
 */
@Entity
@Table(name = "submission_tasks")
public class SubmissionTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "submission_id", nullable = false)
  private UUID submissionId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "subtitle", length = 300)
  private String subtitle;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "locked", nullable = false)
  private boolean locked;

  /** Approval step whose approval completes this task; null for owner tasks and final review. */
  @Column(name = "linked_step", length = 100)
  private String linkedStep;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  @Column(name = "completed_by", length = 200)
  private String completedBy;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SubmissionTask() {}

  public SubmissionTask(
      UUID submissionId,
      String title,
      String subtitle,
      int sortOrder,
      boolean locked,
      String linkedStep) {
    this.submissionId = Objects.requireNonNull(submissionId, "submissionId must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.subtitle = subtitle;
    this.sortOrder = sortOrder;
    this.locked = locked;
    this.linkedStep = linkedStep;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Owner toggle. Locked tasks refuse it. */
  public void setCompleted(boolean completed, String actorId, Instant now) {
    if (locked) {
      throw new InvalidStateException("Task locked", "This task is locked");
    }
    if (completed) {
      markDone(actorId, now);
    } else {
      this.completed = false;
      this.completedBy = null;
      this.completedAt = null;
      this.updatedAt = now;
    }
  }

  /** Workflow completion; applies to locked tasks too. Already completed tasks keep their data. */
  public void completeByWorkflow(String actorId, Instant now) {
    if (!completed) {
      markDone(actorId, now);
    }
  }

  private void markDone(String actorId, Instant now) {
    this.completed = true;
    this.completedBy = Objects.requireNonNull(actorId, "actorId must not be null");
    this.completedAt = now;
    this.updatedAt = now;
  }

  public boolean isFinalReview() {
    return locked && linkedStep == null;
  }

  // Getters
  public UUID getId() {
    return id;
  }

  public UUID getSubmissionId() {
    return submissionId;
  }

  public String getTitle() {
    return title;
  }

  public String getSubtitle() {
    return subtitle;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public boolean isLocked() {
    return locked;
  }

  public String getLinkedStep() {
    return linkedStep;
  }

  public boolean isCompleted() {
    return completed;
  }

  public String getCompletedBy() {
    return completedBy;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
