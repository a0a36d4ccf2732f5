package io.procura.backend.submission;

import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.security.Actor;
import io.procura.backend.task.SubmissionTaskService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Submission workspace: creating and editing drafts. Status changes are not made here; they go
 * through the workflow engine.
 */
@Service
public class SubmissionService {

  private static final Logger log = LoggerFactory.getLogger(SubmissionService.class);

  private final SubmissionRepository submissionRepository;
  private final SubmissionTaskService taskService;

  public SubmissionService(
      SubmissionRepository submissionRepository, SubmissionTaskService taskService) {
    this.submissionRepository = submissionRepository;
    this.taskService = taskService;
  }

  @Transactional
  public Submission createSubmission(
      UUID opportunityId,
      String title,
      String portal,
      String category,
      BigDecimal estimatedValue,
      LocalDate dueDate,
      Actor actor) {
    var submission = new Submission(opportunityId, actor.id(), title);
    submission.setPortal(portal);
    submission.setCategory(category);
    submission.setEstimatedValue(estimatedValue);
    submission.setDueDate(dueDate);
    submission = submissionRepository.save(submission);
    taskService.createDefaultTasks(submission.getId());
    log.info(
        "Created submission {} for opportunity {} (owner {})",
        submission.getId(),
        opportunityId,
        actor.id());
    return submission;
  }

  /** Lists submissions. Non-admins only ever see their own, whatever owner filter they pass. */
  @Transactional(readOnly = true)
  public Page<Submission> listSubmissions(
      SubmissionStatus status,
      String ownerId,
      ApprovalStatus approvalStatus,
      Actor actor,
      Pageable pageable) {
    String effectiveOwner = actor.isAdmin() ? ownerId : actor.id();
    return submissionRepository.findFiltered(status, effectiveOwner, approvalStatus, pageable);
  }

  @Transactional(readOnly = true)
  public Submission getSubmission(UUID id) {
    return submissionRepository
        .findById(id)
        .orElseThrow(() -> ResourceNotFoundException.submission(id));
  }

  /** Updates draft fields. Null arguments leave the field unchanged. */
  @Transactional
  public Submission updateSubmission(
      UUID id,
      String title,
      String portal,
      String category,
      BigDecimal estimatedValue,
      LocalDate dueDate,
      Actor actor) {
    var submission = getSubmission(id);
    if (!submission.isOwnedBy(actor.id()) && !actor.isAdmin()) {
      throw new AccessDeniedException("Only the owner or an admin can edit submission " + id);
    }
    submission.requireEditable();
    if (title != null) {
      submission.setTitle(title);
    }
    if (portal != null) {
      submission.setPortal(portal);
    }
    if (category != null) {
      submission.setCategory(category);
    }
    if (estimatedValue != null) {
      submission.setEstimatedValue(estimatedValue);
    }
    if (dueDate != null) {
      submission.setDueDate(dueDate);
    }
    log.info("Updated draft submission {} by {}", id, actor.id());
    return submissionRepository.save(submission);
  }
}
