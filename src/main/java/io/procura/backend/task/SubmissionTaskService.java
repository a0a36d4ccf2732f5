package io.procura.backend.task;

import io.procura.backend.audit.AuditActions;
import io.procura.backend.audit.AuditLedger;
import io.procura.backend.exception.InvalidStateException;
import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.security.Actor;
import io.procura.backend.submission.SubmissionRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Preparation checklist of a submission.
 *
 * <p>Every submission starts with the same five tasks. The owner ticks the unlocked ones while the
 * submission is a draft; once approval is requested the checklist is frozen until a withdrawal
 * returns it to DRAFT. The locked review tasks follow the approval chain: approving a step
 * completes the task linked to it, an autonomous approval completes all of them, and finalization
 * completes the final review.
 */
@Service
public class SubmissionTaskService {

  private static final Logger log = LoggerFactory.getLogger(SubmissionTaskService.class);

  private record DefaultTask(String title, String subtitle, boolean locked, String linkedStep) {}

  private static final List<DefaultTask> DEFAULT_TASKS =
      List.of(
          new DefaultTask(
              "Complete Checklist", "Review and complete all required fields", false, null),
          new DefaultTask("Upload Documents", "Attach all required documents", false, null),
          new DefaultTask("Legal Review", "Obtain legal department approval", true, "legal"),
          new DefaultTask("Finance Review", "Obtain finance department approval", true, "finance"),
          new DefaultTask(
              "Final Review", "Complete final review before submission", true, null));

  private final SubmissionTaskRepository taskRepository;
  private final SubmissionRepository submissionRepository;
  private final AuditLedger auditLedger;

  public SubmissionTaskService(
      SubmissionTaskRepository taskRepository,
      SubmissionRepository submissionRepository,
      AuditLedger auditLedger) {
    this.taskRepository = taskRepository;
    this.submissionRepository = submissionRepository;
    this.auditLedger = auditLedger;
  }

  @Transactional
  public List<SubmissionTask> createDefaultTasks(UUID submissionId) {
    var tasks = new ArrayList<SubmissionTask>();
    for (int i = 0; i < DEFAULT_TASKS.size(); i++) {
      var task = DEFAULT_TASKS.get(i);
      tasks.add(
          new SubmissionTask(
              submissionId,
              task.title(),
              task.subtitle(),
              i + 1,
              task.locked(),
              task.linkedStep()));
    }
    return taskRepository.saveAll(tasks);
  }

  @Transactional(readOnly = true)
  public List<SubmissionTask> listTasks(UUID submissionId) {
    if (!submissionRepository.existsById(submissionId)) {
      throw ResourceNotFoundException.submission(submissionId);
    }
    return taskRepository.findBySubmissionIdOrderBySortOrderAsc(submissionId);
  }

  /**
   * Ticks or unticks an owner task and records the change on the audit trail. Holds the submission
   * row lock so the toggle cannot interleave with a request for approval.
   */
  @Transactional
  public SubmissionTask updateTask(UUID submissionId, UUID taskId, boolean completed, Actor actor) {
    var submission =
        submissionRepository
            .findByIdForUpdate(submissionId)
            .orElseThrow(() -> ResourceNotFoundException.submission(submissionId));
    var task =
        taskRepository
            .findByIdAndSubmissionId(taskId, submissionId)
            .orElseThrow(() -> ResourceNotFoundException.task(submissionId, taskId));
    if (!submission.isOwnedBy(actor.id()) && !actor.isAdmin()) {
      throw new AccessDeniedException(
          "Only the owner or an admin can update tasks of submission " + submissionId);
    }
    if (task.isLocked()) {
      throw new InvalidStateException("Task locked", "This task is locked");
    }
    if (!submission.isEditable()) {
      throw new InvalidStateException(
          "Checklist frozen",
          "Tasks cannot change while the submission is in status " + submission.getStatus());
    }
    if (task.isCompleted() == completed) {
      return task;
    }

    task.setCompleted(completed, actor.id(), Instant.now());
    var payload = new LinkedHashMap<String, Object>();
    payload.put("task_id", task.getId());
    payload.put("title", task.getTitle());
    auditLedger.append(
        submissionId,
        actor.id(),
        completed ? AuditActions.TASK_COMPLETED : AuditActions.TASK_REOPENED,
        payload,
        List.of());
    log.info(
        "Task {} of submission {} set completed={} by {}",
        taskId,
        submissionId,
        completed,
        actor.id());
    return task;
  }

  /** Completes the review task linked to an approved step. Joins the caller's transaction. */
  @Transactional
  public void completeStepTask(UUID submissionId, String stepName, String actorId) {
    completeWhere(submissionId, task -> stepName.equals(task.getLinkedStep()), actorId);
  }

  /** Completes every step-linked review task, as an autonomous approval stands in for them. */
  @Transactional
  public void completeReviewTasks(UUID submissionId, String actorId) {
    completeWhere(submissionId, task -> task.isLocked() && task.getLinkedStep() != null, actorId);
  }

  @Transactional
  public void completeFinalReview(UUID submissionId, String actorId) {
    completeWhere(submissionId, SubmissionTask::isFinalReview, actorId);
  }

  private void completeWhere(UUID submissionId, Predicate<SubmissionTask> filter, String actorId) {
    var now = Instant.now();
    taskRepository.findBySubmissionIdOrderBySortOrderAsc(submissionId).stream()
        .filter(filter)
        .forEach(task -> task.completeByWorkflow(actorId, now));
  }
}
