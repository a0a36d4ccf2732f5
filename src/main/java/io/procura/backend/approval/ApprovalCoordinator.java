package io.procura.backend.approval;

import io.procura.backend.audit.AuditActions;
import io.procura.backend.audit.AuditLedger;
import io.procura.backend.submission.Submission;
import io.procura.backend.submission.SubmissionRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Builds approval chains from the configured template, arms SLA deadlines as steps become
 * actionable, and escalates overdue steps.
 *
 * <p>Chain creation and activation run inside the workflow engine's transaction. The escalation
 * sweep opens one transaction per step so that a failure on one step leaves the others unaffected.
 */
@Service
@EnableConfigurationProperties(ApprovalChainProperties.class)
public class ApprovalCoordinator {

  private static final Logger log = LoggerFactory.getLogger(ApprovalCoordinator.class);

  private final ApprovalChainProperties properties;
  private final ApproverDirectory approverDirectory;
  private final ApprovalStepRepository stepRepository;
  private final SubmissionRepository submissionRepository;
  private final AuditLedger auditLedger;
  private final ApplicationEventPublisher eventPublisher;
  private final TransactionTemplate transactionTemplate;

  public ApprovalCoordinator(
      ApprovalChainProperties properties,
      ApproverDirectory approverDirectory,
      ApprovalStepRepository stepRepository,
      SubmissionRepository submissionRepository,
      AuditLedger auditLedger,
      ApplicationEventPublisher eventPublisher,
      TransactionTemplate transactionTemplate) {
    this.properties = properties;
    this.approverDirectory = approverDirectory;
    this.stepRepository = stepRepository;
    this.submissionRepository = submissionRepository;
    this.auditLedger = auditLedger;
    this.eventPublisher = eventPublisher;
    this.transactionTemplate = transactionTemplate;
  }

  /**
   * Creates the full ordered step set of a new generation. Conditional steps that do not apply to
   * the submission's value are created SKIPPED; the first pending step is armed.
   */
  public List<ApprovalStep> createChain(Submission submission, int generation, Instant now) {
    var steps = new ArrayList<ApprovalStep>();
    int order = 1;
    for (var template : properties.chain()) {
      boolean skipped = !template.appliesTo(submission.getEstimatedValue());
      String assignee =
          skipped
              ? null
              : approverDirectory.approversFor(template.role()).stream().findFirst().orElse(null);
      steps.add(
          new ApprovalStep(
              submission.getId(),
              generation,
              template.name(),
              order++,
              template.role(),
              assignee,
              template.sla(),
              skipped));
    }
    activateNext(steps, now);
    var saved = stepRepository.saveAll(steps);
    log.info(
        "Created approval chain: submission={}, generation={}, steps={}",
        submission.getId(),
        generation,
        saved.stream().map(s -> s.getStepName() + ":" + s.getStatus()).toList());
    return saved;
  }

  /**
   * Arms the lowest-order pending step, if any, and announces it to its approver.
   *
   * @return the now-actionable step, or empty when the chain has no pending step left
   */
  public Optional<ApprovalStep> activateNext(List<ApprovalStep> steps, Instant now) {
    var next = nextPending(steps);
    next.ifPresent(
        step -> {
          step.arm(now);
          eventPublisher.publishEvent(
              new ApprovalStepActivatedEvent(
                  step.getSubmissionId(), step.getStepName(), step.getAssignedApproverId()));
        });
    return next;
  }

  /** The lowest-order PENDING step of a chain. */
  public static Optional<ApprovalStep> nextPending(List<ApprovalStep> steps) {
    return steps.stream()
        .filter(ApprovalStep::isPending)
        .min(Comparator.comparingInt(ApprovalStep::getStepOrder));
  }

  /**
   * Escalates every overdue, not yet escalated pending step of an active chain.
   *
   * @return the number of steps escalated
   */
  public int escalateOverdueSteps() {
    var now = Instant.now();
    var overdue = stepRepository.findOverdueStepIds(now);
    int escalated = 0;
    for (var stepId : overdue) {
      try {
        Boolean done = transactionTemplate.execute(status -> escalateStep(stepId, now));
        if (Boolean.TRUE.equals(done)) {
          escalated++;
        }
      } catch (RuntimeException e) {
        log.error("Escalation failed for approval step {}", stepId, e);
      }
    }
    return escalated;
  }

  private boolean escalateStep(UUID stepId, Instant now) {
    var step = stepRepository.findById(stepId).orElse(null);
    if (step == null) {
      return false;
    }
    var submission = submissionRepository.findByIdForUpdate(step.getSubmissionId()).orElse(null);
    if (submission == null
        || !submission.isChainActive()
        || submission.getChainGeneration() != step.getGeneration()
        || !step.isOverdue(now)) {
      log.debug("Skipping escalation of step {}: no longer overdue on an active chain", stepId);
      return false;
    }

    var target = escalationTarget(step);
    step.markEscalated(target, now);

    var payload = new LinkedHashMap<String, Object>();
    payload.put("step_name", step.getStepName());
    payload.put("generation", step.getGeneration());
    payload.put("approver_role", step.getApproverRole());
    payload.put("assigned_approver", step.getAssignedApproverId());
    payload.put("due_at", step.getDueAt());
    payload.put("escalated_to", target);
    auditLedger.append(
        submission.getId(),
        AuditActions.ACTOR_SLA,
        AuditActions.STEP_ESCALATED,
        payload,
        List.of());

    eventPublisher.publishEvent(
        new ApprovalStepEscalatedEvent(submission.getId(), step.getStepName(), target));
    log.warn(
        "Escalated overdue approval step: submission={}, step={}, dueAt={}, escalatedTo={}",
        submission.getId(),
        step.getStepName(),
        step.getDueAt(),
        target);
    return true;
  }

  /**
   * Next person in line for the step's role after the assigned approver, falling back to the
   * escalation contact.
   */
  String escalationTarget(ApprovalStep step) {
    var approvers = approverDirectory.approversFor(step.getApproverRole());
    if (step.getAssignedApproverId() == null && !approvers.isEmpty()) {
      return approvers.get(0);
    }
    int index = approvers.indexOf(step.getAssignedApproverId());
    if (index >= 0 && index + 1 < approvers.size()) {
      return approvers.get(index + 1);
    }
    return approverDirectory.escalationContact().orElse(null);
  }
}
