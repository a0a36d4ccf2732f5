package io.procura.backend.workflow;

import io.procura.backend.approval.ApprovalCoordinator;
import io.procura.backend.approval.ApprovalStep;
import io.procura.backend.approval.ApprovalStepRepository;
import io.procura.backend.approval.ApprovalStepStatus;
import io.procura.backend.audit.AuditActions;
import io.procura.backend.audit.AuditLedger;
import io.procura.backend.audit.LedgerRecord;
import io.procura.backend.autonomy.AutonomyDecision;
import io.procura.backend.autonomy.AutonomyPolicy;
import io.procura.backend.autonomy.AutonomyPolicyEvaluator;
import io.procura.backend.autonomy.AutonomyPolicySource;
import io.procura.backend.autonomy.SubmissionSnapshot;
import io.procura.backend.exception.InvalidStateException;
import io.procura.backend.exception.PolicyViolationException;
import io.procura.backend.exception.ResourceConflictException;
import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.integration.automation.AutomationExecutor;
import io.procura.backend.integration.qualification.QualificationEngine;
import io.procura.backend.security.Actor;
import io.procura.backend.submission.ApprovalMode;
import io.procura.backend.submission.Submission;
import io.procura.backend.submission.SubmissionRepository;
import io.procura.backend.submission.SubmissionStatus;
import io.procura.backend.task.SubmissionTaskService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only mutation API for a submission's approval lifecycle.
 *
 * <p>Every mutating operation is one transaction that row-locks the submission, validates the
 * transition, applies it, and appends exactly one audit entry; the state change and its entry
 * commit or roll back together. Side effects on collaborators (notifications, portal upload) are
 * published as events and run after commit.
 *
 * <p>Error mapping: wrong status or precondition → {@link InvalidStateException}; a lost race
 * (lock timeout, step already decided) → {@link ResourceConflictException}; unknown submission or
 * step → {@link ResourceNotFoundException}; a refused autonomy override → {@link
 * PolicyViolationException}; a broken audit chain at finalization → {@code
 * IntegrityViolationException}.
 */
@Service
public class WorkflowEngine {

  private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

  private final SubmissionRepository submissionRepository;
  private final ApprovalStepRepository stepRepository;
  private final ApprovalCoordinator approvalCoordinator;
  private final AutonomyPolicyEvaluator policyEvaluator;
  private final AutonomyPolicySource policySource;
  private final QualificationEngine qualificationEngine;
  private final AutomationExecutor automationExecutor;
  private final AuditLedger auditLedger;
  private final SubmissionTaskService taskService;
  private final SuspiciousActivityRecorder suspiciousActivityRecorder;
  private final ApplicationEventPublisher eventPublisher;

  public WorkflowEngine(
      SubmissionRepository submissionRepository,
      ApprovalStepRepository stepRepository,
      ApprovalCoordinator approvalCoordinator,
      AutonomyPolicyEvaluator policyEvaluator,
      AutonomyPolicySource policySource,
      QualificationEngine qualificationEngine,
      AutomationExecutor automationExecutor,
      AuditLedger auditLedger,
      SubmissionTaskService taskService,
      SuspiciousActivityRecorder suspiciousActivityRecorder,
      ApplicationEventPublisher eventPublisher) {
    this.submissionRepository = submissionRepository;
    this.stepRepository = stepRepository;
    this.approvalCoordinator = approvalCoordinator;
    this.policyEvaluator = policyEvaluator;
    this.policySource = policySource;
    this.qualificationEngine = qualificationEngine;
    this.automationExecutor = automationExecutor;
    this.auditLedger = auditLedger;
    this.taskService = taskService;
    this.suspiciousActivityRecorder = suspiciousActivityRecorder;
    this.eventPublisher = eventPublisher;
  }

  // --- Transitions ---

  /**
   * Requests approval for a draft. Evaluates the autonomy policy once: an eligible submission
   * completes autonomously, otherwise a new approval chain generation is created.
   *
   * @param forceAutonomy demand autonomous approval; refused with {@link PolicyViolationException}
   *     when the policy does not allow it, and the refusal is recorded on the audit trail
   */
  @Transactional
  public WorkflowResult requestApproval(UUID submissionId, Actor actor, boolean forceAutonomy) {
    var submission = lockSubmission(submissionId);
    if (submission.getStatus() != SubmissionStatus.DRAFT) {
      throw new InvalidStateException(
          "Invalid submission state",
          "Cannot request approval for submission in status " + submission.getStatus());
    }
    if (submission.isChainActive()) {
      throw new InvalidStateException(
          "Approval chain already active",
          "Submission " + submissionId + " already has an active approval chain");
    }

    var snapshot =
        new SubmissionSnapshot(
            submissionId,
            submission.getEstimatedValue(),
            lookupScore(submission),
            submission.getCategory());
    var policy = policySource.currentPolicy();
    var decision = policyEvaluator.evaluate(snapshot, policy);

    if (forceAutonomy && !decision.eligible()) {
      var payload = decisionPayload(decision, snapshot, policy);
      payload.put("requested_by", actor.id());
      suspiciousActivityRecorder.record(
          submissionId, actor.id(), AuditActions.AUTONOMY_OVERRIDE_REJECTED, payload);
      log.warn(
          "Refused autonomy override: submission={}, actor={}, reason={}",
          submissionId,
          actor.id(),
          decision.reason());
      throw new PolicyViolationException(decision.reason());
    }

    var now = Instant.now();
    LedgerRecord entry;
    List<StepSummary> chain = List.of();
    if (decision.eligible()) {
      submission.markComplete(ApprovalMode.AUTONOMOUS);
      taskService.completeReviewTasks(submissionId, AuditActions.ACTOR_AUTONOMY);
      var payload = decisionPayload(decision, snapshot, policy);
      payload.put("requested_by", actor.id());
      entry =
          auditLedger.append(
              submissionId,
              AuditActions.ACTOR_AUTONOMY,
              AuditActions.AUTONOMY_APPROVED,
              payload,
              List.of());
      eventPublisher.publishEvent(
          new SubmissionCompletedEvent(
              submissionId, submission.getOwnerId(), ApprovalMode.AUTONOMOUS));
      log.info("Submission {} approved autonomously: {}", submissionId, decision.reason());
    } else {
      int generation = submission.startApprovalChain();
      var steps = approvalCoordinator.createChain(submission, generation, now);
      chain = steps.stream().map(StepSummary::from).toList();
      boolean nothingPending = ApprovalCoordinator.nextPending(steps).isEmpty();
      if (nothingPending) {
        submission.markComplete(ApprovalMode.MANUAL);
        eventPublisher.publishEvent(
            new SubmissionCompletedEvent(
                submissionId, submission.getOwnerId(), ApprovalMode.MANUAL));
      }
      var payload = decisionPayload(decision, snapshot, policy);
      payload.put("generation", generation);
      payload.put("chain", steps.stream().map(WorkflowEngine::stepPayload).toList());
      entry =
          auditLedger.append(
              submissionId, actor.id(), AuditActions.APPROVAL_REQUESTED, payload, List.of());
      log.info(
          "Approval requested: submission={}, generation={}, status={}, autonomyReason={}",
          submissionId,
          generation,
          submission.getStatus(),
          decision.reason());
    }
    return WorkflowResult.of(submission, decision.reason(), chain, null, entry.sequence());
  }

  /** Approves the actionable step. Completes the submission when no pending step remains. */
  @Transactional
  public WorkflowResult approveStep(
      UUID submissionId, String stepName, Actor actor, String notes) {
    var submission = lockSubmission(submissionId);
    requireDecidable(submission, stepName, "approve");
    var steps = activeChain(submission);
    var step = requireActionableStep(submission, steps, stepName, actor);

    var now = Instant.now();
    step.approve(actor.id(), notes, now);
    taskService.completeStepTask(submissionId, stepName, actor.id());
    var next = approvalCoordinator.activateNext(steps, now);
    if (next.isPresent()) {
      submission.recordStepApproved();
    } else {
      submission.markComplete(ApprovalMode.MANUAL);
      eventPublisher.publishEvent(
          new SubmissionCompletedEvent(
              submissionId, submission.getOwnerId(), ApprovalMode.MANUAL));
    }

    var payload = stepPayload(step);
    payload.put("generation", step.getGeneration());
    payload.put("notes", notes);
    payload.put("next_step", next.map(ApprovalStep::getStepName).orElse(null));
    payload.put("submission_status", submission.getStatus());
    var entry =
        auditLedger.append(
            submissionId, actor.id(), AuditActions.STEP_APPROVED, payload, List.of());
    log.info(
        "Approval step approved: submission={}, step={}, actor={}, status={}",
        submissionId,
        stepName,
        actor.id(),
        submission.getStatus());
    return WorkflowResult.of(
        submission, null, List.of(), StepSummary.from(step), entry.sequence());
  }

  /** Rejects the actionable step and, with it, the submission. Rejection is terminal. */
  @Transactional
  public WorkflowResult rejectStep(
      UUID submissionId, String stepName, Actor actor, String reason) {
    var submission = lockSubmission(submissionId);
    if (submission.getStatus() == SubmissionStatus.REJECTED) {
      throw new InvalidStateException(
          "Invalid submission state", "Submission " + submissionId + " is already rejected");
    }
    requireDecidable(submission, stepName, "reject");
    var steps = activeChain(submission);
    var step = requireActionableStep(submission, steps, stepName, actor);
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException("Reason required", "A rejection reason is required");
    }

    step.reject(actor.id(), reason, Instant.now());
    submission.markRejected();
    eventPublisher.publishEvent(
        new SubmissionRejectedEvent(submissionId, submission.getOwnerId(), stepName));

    var payload = stepPayload(step);
    payload.put("generation", step.getGeneration());
    payload.put("reason", reason);
    var entry =
        auditLedger.append(
            submissionId, actor.id(), AuditActions.STEP_REJECTED, payload, List.of());
    log.info(
        "Approval step rejected: submission={}, step={}, actor={}",
        submissionId,
        stepName,
        actor.id());
    return WorkflowResult.of(
        submission, null, List.of(), StepSummary.from(step), entry.sequence());
  }

  /**
   * Withdraws a pending submission back to DRAFT, closing its chain generation. Only the owner or
   * an admin may withdraw, and only before any step was decided.
   */
  @Transactional
  public WorkflowResult withdraw(UUID submissionId, Actor actor) {
    var submission = lockSubmission(submissionId);
    if (submission.getStatus() != SubmissionStatus.PENDING_APPROVAL) {
      throw new InvalidStateException(
          "Invalid submission state",
          "Cannot withdraw submission in status " + submission.getStatus());
    }
    if (!submission.isOwnedBy(actor.id()) && !actor.isAdmin()) {
      throw new InvalidStateException(
          "Not allowed to withdraw", "Only the owner or an admin can withdraw " + submissionId);
    }
    var steps = activeChain(submission);
    var decided = steps.stream().filter(s -> s.getStatus().isDecided()).findFirst();
    if (decided.isPresent()) {
      throw new InvalidStateException(
          "Cannot withdraw",
          "Step '" + decided.get().getStepName() + "' has already been decided");
    }

    int generation = submission.getChainGeneration();
    submission.withdrawToDraft();
    var payload = new LinkedHashMap<String, Object>();
    payload.put("generation", generation);
    payload.put("closed_steps", steps.stream().map(ApprovalStep::getStepName).toList());
    var entry =
        auditLedger.append(submissionId, actor.id(), AuditActions.WITHDRAWN, payload, List.of());
    log.info(
        "Submission withdrawn: submission={}, generation={}, actor={}",
        submissionId,
        generation,
        actor.id());
    return WorkflowResult.of(submission, null, entry.sequence());
  }

  /**
   * Finalizes a completed submission. A dry run only previews the result and verifies the audit
   * chain. A real run requires an intact chain, moves the submission to SUBMITTED and hands it to
   * the automation executor after commit.
   */
  @Transactional
  public FinalizeResult finalizeSubmission(UUID submissionId, Actor actor, boolean dryRun) {
    if (dryRun) {
      var submission = findSubmission(submissionId);
      requireComplete(submission);
      return new FinalizeResult(
          true,
          submissionId,
          submission.getStatus(),
          SubmissionStatus.SUBMITTED,
          submission.getApprovalMode(),
          chainSummary(submission),
          auditLedger.verifyChain(submissionId),
          null);
    }

    var submission = lockSubmission(submissionId);
    requireComplete(submission);
    var verification = auditLedger.requireValidChain(submissionId);
    submission.markSubmitted();
    taskService.completeFinalReview(submissionId, actor.id());

    var payload = new LinkedHashMap<String, Object>();
    payload.put("approval_mode", submission.getApprovalMode());
    payload.put("generation", submission.getChainGeneration());
    payload.put("portal", submission.getPortal());
    payload.put("verified_entries", verification.entries().size());
    var entry =
        auditLedger.append(submissionId, actor.id(), AuditActions.FINALIZED, payload, List.of());
    eventPublisher.publishEvent(new SubmissionFinalizedEvent(submissionId));
    log.info("Submission finalized: submission={}, actor={}", submissionId, actor.id());
    return new FinalizeResult(
        false,
        submissionId,
        submission.getStatus(),
        SubmissionStatus.SUBMITTED,
        submission.getApprovalMode(),
        chainSummary(submission),
        verification,
        entry.sequence());
  }

  /**
   * Records a follow-up fact about the portal upload of a submitted submission. Never changes
   * status.
   *
   * <p>Transaction semantics: REQUIRES_NEW, since it is called after the finalize transaction has
   * committed.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public LedgerRecord recordAutomationOutcome(
      UUID submissionId,
      String runId,
      AutomationOutcome outcome,
      List<String> evidenceRefs,
      String detail) {
    var submission = lockSubmission(submissionId);
    if (submission.getStatus() != SubmissionStatus.SUBMITTED) {
      throw new InvalidStateException(
          "Invalid submission state",
          "Automation outcomes can only be recorded for submitted submissions, not "
              + submission.getStatus());
    }
    var refs = new ArrayList<String>();
    if (runId != null) {
      refs.add(runId);
    }
    if (evidenceRefs != null) {
      evidenceRefs.stream().filter(ref -> !refs.contains(ref)).forEach(refs::add);
    }
    var payload = new LinkedHashMap<String, Object>();
    payload.put("run_id", runId);
    payload.put("provider", automationExecutor.providerId());
    payload.put("outcome", outcome);
    payload.put("detail", detail);
    var entry =
        auditLedger.append(
            submissionId, AuditActions.ACTOR_AUTOMATION, outcome.action(), payload, refs);
    if (outcome == AutomationOutcome.TRIGGER_FAILED || outcome == AutomationOutcome.FAILED) {
      log.warn(
          "Automation outcome recorded: submission={}, run={}, outcome={}, detail={}",
          submissionId,
          runId,
          outcome,
          detail);
    } else {
      log.info(
          "Automation outcome recorded: submission={}, run={}, outcome={}",
          submissionId,
          runId,
          outcome);
    }
    return entry;
  }

  /**
   * Appends a compensating {@code audit.correction} entry that references an earlier entry of the
   * same chain. Existing entries are never modified.
   */
  @Transactional
  public LedgerRecord recordCorrection(
      UUID submissionId, long correctsSequence, Actor actor, String reason) {
    if (!actor.isAdmin()) {
      throw new AccessDeniedException("Only admins can record audit corrections");
    }
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException("Reason required", "A correction reason is required");
    }
    var submission = lockSubmission(submissionId);
    if (!auditLedger.hasEntry(submissionId, correctsSequence)) {
      throw ResourceNotFoundException.auditSequence(submissionId, correctsSequence);
    }
    var payload = new LinkedHashMap<String, Object>();
    payload.put("corrects_sequence", correctsSequence);
    payload.put("reason", reason);
    payload.put("submission_status", submission.getStatus());
    var entry =
        auditLedger.append(submissionId, actor.id(), AuditActions.CORRECTION, payload, List.of());
    log.info(
        "Audit correction recorded: submission={}, correctsSequence={}, actor={}",
        submissionId,
        correctsSequence,
        actor.id());
    return entry;
  }

  // --- Reads ---

  @Transactional(readOnly = true)
  public Submission getSubmission(UUID submissionId) {
    return findSubmission(submissionId);
  }

  /** Steps of the open chain generation; empty when no chain is active. */
  @Transactional(readOnly = true)
  public List<ApprovalStep> getActiveChain(UUID submissionId) {
    return activeChain(findSubmission(submissionId));
  }

  /** Steps of every generation, oldest generation first. */
  @Transactional(readOnly = true)
  public List<ApprovalStep> getChainHistory(UUID submissionId) {
    findSubmission(submissionId);
    return stepRepository.findBySubmissionIdOrderByGenerationAscStepOrderAsc(submissionId);
  }

  // --- Private helpers ---

  private Submission findSubmission(UUID submissionId) {
    return submissionRepository
        .findById(submissionId)
        .orElseThrow(() -> ResourceNotFoundException.submission(submissionId));
  }

  private Submission lockSubmission(UUID submissionId) {
    try {
      return submissionRepository
          .findByIdForUpdate(submissionId)
          .orElseThrow(() -> ResourceNotFoundException.submission(submissionId));
    } catch (PessimisticLockingFailureException e) {
      log.warn("Timed out waiting for lock on submission {}", submissionId);
      throw new ResourceConflictException(
          "Submission busy",
          "Submission " + submissionId + " is being modified concurrently; retry the request");
    }
  }

  private List<ApprovalStep> activeChain(Submission submission) {
    if (!submission.isChainActive()) {
      return List.of();
    }
    return stepRepository.findBySubmissionIdAndGenerationOrderByStepOrderAsc(
        submission.getId(), submission.getChainGeneration());
  }

  /**
   * Status precondition shared by approve and reject. A COMPLETE submission whose named step was
   * already decided means the caller lost the race to the final decision.
   */
  private void requireDecidable(Submission submission, String stepName, String action) {
    if (submission.getStatus() == SubmissionStatus.PENDING_APPROVAL) {
      return;
    }
    if (submission.getStatus() == SubmissionStatus.COMPLETE
        && activeChain(submission).stream()
            .anyMatch(s -> s.getStepName().equals(stepName) && s.getStatus().isDecided())) {
      throw new ResourceConflictException(
          "Step already decided",
          "Step '" + stepName + "' was already decided and the submission is complete");
    }
    throw new InvalidStateException(
        "Invalid submission state",
        "Cannot " + action + " a step of a submission in status " + submission.getStatus());
  }

  private ApprovalStep requireActionableStep(
      Submission submission, List<ApprovalStep> steps, String stepName, Actor actor) {
    var step =
        steps.stream()
            .filter(s -> s.getStepName().equals(stepName))
            .findFirst()
            .orElseThrow(
                () -> ResourceNotFoundException.approvalStep(submission.getId(), stepName));
    if (step.getStatus().isDecided()) {
      throw new ResourceConflictException(
          "Step already decided",
          "Step '"
              + stepName
              + "' was already "
              + step.getStatus().name().toLowerCase(Locale.ROOT));
    }
    if (step.getStatus() == ApprovalStepStatus.SKIPPED) {
      throw new InvalidStateException(
          "Step skipped", "Step '" + stepName + "' is not required for this submission");
    }
    var actionable = ApprovalCoordinator.nextPending(steps).orElse(null);
    if (actionable != step) {
      throw new InvalidStateException(
          "Step not actionable",
          "Step '"
              + stepName
              + "' cannot be decided before step '"
              + (actionable != null ? actionable.getStepName() : "?")
              + "'");
    }
    if (!actor.canActAs(step.getApproverRole())) {
      throw new InvalidStateException(
          "Approver role required",
          "Step '" + stepName + "' requires role " + step.getApproverRole());
    }
    return step;
  }

  private void requireComplete(Submission submission) {
    if (submission.getStatus() != SubmissionStatus.COMPLETE) {
      throw new InvalidStateException(
          "Invalid submission state",
          "Cannot finalize submission in status " + submission.getStatus());
    }
  }

  /** Qualification lookup failures count as "no score", which keeps the submission manual. */
  private BigDecimal lookupScore(Submission submission) {
    try {
      return qualificationEngine.getScore(submission.getOpportunityId()).orElse(null);
    } catch (RuntimeException e) {
      log.warn(
          "Qualification lookup failed for opportunity {}; treating as unscored",
          submission.getOpportunityId(),
          e);
      return null;
    }
  }

  private List<StepSummary> chainSummary(Submission submission) {
    return activeChain(submission).stream().map(StepSummary::from).toList();
  }

  private Map<String, Object> decisionPayload(
      AutonomyDecision decision, SubmissionSnapshot snapshot, AutonomyPolicy policy) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("autonomy_reason", decision.reason());
    payload.put("autonomy_eligible", decision.eligible());
    payload.put("estimated_value", snapshot.estimatedValue());
    payload.put("qualification_score", snapshot.qualificationScore());
    payload.put("qualification_provider", qualificationEngine.providerId());
    payload.put("category", snapshot.category());
    payload.put("policy_enabled", policy.enabled());
    payload.put("policy_threshold_usd", policy.thresholdUsd());
    payload.put("policy_min_score", policy.minScore());
    payload.put(
        "policy_excluded_categories", policy.excludedCategories().stream().sorted().toList());
    return payload;
  }

  private static Map<String, Object> stepPayload(ApprovalStep step) {
    var payload = new LinkedHashMap<String, Object>();
    payload.put("step_name", step.getStepName());
    payload.put("step_order", step.getStepOrder());
    payload.put("approver_role", step.getApproverRole());
    payload.put("assigned_approver", step.getAssignedApproverId());
    payload.put("status", step.getStatus());
    return payload;
  }
}
