package io.procura.backend.workflow;

import io.procura.backend.approval.ApprovalNotifier;
import io.procura.backend.approval.ApprovalStepActivatedEvent;
import io.procura.backend.approval.ApprovalStepEscalatedEvent;
import io.procura.backend.integration.notification.NotificationKind;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Post-commit side effects of workflow transitions: approver and owner notifications, and the
 * portal upload hand-off after finalization. Runs only once the transition has committed; a
 * failure here is logged (and, for automation, recorded on the audit trail) but never undoes the
 * transition.
 */
@Component
public class WorkflowEventHandler {

  private static final Logger log = LoggerFactory.getLogger(WorkflowEventHandler.class);

  private final ApprovalNotifier approvalNotifier;
  private final AutomationLauncher automationLauncher;
  private final WorkflowEngine workflowEngine;

  public WorkflowEventHandler(
      ApprovalNotifier approvalNotifier,
      AutomationLauncher automationLauncher,
      WorkflowEngine workflowEngine) {
    this.approvalNotifier = approvalNotifier;
    this.automationLauncher = automationLauncher;
    this.workflowEngine = workflowEngine;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStepActivated(ApprovalStepActivatedEvent event) {
    notifySafely(
        event.submissionId(),
        event.stepName(),
        event.approverId(),
        NotificationKind.APPROVAL_REQUESTED);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onStepEscalated(ApprovalStepEscalatedEvent event) {
    notifySafely(
        event.submissionId(), event.stepName(), event.escalatedTo(), NotificationKind.ESCALATED);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onSubmissionRejected(SubmissionRejectedEvent event) {
    notifySafely(
        event.submissionId(), event.stepName(), event.ownerId(), NotificationKind.REJECTED);
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onSubmissionCompleted(SubmissionCompletedEvent event) {
    notifySafely(event.submissionId(), null, event.ownerId(), NotificationKind.COMPLETED);
  }

  /** Runs on the workflow executor so the finalize request does not wait on upload retries. */
  @Async(WorkflowAsyncConfig.EXECUTOR)
  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onSubmissionFinalized(SubmissionFinalizedEvent event) {
    String runId;
    try {
      runId = automationLauncher.launch(event.submissionId());
    } catch (RuntimeException e) {
      log.error("Failed to trigger portal upload for submission {}", event.submissionId(), e);
      recordOutcome(event.submissionId(), null, AutomationOutcome.TRIGGER_FAILED, e.getMessage());
      return;
    }
    recordOutcome(event.submissionId(), runId, AutomationOutcome.TRIGGERED, null);
  }

  private void recordOutcome(
      UUID submissionId, String runId, AutomationOutcome outcome, String detail) {
    try {
      workflowEngine.recordAutomationOutcome(submissionId, runId, outcome, List.of(), detail);
    } catch (RuntimeException e) {
      log.error(
          "Failed to record automation outcome {} for submission {} (run {})",
          outcome,
          submissionId,
          runId,
          e);
    }
  }

  private void notifySafely(
      UUID submissionId, String stepName, String recipientId, NotificationKind kind) {
    if (recipientId == null) {
      log.warn(
          "No recipient for {} notification: submission={}, step={}",
          kind,
          submissionId,
          stepName);
      return;
    }
    try {
      approvalNotifier.notify(submissionId, stepName, recipientId, kind);
    } catch (RuntimeException e) {
      log.error(
          "Failed to send {} notification to {} for submission {}",
          kind,
          recipientId,
          submissionId,
          e);
    }
  }
}
