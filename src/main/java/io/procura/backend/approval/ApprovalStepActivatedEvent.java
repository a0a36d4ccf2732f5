package io.procura.backend.approval;

import java.util.UUID;

/**
 * Published when a step becomes the actionable step of its chain. Consumed after commit to notify
 * the assigned approver.
 */
public record ApprovalStepActivatedEvent(UUID submissionId, String stepName, String approverId) {}
