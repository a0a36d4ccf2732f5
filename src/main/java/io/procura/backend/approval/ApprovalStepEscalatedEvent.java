package io.procura.backend.approval;

import java.util.UUID;

/** Published when an overdue step is escalated. Consumed after commit to notify the target. */
public record ApprovalStepEscalatedEvent(UUID submissionId, String stepName, String escalatedTo) {}
