package io.procura.backend.workflow;

import io.procura.backend.submission.ApprovalMode;
import java.util.UUID;

/** Published when a submission reaches COMPLETE. The owner is notified after commit. */
public record SubmissionCompletedEvent(UUID submissionId, String ownerId, ApprovalMode mode) {}
