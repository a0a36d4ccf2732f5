package io.procura.backend.workflow;

import java.util.UUID;

/** Published when a step rejection rejects the submission. The owner is notified after commit. */
public record SubmissionRejectedEvent(UUID submissionId, String ownerId, String stepName) {}
