package io.procura.backend.workflow;

import java.util.UUID;

/** Published when a submission is finalized. Triggers the portal upload run after commit. */
public record SubmissionFinalizedEvent(UUID submissionId) {}
