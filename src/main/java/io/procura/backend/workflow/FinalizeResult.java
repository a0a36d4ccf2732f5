package io.procura.backend.workflow;

import io.procura.backend.audit.ChainVerification;
import io.procura.backend.submission.ApprovalMode;
import io.procura.backend.submission.SubmissionStatus;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of {@link WorkflowEngine#finalizeSubmission}. A dry run carries the preview (target
 * status, chain summary, ledger verification) and no audit sequence; a real run carries the
 * sequence of the {@code submission.finalized} entry.
 */
public record FinalizeResult(
    boolean dryRun,
    UUID submissionId,
    SubmissionStatus status,
    SubmissionStatus targetStatus,
    ApprovalMode approvalMode,
    List<StepSummary> chain,
    ChainVerification ledger,
    Long auditSequence) {}
