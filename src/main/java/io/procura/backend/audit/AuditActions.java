package io.procura.backend.audit;

/** Action names and system actors written to the audit ledger. */
public final class AuditActions {

  public static final String APPROVAL_REQUESTED = "submission.approval_requested";
  public static final String AUTONOMY_APPROVED = "submission.autonomy_approved";
  public static final String AUTONOMY_OVERRIDE_REJECTED = "autonomy.override_rejected";
  public static final String STEP_APPROVED = "approval_step.approved";
  public static final String STEP_REJECTED = "approval_step.rejected";
  public static final String STEP_ESCALATED = "approval_step.escalated";
  public static final String WITHDRAWN = "submission.withdrawn";
  public static final String FINALIZED = "submission.finalized";
  public static final String CORRECTION = "audit.correction";
  public static final String TASK_COMPLETED = "task.completed";
  public static final String TASK_REOPENED = "task.reopened";

  public static final String ACTOR_AUTONOMY = "system:autonomy";
  public static final String ACTOR_SLA = "system:sla";
  public static final String ACTOR_AUTOMATION = "system:automation";

  private AuditActions() {}
}
