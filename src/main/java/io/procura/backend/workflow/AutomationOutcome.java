package io.procura.backend.workflow;

/** Follow-up facts about the portal upload run started by finalization. */
public enum AutomationOutcome {
  TRIGGERED("automation.triggered"),
  TRIGGER_FAILED("automation.trigger_failed"),
  COMPLETED("automation.completed"),
  FAILED("automation.failed");

  private final String action;

  AutomationOutcome(String action) {
    this.action = action;
  }

  /** Audit action recorded for this outcome. */
  public String action() {
    return action;
  }

  /** Outcomes the automation service reports back through its callback. */
  public boolean isReportedByRun() {
    return this == COMPLETED || this == FAILED;
  }
}
