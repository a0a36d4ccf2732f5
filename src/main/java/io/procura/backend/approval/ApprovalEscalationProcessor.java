package io.procura.backend.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Scheduled sweep that escalates approval steps past their SLA deadline. */
@Component
public class ApprovalEscalationProcessor {

  private static final Logger log = LoggerFactory.getLogger(ApprovalEscalationProcessor.class);

  private final ApprovalCoordinator approvalCoordinator;

  public ApprovalEscalationProcessor(ApprovalCoordinator approvalCoordinator) {
    this.approvalCoordinator = approvalCoordinator;
  }

  @Scheduled(
      fixedDelayString = "${procura.approval.escalation.interval:PT15M}",
      initialDelayString = "${procura.approval.escalation.initial-delay:PT1M}")
  public void processOverdueSteps() {
    log.debug("Approval escalation sweep started");
    int escalated = approvalCoordinator.escalateOverdueSteps();
    if (escalated > 0) {
      log.info("Approval escalation sweep completed: {} steps escalated", escalated);
    } else {
      log.debug("Approval escalation sweep completed: no overdue steps");
    }
  }
}
