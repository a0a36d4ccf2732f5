package io.procura.backend.approval;

import static org.assertj.core.api.Assertions.assertThat;

import io.procura.backend.TestcontainersConfiguration;
import io.procura.backend.audit.AuditActions;
import io.procura.backend.audit.AuditLedger;
import io.procura.backend.audit.LedgerRecord;
import io.procura.backend.security.Actor;
import io.procura.backend.security.Roles;
import io.procura.backend.submission.SubmissionService;
import io.procura.backend.workflow.WorkflowEngine;
import java.math.BigDecimal;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@RecordApplicationEvents
class ApprovalEscalationIntegrationTest {

  private static final Actor OWNER = Actor.of("owner-1", Roles.CONTRACT_OFFICER);

  @Autowired private SubmissionService submissionService;
  @Autowired private WorkflowEngine workflowEngine;
  @Autowired private ApprovalEscalationProcessor escalationProcessor;
  @Autowired private AuditLedger auditLedger;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private ApplicationEvents applicationEvents;

  private UUID pendingSubmission() {
    var id =
        submissionService
            .createSubmission(
                UUID.randomUUID(),
                "Cloud migration",
                "sam.gov",
                "it-services",
                new BigDecimal("75000"),
                null,
                OWNER)
            .getId();
    workflowEngine.requestApproval(id, OWNER, false);
    return id;
  }

  private void backdateActiveStep(UUID submissionId, String stepName) {
    jdbcTemplate.update(
        "UPDATE approval_steps SET due_at = now() - interval '1 hour'"
            + " WHERE submission_id = ? AND step_name = ?",
        submissionId,
        stepName);
  }

  @Test
  void overdueStepIsEscalatedOnceToNextApprover() {
    var id = pendingSubmission();
    backdateActiveStep(id, "legal");

    escalationProcessor.processOverdueSteps();
    escalationProcessor.processOverdueSteps();

    var legal = workflowEngine.getActiveChain(id).get(0);
    assertThat(legal.getStatus()).isEqualTo(ApprovalStepStatus.PENDING);
    assertThat(legal.getEscalatedTo()).isEqualTo("officer-2");
    assertThat(legal.getEscalatedAt()).isNotNull();

    var trail = auditLedger.getEntries(id);
    assertThat(trail)
        .extracting(LedgerRecord::action)
        .containsExactly(AuditActions.APPROVAL_REQUESTED, AuditActions.STEP_ESCALATED);
    assertThat(trail.get(1).actor()).isEqualTo(AuditActions.ACTOR_SLA);
    assertThat(auditLedger.verifyChain(id).valid()).isTrue();
    assertThat(
            applicationEvents.stream(ApprovalStepEscalatedEvent.class)
                .filter(e -> e.submissionId().equals(id)))
        .hasSize(1);
  }

  @Test
  void withdrawnChainIsNotEscalated() {
    var id = pendingSubmission();
    workflowEngine.withdraw(id, OWNER);
    backdateActiveStep(id, "legal");

    escalationProcessor.processOverdueSteps();

    assertThat(auditLedger.getEntries(id))
        .extracting(LedgerRecord::action)
        .doesNotContain(AuditActions.STEP_ESCALATED);
  }

  @Test
  void stepsNotYetArmedAreNotEscalated() {
    var id = pendingSubmission();

    escalationProcessor.processOverdueSteps();

    assertThat(workflowEngine.getActiveChain(id)).allMatch(s -> s.getEscalatedAt() == null);
  }
}
