package io.procura.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.procura.backend.TestcontainersConfiguration;
import io.procura.backend.exception.IntegrityViolationException;
import io.procura.backend.security.Actor;
import io.procura.backend.security.Roles;
import io.procura.backend.submission.SubmissionService;
import io.procura.backend.workflow.AutomationOutcome;
import io.procura.backend.workflow.WorkflowEngine;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuditLedgerIntegrationTest {

  private static final Actor OWNER = Actor.of("owner-1", Roles.CONTRACT_OFFICER);
  private static final Actor OFFICER = Actor.of("officer-1", Roles.CONTRACT_OFFICER);

  @Autowired private SubmissionService submissionService;
  @Autowired private WorkflowEngine workflowEngine;
  @Autowired private AuditLedger auditLedger;
  @Autowired private JdbcTemplate jdbcTemplate;
  @Autowired private TransactionTemplate transactionTemplate;

  private UUID completedSubmission() {
    var submission =
        submissionService.createSubmission(
            UUID.randomUUID(),
            "Data centre refresh",
            "sam.gov",
            "it-services",
            new BigDecimal("120000.50"),
            null,
            OWNER);
    var id = submission.getId();
    workflowEngine.requestApproval(id, OWNER, false);
    workflowEngine.approveStep(id, "legal", OFFICER, "ok");
    workflowEngine.approveStep(id, "finance", OFFICER, "ok");
    return id;
  }

  @Test
  void appendOutsideTransactionIsRejected() {
    assertThatThrownBy(
            () ->
                auditLedger.append(
                    UUID.randomUUID(), "alice", AuditActions.CORRECTION, null, List.of()))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void persistedChainVerifiesAfterReload() {
    var id = completedSubmission();

    var trail = auditLedger.getEntries(id);

    assertThat(trail).extracting(LedgerRecord::sequence).containsExactly(1L, 2L, 3L);
    assertThat(trail.get(0).payload()).contains("\"estimated_value\":120000.5");
    assertThat(auditLedger.verifyChain(id).valid()).isTrue();
  }

  @Test
  void evidenceReferencesSurviveStorage() {
    var id = completedSubmission();
    workflowEngine.finalizeSubmission(id, OWNER, false);

    var entry =
        workflowEngine.recordAutomationOutcome(
            id, "run-5", AutomationOutcome.FAILED, List.of("log-1", "log-2"), "portal timeout");

    var reloaded =
        auditLedger.getEntries(id).stream()
            .filter(e -> e.sequence() == entry.sequence())
            .findFirst()
            .orElseThrow();
    assertThat(reloaded.evidenceRefs()).containsExactly("run-5", "log-1", "log-2");
    assertThat(auditLedger.verifyEntry(reloaded)).isTrue();
  }

  @Test
  void databaseRejectsUpdateDeleteAndTruncate() {
    var id = completedSubmission();

    assertThatThrownBy(
            () ->
                jdbcTemplate.update(
                    "UPDATE audit_entries SET actor = 'mallory' WHERE submission_id = ?", id))
        .isInstanceOf(DataAccessException.class)
        .hasMessageContaining("append-only");
    assertThatThrownBy(
            () -> jdbcTemplate.update("DELETE FROM audit_entries WHERE submission_id = ?", id))
        .isInstanceOf(DataAccessException.class);
    assertThatThrownBy(() -> jdbcTemplate.execute("TRUNCATE audit_entries"))
        .isInstanceOf(DataAccessException.class);

    assertThat(auditLedger.getEntries(id)).hasSize(3);
  }

  @Test
  void directEditIsDetectedAndBlocksFinalization() {
    var id = completedSubmission();
    transactionTemplate.executeWithoutResult(
        tx -> {
          jdbcTemplate.execute(
              "ALTER TABLE audit_entries DISABLE TRIGGER audit_entries_no_update_delete");
          jdbcTemplate.update(
              "UPDATE audit_entries SET payload = '{}' WHERE submission_id = ? AND sequence = 2",
              id);
          jdbcTemplate.execute(
              "ALTER TABLE audit_entries ENABLE TRIGGER audit_entries_no_update_delete");
        });

    var verification = auditLedger.verifyChain(id);
    assertThat(verification.valid()).isFalse();
    assertThat(verification.brokenAtSequence()).isEqualTo(2L);

    assertThatThrownBy(() -> workflowEngine.finalizeSubmission(id, OWNER, false))
        .isInstanceOf(IntegrityViolationException.class);
    assertThat(workflowEngine.getSubmission(id).getStatus().name()).isEqualTo("COMPLETE");
    assertThat(auditLedger.getEntries(id)).hasSize(3);
  }
}
