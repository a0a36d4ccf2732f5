package io.procura.backend.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.procura.backend.exception.IntegrityViolationException;
import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.submission.SubmissionRepository;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.domain.PageRequest;

class AuditLedgerTest {

  private InMemoryAuditEntryRepository repository;
  private AuditLedger ledger;
  private UUID submissionId;

  @BeforeEach
  void setUp() {
    repository = new InMemoryAuditEntryRepository();
    ledger = AuditTestSupport.ledger(repository);
    submissionId = UUID.randomUUID();
  }

  private void appendThree() {
    ledger.append(submissionId, "alice", AuditActions.APPROVAL_REQUESTED, Map.of(), null);
    ledger.append(
        submissionId, "legal-1", AuditActions.STEP_APPROVED, Map.of("step_name", "legal"), null);
    ledger.append(
        submissionId,
        "finance-1",
        AuditActions.STEP_APPROVED,
        Map.of("step_name", "finance"),
        List.of("receipt-1"));
  }

  @Test
  void append_startsChainAtGenesis() {
    var first = ledger.append(submissionId, "alice", AuditActions.APPROVAL_REQUESTED, null, null);

    assertThat(first.id()).isNotNull();
    assertThat(first.sequence()).isEqualTo(1);
    assertThat(first.priorHash()).isEqualTo(AuditEntrySigner.GENESIS_HASH);
    assertThat(first.payload()).isEqualTo("{}");
    assertThat(first.evidenceRefs()).isEmpty();
    assertThat(first.keyVersion()).isEqualTo("v1");
    assertThat(ledger.verifyEntry(first)).isTrue();
  }

  @Test
  void append_linksEachEntryToItsPredecessorSignature() {
    appendThree();

    var trail = ledger.getEntries(submissionId);
    assertThat(trail).extracting(LedgerRecord::sequence).containsExactly(1L, 2L, 3L);
    assertThat(trail.get(1).priorHash()).isEqualTo(trail.get(0).signature());
    assertThat(trail.get(2).priorHash()).isEqualTo(trail.get(1).signature());
    assertThat(trail.get(2).evidenceRefs()).containsExactly("receipt-1");
  }

  @Test
  void append_keepsChainsOfDifferentSubmissionsIndependent() {
    var other = UUID.randomUUID();
    appendThree();

    var first = ledger.append(other, "bob", AuditActions.APPROVAL_REQUESTED, Map.of(), null);

    assertThat(first.sequence()).isEqualTo(1);
    assertThat(first.priorHash()).isEqualTo(AuditEntrySigner.GENESIS_HASH);
    assertThat(ledger.verifyChain(other).valid()).isTrue();
    assertThat(ledger.getAllEntries()).hasSize(4);
  }

  @Test
  void verifyChain_validForUntouchedChain() {
    appendThree();

    var verification = ledger.verifyChain(submissionId);

    assertThat(verification.valid()).isTrue();
    assertThat(verification.brokenAtSequence()).isNull();
    assertThat(verification.entries()).allMatch(EntryVerification::verified);
  }

  @Test
  void verifyChain_emptyChainIsValid() {
    var verification = ledger.verifyChain(submissionId);

    assertThat(verification.valid()).isTrue();
    assertThat(verification.entries()).isEmpty();
  }

  @Test
  void verifyChain_detectsEditedPayloadAndFailsEverythingAfterIt() {
    appendThree();
    repository.tamper(submissionId, 2, r -> withPayload(r, "{\"step_name\":\"executive\"}"));

    var verification = ledger.verifyChain(submissionId);

    assertThat(verification.valid()).isFalse();
    assertThat(verification.brokenAtSequence()).isEqualTo(2L);
    assertThat(verification.entries())
        .extracting(EntryVerification::verified)
        .containsExactly(true, false, false);
    assertThat(verification.entries().get(1).signatureValid()).isFalse();
    assertThat(verification.entries().get(2).signatureValid()).isTrue();
  }

  @Test
  void getAuditTrail_marksTamperedEntryAndEverythingAfterItUnverified() {
    appendThree();
    repository.tamper(submissionId, 2, r -> withPayload(r, "{\"step_name\":\"executive\"}"));

    var trail = ledger.getAuditTrail(submissionId);

    assertThat(trail.submissionId()).isEqualTo(submissionId);
    assertThat(trail.valid()).isFalse();
    assertThat(trail.brokenAtSequence()).isEqualTo(2L);
    assertThat(trail.entries())
        .extracting(e -> e.entry().sequence(), e -> e.verification().verified())
        .containsExactly(tuple(1L, true), tuple(2L, false), tuple(3L, false));
    assertThat(trail.entries().get(1).entry().payload()).contains("executive");
  }

  @Test
  void getAuditTrail_allEntriesVerifiedForIntactChain() {
    appendThree();

    var trail = ledger.getAuditTrail(submissionId);

    assertThat(trail.valid()).isTrue();
    assertThat(trail.brokenAtSequence()).isNull();
    assertThat(trail.entries()).hasSize(3).allMatch(e -> e.verification().verified());
  }

  @Test
  void readsThrowNotFoundForUnknownSubmission() {
    var submissions = Mockito.mock(SubmissionRepository.class);
    var unknown = UUID.randomUUID();
    Mockito.when(submissions.existsById(unknown)).thenReturn(false);
    var scoped = AuditTestSupport.ledger(repository, AuditTestSupport.signer(), submissions);

    assertThatThrownBy(() -> scoped.verifyChain(unknown))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> {
              assertThat(e.getResourceType()).isEqualTo("Submission");
              assertThat(e.getResourceId()).isEqualTo(unknown.toString());
            });
    assertThatThrownBy(() -> scoped.getAuditTrail(unknown))
        .isInstanceOf(ResourceNotFoundException.class);
    assertThatThrownBy(() -> scoped.getEntries(unknown))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void verifyChain_detectsRewrittenKeyVersion() {
    appendThree();
    // key version relabelled; v2 key then fails the stored signature
    repository.tamper(
        submissionId,
        2,
        r ->
            new LedgerRecord(
                r.id(),
                r.submissionId(),
                r.sequence(),
                r.occurredAt(),
                r.actor(),
                r.action(),
                r.payload(),
                r.evidenceRefs(),
                r.digest(),
                r.priorHash(),
                r.signature(),
                "v2"));

    assertThat(ledger.verifyChain(submissionId).brokenAtSequence()).isEqualTo(2L);
  }

  @Test
  void listEntries_filtersBySubmissionAndActionNewestFirst() {
    appendThree();
    var other = UUID.randomUUID();
    ledger.append(other, "bob", AuditActions.APPROVAL_REQUESTED, Map.of(), null);

    var approvals =
        ledger.listEntries(submissionId, null, AuditActions.STEP_APPROVED, PageRequest.of(0, 10));
    var all = ledger.listEntries(null, null, null, PageRequest.of(0, 2));

    assertThat(approvals.getContent())
        .extracting(LedgerRecord::sequence)
        .containsExactlyInAnyOrder(3L, 2L);
    assertThat(all.getTotalElements()).isEqualTo(4);
    assertThat(all.getContent()).hasSize(2);
  }

  @Test
  void verifyChain_detectsRewrittenActor() {
    appendThree();
    // actor rewritten, digest and signature left as stored
    repository.tamper(
        submissionId,
        1,
        r ->
            new LedgerRecord(
                r.id(),
                r.submissionId(),
                r.sequence(),
                r.occurredAt(),
                "mallory",
                r.action(),
                r.payload(),
                r.evidenceRefs(),
                r.digest(),
                r.priorHash(),
                r.signature(),
                r.keyVersion()));

    var verification = ledger.verifyChain(submissionId);

    assertThat(verification.brokenAtSequence()).isEqualTo(1L);
  }

  @Test
  void verifyChain_detectsDeletedEntry() {
    appendThree();
    repository.delete(submissionId, 2);

    var verification = ledger.verifyChain(submissionId);

    assertThat(verification.valid()).isFalse();
    assertThat(verification.brokenAtSequence()).isEqualTo(2L);
    assertThat(verification.entries().get(1).linkValid()).isFalse();
  }

  @Test
  void verifyChain_acceptsEntriesSignedWithRetiredKeyVersion() {
    ledger.append(submissionId, "alice", AuditActions.APPROVAL_REQUESTED, Map.of(), null);
    var rotated = AuditTestSupport.ledger(repository, AuditTestSupport.signer("v2"));

    var second = rotated.append(submissionId, "legal-1", AuditActions.STEP_APPROVED, null, null);

    assertThat(second.keyVersion()).isEqualTo("v2");
    assertThat(rotated.verifyChain(submissionId).valid()).isTrue();
  }

  @Test
  void requireValidChain_throwsWithBrokenSequence() {
    appendThree();
    repository.tamper(submissionId, 3, r -> withPayload(r, "{}"));

    assertThatThrownBy(() -> ledger.requireValidChain(submissionId))
        .isInstanceOfSatisfying(
            IntegrityViolationException.class,
            e -> {
              assertThat(e.getSubmissionId()).isEqualTo(submissionId);
              assertThat(e.getBrokenAtSequence()).isEqualTo(3L);
            });
  }

  @Test
  void verifyEntryById_returnsVerificationForIntactEntry() {
    appendThree();
    var second = ledger.getEntries(submissionId).get(1);

    var result = ledger.verifyEntryById(second.id());

    assertThat(result.verified()).isTrue();
    assertThat(result.sequence()).isEqualTo(2);
  }

  @Test
  void verifyEntryById_throwsForTamperedEntry() {
    appendThree();
    repository.tamper(submissionId, 2, r -> withPayload(r, "{\"x\":1}"));
    var second = ledger.getEntries(submissionId).get(1);

    assertThatThrownBy(() -> ledger.verifyEntryById(second.id()))
        .isInstanceOf(IntegrityViolationException.class)
        .hasMessageContaining("invalid digest or signature");
  }

  @Test
  void verifyEntryById_throwsWhenPredecessorMissing() {
    appendThree();
    repository.delete(submissionId, 2);
    var third = ledger.getEntries(submissionId).get(1);

    assertThatThrownBy(() -> ledger.verifyEntryById(third.id()))
        .isInstanceOf(IntegrityViolationException.class)
        .hasMessageContaining("does not link");
  }

  @Test
  void verifyEntryById_throwsWhenUnknown() {
    assertThatThrownBy(() -> ledger.verifyEntryById(UUID.randomUUID()))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void hasEntry_reportsExistingSequences() {
    appendThree();

    assertThat(ledger.hasEntry(submissionId, 3)).isTrue();
    assertThat(ledger.hasEntry(submissionId, 4)).isFalse();
  }

  static LedgerRecord withPayload(LedgerRecord r, String payload) {
    return new LedgerRecord(
        r.id(),
        r.submissionId(),
        r.sequence(),
        r.occurredAt(),
        r.actor(),
        r.action(),
        payload,
        r.evidenceRefs(),
        r.digest(),
        r.priorHash(),
        r.signature(),
        r.keyVersion());
  }
}
