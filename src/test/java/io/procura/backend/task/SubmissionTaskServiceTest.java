package io.procura.backend.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import io.procura.backend.audit.AuditActions;
import io.procura.backend.audit.AuditLedger;
import io.procura.backend.audit.AuditTestSupport;
import io.procura.backend.audit.InMemoryAuditEntryRepository;
import io.procura.backend.audit.LedgerRecord;
import io.procura.backend.exception.InvalidStateException;
import io.procura.backend.exception.ResourceNotFoundException;
import io.procura.backend.security.Actor;
import io.procura.backend.security.Roles;
import io.procura.backend.submission.Submission;
import io.procura.backend.submission.SubmissionRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class SubmissionTaskServiceTest {

  private static final Actor OWNER = Actor.of("owner-1", Roles.CONTRACT_OFFICER);
  private static final Actor OTHER = Actor.of("owner-2", Roles.CONTRACT_OFFICER);
  private static final Actor ADMIN = Actor.of("admin-1", Roles.ADMIN);

  @Mock private SubmissionTaskRepository taskRepository;
  @Mock private SubmissionRepository submissionRepository;

  private final List<SubmissionTask> tasks = new ArrayList<>();
  private AuditLedger auditLedger;
  private SubmissionTaskService service;
  private Submission submission;

  @BeforeEach
  void setUp() {
    auditLedger = AuditTestSupport.ledger(new InMemoryAuditEntryRepository());
    service = new SubmissionTaskService(taskRepository, submissionRepository, auditLedger);

    submission = new Submission(UUID.randomUUID(), OWNER.id(), "Network upgrade");
    ReflectionTestUtils.setField(submission, "id", UUID.randomUUID());

    lenient()
        .when(taskRepository.saveAll(anyList()))
        .thenAnswer(
            inv -> {
              List<SubmissionTask> saved = inv.getArgument(0);
              saved.forEach(t -> ReflectionTestUtils.setField(t, "id", UUID.randomUUID()));
              tasks.addAll(saved);
              return saved;
            });
    lenient()
        .when(taskRepository.findBySubmissionIdOrderBySortOrderAsc(any()))
        .thenAnswer(inv -> List.copyOf(tasks));
    lenient()
        .when(taskRepository.findByIdAndSubmissionId(any(), any()))
        .thenAnswer(
            inv -> tasks.stream().filter(t -> t.getId().equals(inv.getArgument(0))).findFirst());
    lenient()
        .when(submissionRepository.findByIdForUpdate(submission.getId()))
        .thenReturn(Optional.of(submission));
    service.createDefaultTasks(submission.getId());
  }

  private SubmissionTask task(String title) {
    return tasks.stream().filter(t -> t.getTitle().equals(title)).findFirst().orElseThrow();
  }

  @Test
  void createDefaultTasks_ownerTasksFirstThenLockedReviews() {
    assertThat(tasks)
        .extracting(
            SubmissionTask::getTitle,
            SubmissionTask::getSortOrder,
            SubmissionTask::isLocked,
            SubmissionTask::getLinkedStep)
        .containsExactly(
            tuple("Complete Checklist", 1, false, null),
            tuple("Upload Documents", 2, false, null),
            tuple("Legal Review", 3, true, "legal"),
            tuple("Finance Review", 4, true, "finance"),
            tuple("Final Review", 5, true, null));
    assertThat(tasks).noneMatch(SubmissionTask::isCompleted);
  }

  @Test
  void updateTask_ownerCompletesAndReopensDraftTask() {
    var checklist = task("Complete Checklist");

    var completed = service.updateTask(submission.getId(), checklist.getId(), true, OWNER);

    assertThat(completed.isCompleted()).isTrue();
    assertThat(completed.getCompletedBy()).isEqualTo("owner-1");
    assertThat(completed.getCompletedAt()).isNotNull();

    var reopened = service.updateTask(submission.getId(), checklist.getId(), false, ADMIN);

    assertThat(reopened.isCompleted()).isFalse();
    assertThat(reopened.getCompletedBy()).isNull();
    assertThat(reopened.getCompletedAt()).isNull();
    assertThat(auditLedger.getEntries(submission.getId()))
        .extracting(LedgerRecord::action, LedgerRecord::actor)
        .containsExactly(
            tuple(AuditActions.TASK_COMPLETED, "owner-1"),
            tuple(AuditActions.TASK_REOPENED, "admin-1"));
  }

  @Test
  void updateTask_unchangedValueWritesNothing() {
    var upload = task("Upload Documents");

    service.updateTask(submission.getId(), upload.getId(), false, OWNER);

    assertThat(auditLedger.getEntries(submission.getId())).isEmpty();
  }

  @Test
  void updateTask_lockedTaskIsRejected() {
    var legal = task("Legal Review");

    assertThatThrownBy(() -> service.updateTask(submission.getId(), legal.getId(), true, OWNER))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Task locked"));
    assertThat(legal.isCompleted()).isFalse();
  }

  @Test
  void updateTask_frozenWhileApprovalPending() {
    submission.startApprovalChain();
    var checklist = task("Complete Checklist");

    assertThatThrownBy(
            () -> service.updateTask(submission.getId(), checklist.getId(), true, OWNER))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            e -> assertThat(e.getBody().getTitle()).isEqualTo("Checklist frozen"));
    assertThat(checklist.isCompleted()).isFalse();
    assertThat(auditLedger.getEntries(submission.getId())).isEmpty();
  }

  @Test
  void updateTask_editableAgainAfterWithdrawal() {
    submission.startApprovalChain();
    submission.withdrawToDraft();
    var checklist = task("Complete Checklist");

    assertThat(service.updateTask(submission.getId(), checklist.getId(), true, OWNER).isCompleted())
        .isTrue();
  }

  @Test
  void updateTask_onlyOwnerOrAdmin() {
    var checklist = task("Complete Checklist");

    assertThatThrownBy(
            () -> service.updateTask(submission.getId(), checklist.getId(), true, OTHER))
        .isInstanceOf(AccessDeniedException.class);
  }

  @Test
  void updateTask_unknownTaskOrSubmissionIsNotFound() {
    var unknownSubmission = UUID.randomUUID();
    when(submissionRepository.findByIdForUpdate(unknownSubmission)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.updateTask(submission.getId(), UUID.randomUUID(), true, OWNER))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> assertThat(e.getResourceType()).isEqualTo("Task"));
    assertThatThrownBy(
            () -> service.updateTask(unknownSubmission, task("Final Review").getId(), true, OWNER))
        .isInstanceOfSatisfying(
            ResourceNotFoundException.class,
            e -> assertThat(e.getResourceType()).isEqualTo("Submission"));
  }

  @Test
  void workflowCompletesLockedReviewTasks() {
    service.completeStepTask(submission.getId(), "legal", "officer-1");

    assertThat(task("Legal Review").isCompleted()).isTrue();
    assertThat(task("Legal Review").getCompletedBy()).isEqualTo("officer-1");
    assertThat(task("Finance Review").isCompleted()).isFalse();

    service.completeReviewTasks(submission.getId(), AuditActions.ACTOR_AUTONOMY);

    assertThat(task("Legal Review").getCompletedBy()).isEqualTo("officer-1");
    assertThat(task("Finance Review").getCompletedBy()).isEqualTo(AuditActions.ACTOR_AUTONOMY);
    assertThat(task("Final Review").isCompleted()).isFalse();
    assertThat(task("Complete Checklist").isCompleted()).isFalse();

    service.completeFinalReview(submission.getId(), "owner-1");

    assertThat(task("Final Review").isCompleted()).isTrue();
  }

  @Test
  void listTasks_unknownSubmissionIsNotFound() {
    var unknown = UUID.randomUUID();
    when(submissionRepository.existsById(unknown)).thenReturn(false);

    assertThatThrownBy(() -> service.listTasks(unknown))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
