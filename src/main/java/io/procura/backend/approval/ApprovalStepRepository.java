package io.procura.backend.approval;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApprovalStepRepository extends JpaRepository<ApprovalStep, UUID> {

  List<ApprovalStep> findBySubmissionIdAndGenerationOrderByStepOrderAsc(
      UUID submissionId, int generation);

  List<ApprovalStep> findBySubmissionIdOrderByGenerationAscStepOrderAsc(UUID submissionId);

  /** Pending, not yet escalated steps of active chains whose SLA deadline has passed. */
  @Query(
      """
      SELECT s.id FROM ApprovalStep s, Submission sub
      WHERE sub.id = s.submissionId
        AND sub.chainActive = true
        AND sub.chainGeneration = s.generation
        AND s.status = io.procura.backend.approval.ApprovalStepStatus.PENDING
        AND s.escalatedAt IS NULL
        AND s.dueAt < :now
      ORDER BY s.dueAt ASC
      """)
  List<UUID> findOverdueStepIds(@Param("now") Instant now);
}
