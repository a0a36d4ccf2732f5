package io.procura.backend.submission;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

  /**
   * Loads and row-locks a submission for the rest of the transaction. Waits at most three seconds
   * for a competing lock; a timeout surfaces as a {@code PessimisticLockingFailureException}.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
  @Query("SELECT s FROM Submission s WHERE s.id = :id")
  Optional<Submission> findByIdForUpdate(@Param("id") UUID id);

  @Query(
      """
      SELECT s FROM Submission s
      WHERE (:status IS NULL OR s.status = :status)
        AND (:ownerId IS NULL OR s.ownerId = :ownerId)
        AND (:approvalStatus IS NULL OR s.approvalStatus = :approvalStatus)
      ORDER BY s.createdAt DESC
      """)
  Page<Submission> findFiltered(
      @Param("status") SubmissionStatus status,
      @Param("ownerId") String ownerId,
      @Param("approvalStatus") ApprovalStatus approvalStatus,
      Pageable pageable);
}
