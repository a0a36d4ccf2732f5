package io.procura.backend.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Append-only access to {@link AuditEntry}. Extends the bare {@link Repository} marker rather than
 * {@code JpaRepository} so that no update or delete method exists on the contract.
 */
public interface AuditEntryRepository extends Repository<AuditEntry, UUID> {

  AuditEntry save(AuditEntry entry);

  Optional<AuditEntry> findById(UUID id);

  Optional<AuditEntry> findTopBySubmissionIdOrderBySequenceDesc(UUID submissionId);

  Optional<AuditEntry> findBySubmissionIdAndSequence(UUID submissionId, long sequence);

  List<AuditEntry> findBySubmissionIdOrderBySequenceAsc(UUID submissionId);

  List<AuditEntry> findAllByOrderBySubmissionIdAscSequenceAsc();

  /** Entries across submissions, newest first. A null filter matches everything. */
  @Query(
      value =
          """
          SELECT e FROM AuditEntry e
          WHERE (:submissionId IS NULL OR e.submissionId = :submissionId)
            AND (:action IS NULL OR e.action = :action)
            AND (:portal IS NULL OR e.submissionId IN
                  (SELECT s.id FROM Submission s WHERE s.portal = :portal))
          ORDER BY e.occurredAt DESC, e.sequence DESC
          """,
      countQuery =
          """
          SELECT COUNT(e) FROM AuditEntry e
          WHERE (:submissionId IS NULL OR e.submissionId = :submissionId)
            AND (:action IS NULL OR e.action = :action)
            AND (:portal IS NULL OR e.submissionId IN
                  (SELECT s.id FROM Submission s WHERE s.portal = :portal))
          """)
  Page<AuditEntry> findFiltered(
      @Param("submissionId") UUID submissionId,
      @Param("portal") String portal,
      @Param("action") String action,
      Pageable pageable);
}
