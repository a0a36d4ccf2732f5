package io.procura.backend.task;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SubmissionTaskRepository extends JpaRepository<SubmissionTask, UUID> {

  List<SubmissionTask> findBySubmissionIdOrderBySortOrderAsc(UUID submissionId);

  Optional<SubmissionTask> findByIdAndSubmissionId(UUID id, UUID submissionId);
}
