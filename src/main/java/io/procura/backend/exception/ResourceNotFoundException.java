package io.procura.backend.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A referenced submission, approval step, checklist task or audit entry does not exist. The
 * problem body names the resource type and the identifier that was looked up.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final String resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId, String detail) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, resourceId, detail), null);
    this.resourceType = resourceType;
    this.resourceId = String.valueOf(resourceId);
  }

  public static ResourceNotFoundException submission(UUID submissionId) {
    return new ResourceNotFoundException(
        "Submission", submissionId, "Submission " + submissionId + " does not exist");
  }

  public static ResourceNotFoundException approvalStep(UUID submissionId, String stepName) {
    return new ResourceNotFoundException(
        "Approval step",
        stepName,
        "No step '" + stepName + "' in the active chain of submission " + submissionId);
  }

  public static ResourceNotFoundException auditEntry(UUID entryId) {
    return new ResourceNotFoundException(
        "Audit entry", entryId, "Audit entry " + entryId + " does not exist");
  }

  public static ResourceNotFoundException auditSequence(UUID submissionId, long sequence) {
    return new ResourceNotFoundException(
        "Audit entry",
        sequence,
        "Submission " + submissionId + " has no audit entry with sequence " + sequence);
  }

  public static ResourceNotFoundException task(UUID submissionId, UUID taskId) {
    return new ResourceNotFoundException(
        "Task", taskId, "Submission " + submissionId + " has no task " + taskId);
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }

  private static ProblemDetail createProblem(
      String resourceType, Object resourceId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail(detail);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", String.valueOf(resourceId));
    return problem;
  }
}
