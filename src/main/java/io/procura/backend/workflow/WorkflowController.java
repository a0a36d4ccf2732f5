package io.procura.backend.workflow;

import io.procura.backend.approval.ApprovalStep;
import io.procura.backend.approval.ApprovalStepStatus;
import io.procura.backend.audit.LedgerRecord;
import io.procura.backend.exception.InvalidStateException;
import io.procura.backend.security.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WorkflowController {

  private final WorkflowEngine workflowEngine;

  public WorkflowController(WorkflowEngine workflowEngine) {
    this.workflowEngine = workflowEngine;
  }

  @PostMapping("/api/submissions/{id}/request-approval")
  public ResponseEntity<WorkflowResult> requestApproval(
      @PathVariable UUID id, @RequestBody(required = false) RequestApprovalRequest request) {
    boolean forceAutonomy = request != null && request.forceAutonomy();
    return ResponseEntity.ok(workflowEngine.requestApproval(id, Actor.current(), forceAutonomy));
  }

  @PostMapping("/api/submissions/{id}/steps/{stepName}/approve")
  @PreAuthorize("hasAnyRole('CONTRACT_OFFICER', 'ADMIN')")
  public ResponseEntity<WorkflowResult> approveStep(
      @PathVariable UUID id,
      @PathVariable String stepName,
      @Valid @RequestBody(required = false) ApproveStepRequest request) {
    String notes = request != null ? request.notes() : null;
    return ResponseEntity.ok(workflowEngine.approveStep(id, stepName, Actor.current(), notes));
  }

  @PostMapping("/api/submissions/{id}/steps/{stepName}/reject")
  @PreAuthorize("hasAnyRole('CONTRACT_OFFICER', 'ADMIN')")
  public ResponseEntity<WorkflowResult> rejectStep(
      @PathVariable UUID id,
      @PathVariable String stepName,
      @Valid @RequestBody RejectStepRequest request) {
    return ResponseEntity.ok(
        workflowEngine.rejectStep(id, stepName, Actor.current(), request.reason()));
  }

  @PostMapping("/api/submissions/{id}/withdraw")
  public ResponseEntity<WorkflowResult> withdraw(@PathVariable UUID id) {
    return ResponseEntity.ok(workflowEngine.withdraw(id, Actor.current()));
  }

  @PostMapping("/api/submissions/{id}/finalize")
  @PreAuthorize("hasAnyRole('CONTRACT_OFFICER', 'ADMIN')")
  public ResponseEntity<FinalizeResult> finalizeSubmission(
      @PathVariable UUID id, @RequestParam(defaultValue = "false") boolean dryRun) {
    return ResponseEntity.ok(workflowEngine.finalizeSubmission(id, Actor.current(), dryRun));
  }

  @GetMapping("/api/submissions/{id}/approval-steps")
  public ResponseEntity<List<ApprovalStepResponse>> listApprovalSteps(
      @PathVariable UUID id, @RequestParam(defaultValue = "false") boolean includeHistory) {
    var steps =
        includeHistory ? workflowEngine.getChainHistory(id) : workflowEngine.getActiveChain(id);
    return ResponseEntity.ok(steps.stream().map(ApprovalStepResponse::from).toList());
  }

  @PostMapping("/api/submissions/{id}/automation-runs/{runId}/result")
  @PreAuthorize("hasAnyRole('AUTOMATION', 'ADMIN')")
  public ResponseEntity<LedgerRecord> recordAutomationResult(
      @PathVariable UUID id,
      @PathVariable String runId,
      @Valid @RequestBody AutomationResultRequest request) {
    if (!request.outcome().isReportedByRun()) {
      throw new InvalidStateException(
          "Invalid automation outcome", "Runs can only report COMPLETED or FAILED");
    }
    var entry =
        workflowEngine.recordAutomationOutcome(
            id, runId, request.outcome(), request.evidenceRefs(), request.detail());
    return ResponseEntity.status(HttpStatus.CREATED).body(entry);
  }

  @PostMapping("/api/submissions/{id}/audit-trail/corrections")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<LedgerRecord> recordCorrection(
      @PathVariable UUID id, @Valid @RequestBody CorrectionRequest request) {
    var entry =
        workflowEngine.recordCorrection(
            id, request.correctsSequence(), Actor.current(), request.reason());
    return ResponseEntity.status(HttpStatus.CREATED).body(entry);
  }

  // --- DTOs ---

  public record RequestApprovalRequest(boolean forceAutonomy) {}

  public record ApproveStepRequest(
      @Size(max = 2000, message = "notes must not exceed 2000 characters") String notes) {}

  public record RejectStepRequest(
      @NotBlank(message = "reason is required")
          @Size(max = 2000, message = "reason must not exceed 2000 characters")
          String reason) {}

  public record AutomationResultRequest(
      @NotNull(message = "outcome is required") AutomationOutcome outcome,
      List<String> evidenceRefs,
      @Size(max = 2000, message = "detail must not exceed 2000 characters") String detail) {}

  public record CorrectionRequest(
      @Positive(message = "correctsSequence must be positive") long correctsSequence,
      @NotBlank(message = "reason is required") String reason) {}

  public record ApprovalStepResponse(
      UUID id,
      int generation,
      String stepName,
      int stepOrder,
      String approverRole,
      String assignedApproverId,
      ApprovalStepStatus status,
      String decidedById,
      Instant decidedAt,
      String notes,
      Instant dueAt,
      Instant escalatedAt,
      String escalatedTo) {

    public static ApprovalStepResponse from(ApprovalStep step) {
      return new ApprovalStepResponse(
          step.getId(),
          step.getGeneration(),
          step.getStepName(),
          step.getStepOrder(),
          step.getApproverRole(),
          step.getAssignedApproverId(),
          step.getStatus(),
          step.getDecidedById(),
          step.getDecidedAt(),
          step.getNotes(),
          step.getDueAt(),
          step.getEscalatedAt(),
          step.getEscalatedTo());
    }
  }
}
