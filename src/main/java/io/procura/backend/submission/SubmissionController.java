package io.procura.backend.submission;

import io.procura.backend.security.Actor;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SubmissionController {

  private final SubmissionService submissionService;

  public SubmissionController(SubmissionService submissionService) {
    this.submissionService = submissionService;
  }

  @PostMapping("/api/submissions")
  public ResponseEntity<SubmissionResponse> createSubmission(
      @Valid @RequestBody CreateSubmissionRequest request) {
    var submission =
        submissionService.createSubmission(
            request.opportunityId(),
            request.title(),
            request.portal(),
            request.category(),
            request.estimatedValue(),
            request.dueDate(),
            Actor.current());
    return ResponseEntity.created(URI.create("/api/submissions/" + submission.getId()))
        .body(SubmissionResponse.from(submission));
  }

  @GetMapping("/api/submissions")
  public ResponseEntity<Page<SubmissionResponse>> listSubmissions(
      @RequestParam(required = false) SubmissionStatus status,
      @RequestParam(required = false) String ownerId,
      @RequestParam(required = false) ApprovalStatus approvalStatus,
      Pageable pageable) {
    var page =
        submissionService.listSubmissions(
            status, ownerId, approvalStatus, Actor.current(), pageable);
    return ResponseEntity.ok(page.map(SubmissionResponse::from));
  }

  @GetMapping("/api/submissions/{id}")
  public ResponseEntity<SubmissionResponse> getSubmission(@PathVariable UUID id) {
    return ResponseEntity.ok(SubmissionResponse.from(submissionService.getSubmission(id)));
  }

  @PutMapping("/api/submissions/{id}")
  public ResponseEntity<SubmissionResponse> updateSubmission(
      @PathVariable UUID id, @Valid @RequestBody UpdateSubmissionRequest request) {
    var submission =
        submissionService.updateSubmission(
            id,
            request.title(),
            request.portal(),
            request.category(),
            request.estimatedValue(),
            request.dueDate(),
            Actor.current());
    return ResponseEntity.ok(SubmissionResponse.from(submission));
  }

  // --- DTOs ---

  public record CreateSubmissionRequest(
      @NotNull(message = "opportunityId is required") UUID opportunityId,
      @NotBlank(message = "title is required")
          @Size(max = 300, message = "title must not exceed 300 characters")
          String title,
      @Size(max = 100, message = "portal must not exceed 100 characters") String portal,
      @Size(max = 100, message = "category must not exceed 100 characters") String category,
      @DecimalMin(value = "0", message = "estimatedValue must not be negative")
          @Digits(
              integer = 12,
              fraction = 2,
              message = "estimatedValue allows 12 integer digits and 2 decimals")
          BigDecimal estimatedValue,
      LocalDate dueDate) {}

  public record UpdateSubmissionRequest(
      @Size(min = 1, max = 300, message = "title must be between 1 and 300 characters")
          String title,
      @Size(max = 100, message = "portal must not exceed 100 characters") String portal,
      @Size(max = 100, message = "category must not exceed 100 characters") String category,
      @DecimalMin(value = "0", message = "estimatedValue must not be negative")
          @Digits(
              integer = 12,
              fraction = 2,
              message = "estimatedValue allows 12 integer digits and 2 decimals")
          BigDecimal estimatedValue,
      LocalDate dueDate) {}

  public record SubmissionResponse(
      UUID id,
      UUID opportunityId,
      String ownerId,
      String title,
      String portal,
      String category,
      BigDecimal estimatedValue,
      LocalDate dueDate,
      SubmissionStatus status,
      ApprovalStatus approvalStatus,
      ApprovalMode approvalMode,
      int chainGeneration,
      boolean chainActive,
      Instant createdAt,
      Instant updatedAt) {

    public static SubmissionResponse from(Submission submission) {
      return new SubmissionResponse(
          submission.getId(),
          submission.getOpportunityId(),
          submission.getOwnerId(),
          submission.getTitle(),
          submission.getPortal(),
          submission.getCategory(),
          submission.getEstimatedValue(),
          submission.getDueDate(),
          submission.getStatus(),
          submission.getApprovalStatus(),
          submission.getApprovalMode(),
          submission.getChainGeneration(),
          submission.isChainActive(),
          submission.getCreatedAt(),
          submission.getUpdatedAt());
    }
  }
}
