package io.procura.backend.exception;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Locale;
import java.util.Set;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /** Unique constraints that only a concurrent writer can violate. */
  static final Set<String> RACE_CONSTRAINTS = Set.of("uq_audit_entries_sequence");

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleAccessDenied(
      AccessDeniedException ex, HttpServletRequest request) {
    log.warn(
        "Access denied: path={}, method={}, reason=insufficient_role",
        request.getRequestURI(),
        request.getMethod());
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Access denied");
    problem.setDetail("Insufficient permissions for this operation");
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
  }

  @ExceptionHandler(IntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleIntegrityViolation(IntegrityViolationException ex) {
    log.error(
        "Audit integrity violation: submission={}, brokenAtSequence={}",
        ex.getSubmissionId(),
        ex.getBrokenAtSequence());
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(ex.getBody());
  }

  @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handleOptimisticLock(
      ObjectOptimisticLockingFailureException ex) {
    log.warn("Optimistic locking failure: {}", ex.getMessage());
    return conflict("Resource was modified concurrently. Please retry.");
  }

  @ExceptionHandler(PessimisticLockingFailureException.class)
  public ResponseEntity<ProblemDetail> handlePessimisticLock(
      PessimisticLockingFailureException ex) {
    log.warn("Lock acquisition failed: {}", ex.getMessage());
    return conflict("Resource is locked by a concurrent operation. Please retry.");
  }

  @ExceptionHandler(DataIntegrityViolationException.class)
  public ResponseEntity<ProblemDetail> handleDataIntegrity(DataIntegrityViolationException ex) {
    var constraint = constraintName(ex);
    if (constraint != null && RACE_CONSTRAINTS.contains(constraint)) {
      log.warn("Concurrent append lost on constraint {}", constraint);
      return conflict("A concurrent operation recorded a conflicting change. Please retry.");
    }
    log.warn(
        "Data integrity violation: constraint={}, cause={}",
        constraint,
        ex.getMostSpecificCause().getMessage());
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid data");
    problem.setDetail("The request contains a value the database cannot store");
    return ResponseEntity.badRequest().body(problem);
  }

  private static String constraintName(Throwable ex) {
    for (var cause = ex; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException violation
          && violation.getConstraintName() != null) {
        return violation.getConstraintName().toLowerCase(Locale.ROOT);
      }
    }
    return null;
  }

  private static ResponseEntity<ProblemDetail> conflict(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Concurrent modification");
    problem.setDetail(detail);
    problem.setProperty("retryable", true);
    return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
  }
}
