package io.procura.backend.workflow;

import io.procura.backend.audit.AuditLedger;
import io.procura.backend.audit.LedgerRecord;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records rejected attempts that must stay on the audit trail even though the operation itself
 * fails and its transaction rolls back.
 *
 * <p>Transaction semantics: REQUIRES_NEW. The entry commits independently of the caller. The
 * caller must not have appended to the same submission's chain in its own transaction yet.
 */
@Component
public class SuspiciousActivityRecorder {

  private static final Logger log = LoggerFactory.getLogger(SuspiciousActivityRecorder.class);

  private final AuditLedger auditLedger;

  public SuspiciousActivityRecorder(AuditLedger auditLedger) {
    this.auditLedger = auditLedger;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public LedgerRecord record(
      UUID submissionId, String actorId, String action, Map<String, ?> payload) {
    var entry = auditLedger.append(submissionId, actorId, action, payload, List.of());
    log.warn(
        "Suspicious activity recorded: submission={}, actor={}, action={}, sequence={}",
        submissionId,
        actorId,
        action,
        entry.sequence());
    return entry;
  }
}
