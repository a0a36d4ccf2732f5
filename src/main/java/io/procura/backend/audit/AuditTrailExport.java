package io.procura.backend.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Self-contained export of one or more audit chains. Each entry carries everything needed to
 * recompute its digest and signature, plus the verification status observed at export time.
 */
public record AuditTrailExport(Instant exportedAt, List<ExportedChain> chains) {

  public AuditTrailExport {
    chains = List.copyOf(chains);
  }

  public record ExportedChain(
      UUID submissionId, boolean valid, Long brokenAtSequence, List<ExportedEntry> entries) {

    public ExportedChain {
      entries = List.copyOf(entries);
    }
  }

  public record ExportedEntry(LedgerRecord entry, boolean verified) {}
}
