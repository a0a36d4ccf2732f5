package io.procura.backend.audit;

import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

/**
 * One submission's audit entries in sequence order, each paired with the outcome of the same
 * chain walk that produced {@code valid} and {@code brokenAtSequence}.
 */
public record AuditTrail(
    UUID submissionId, boolean valid, Long brokenAtSequence, List<TrailEntry> entries) {

  public AuditTrail {
    entries = List.copyOf(entries);
  }

  public record TrailEntry(LedgerRecord entry, EntryVerification verification) {}

  static AuditTrail of(ChainVerification verification, List<LedgerRecord> records) {
    var entries =
        IntStream.range(0, records.size())
            .mapToObj(i -> new TrailEntry(records.get(i), verification.entries().get(i)))
            .toList();
    return new AuditTrail(
        verification.submissionId(),
        verification.valid(),
        verification.brokenAtSequence(),
        entries);
  }
}
