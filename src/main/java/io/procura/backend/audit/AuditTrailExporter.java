package io.procura.backend.audit;

import io.procura.backend.exception.InvalidStateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Exports audit chains as JSON or NDJSON and re-verifies previously exported documents of either
 * format offline. NDJSON output writes one {@link AuditTrailExport.ExportedChain} per line.
 */
@Service
public class AuditTrailExporter {

  private static final Logger log = LoggerFactory.getLogger(AuditTrailExporter.class);

  private final AuditLedger auditLedger;
  private final AuditChainVerifier chainVerifier;
  private final ObjectMapper objectMapper;

  public AuditTrailExporter(
      AuditLedger auditLedger, AuditChainVerifier chainVerifier, ObjectMapper objectMapper) {
    this.auditLedger = auditLedger;
    this.chainVerifier = chainVerifier;
    this.objectMapper = objectMapper;
  }

  /** Exports one submission's chain, or every chain when {@code submissionId} is null. */
  @Transactional(readOnly = true)
  public AuditTrailExport export(UUID submissionId) {
    var entries =
        submissionId != null
            ? auditLedger.getEntries(submissionId)
            : auditLedger.getAllEntries();
    var bySubmission =
        entries.stream()
            .collect(
                Collectors.groupingBy(
                    LedgerRecord::submissionId, LinkedHashMap::new, Collectors.toList()));

    var chains = new ArrayList<AuditTrailExport.ExportedChain>();
    bySubmission.forEach(
        (id, chainEntries) ->
            chains.add(
                toExportedChain(chainVerifier.verifyChain(id, chainEntries), chainEntries)));
    log.info(
        "Exported audit trail: submission={}, chains={}, entries={}",
        submissionId != null ? submissionId : "all",
        chains.size(),
        entries.size());
    return new AuditTrailExport(Instant.now(), chains);
  }

  public String toJson(AuditTrailExport export) {
    return objectMapper.writeValueAsString(export);
  }

  public String toNdjson(AuditTrailExport export) {
    var out = new StringBuilder();
    for (var chain : export.chains()) {
      out.append(objectMapper.writeValueAsString(chain)).append('\n');
    }
    return out.toString();
  }

  /**
   * Parses a JSON export and recomputes every chain's verification from the exported entries
   * alone. The verification flags stored in the document are ignored.
   *
   * @throws InvalidStateException if the document cannot be parsed
   */
  public List<ChainVerification> verifyExport(String json) {
    AuditTrailExport export;
    try {
      export = objectMapper.readValue(json, AuditTrailExport.class);
    } catch (JacksonException e) {
      log.warn("Rejected audit export document: {}", e.getOriginalMessage());
      throw new InvalidStateException("Invalid export", "Audit export document cannot be parsed");
    }
    return verifyChains(export.chains());
  }

  /**
   * Same as {@link #verifyExport} for an NDJSON export: one chain per line, blank lines ignored.
   *
   * @throws InvalidStateException naming the first line that cannot be parsed
   */
  public List<ChainVerification> verifyNdjsonExport(String ndjson) {
    var chains = new ArrayList<AuditTrailExport.ExportedChain>();
    var lines = ndjson.split("\\R");
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].isBlank()) {
        continue;
      }
      try {
        chains.add(objectMapper.readValue(lines[i], AuditTrailExport.ExportedChain.class));
      } catch (JacksonException e) {
        log.warn("Rejected audit export line {}: {}", i + 1, e.getOriginalMessage());
        throw new InvalidStateException(
            "Invalid export", "Audit export line " + (i + 1) + " cannot be parsed");
      }
    }
    return verifyChains(chains);
  }

  private List<ChainVerification> verifyChains(List<AuditTrailExport.ExportedChain> chains) {
    return chains.stream()
        .map(
            chain ->
                chainVerifier.verifyChain(
                    chain.submissionId(),
                    chain.entries().stream().map(AuditTrailExport.ExportedEntry::entry).toList()))
        .toList();
  }

  private AuditTrailExport.ExportedChain toExportedChain(
      ChainVerification verification, List<LedgerRecord> entries) {
    var exported = new ArrayList<AuditTrailExport.ExportedEntry>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      exported.add(
          new AuditTrailExport.ExportedEntry(
              entries.get(i), verification.entries().get(i).verified()));
    }
    return new AuditTrailExport.ExportedChain(
        verification.submissionId(),
        verification.valid(),
        verification.brokenAtSequence(),
        exported);
  }
}
