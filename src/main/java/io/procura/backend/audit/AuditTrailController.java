package io.procura.backend.audit;

import io.procura.backend.exception.InvalidStateException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditTrailController {

  private static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

  private final AuditLedger auditLedger;
  private final AuditTrailExporter auditTrailExporter;

  public AuditTrailController(AuditLedger auditLedger, AuditTrailExporter auditTrailExporter) {
    this.auditLedger = auditLedger;
    this.auditTrailExporter = auditTrailExporter;
  }

  @GetMapping("/api/submissions/{id}/audit-trail")
  public ResponseEntity<AuditTrail> getAuditTrail(@PathVariable UUID id) {
    return ResponseEntity.ok(auditLedger.getAuditTrail(id));
  }

  @GetMapping("/api/submissions/{id}/audit-trail/verify")
  public ResponseEntity<ChainVerification> verifyAuditTrail(@PathVariable UUID id) {
    return ResponseEntity.ok(auditLedger.verifyChain(id));
  }

  @GetMapping("/api/audit-entries")
  @PreAuthorize("hasAnyRole('ADMIN', 'CONTRACT_OFFICER')")
  public ResponseEntity<Page<LedgerRecord>> listAuditEntries(
      @RequestParam(required = false) UUID submissionId,
      @RequestParam(required = false) String portal,
      @RequestParam(required = false) String action,
      @PageableDefault(size = 100) Pageable pageable) {
    return ResponseEntity.ok(auditLedger.listEntries(submissionId, portal, action, pageable));
  }

  @GetMapping("/api/audit-entries/{entryId}/verify")
  @PreAuthorize("hasAnyRole('ADMIN', 'CONTRACT_OFFICER')")
  public ResponseEntity<EntryVerification> verifyAuditEntry(@PathVariable UUID entryId) {
    return ResponseEntity.ok(auditLedger.verifyEntryById(entryId));
  }

  @GetMapping("/api/audit-trail/export")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<String> exportAuditTrail(
      @RequestParam(defaultValue = "json") String format,
      @RequestParam(required = false) UUID submissionId) {
    var normalized = format.toLowerCase(Locale.ROOT);
    if (!normalized.equals("json") && !normalized.equals("ndjson")) {
      throw new InvalidStateException(
          "Unsupported export format", "Format must be json or ndjson, not " + format);
    }
    var export = auditTrailExporter.export(submissionId);
    boolean ndjson = normalized.equals("ndjson");
    var filename =
        "audit-trail-"
            + (submissionId != null ? submissionId.toString() : "all")
            + (ndjson ? ".ndjson" : ".json");
    return ResponseEntity.ok()
        .contentType(ndjson ? NDJSON : MediaType.APPLICATION_JSON)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(filename).build().toString())
        .body(ndjson ? auditTrailExporter.toNdjson(export) : auditTrailExporter.toJson(export));
  }

  @PostMapping(
      value = "/api/audit-trail/verify-export",
      consumes = MediaType.APPLICATION_JSON_VALUE)
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<List<ChainVerification>> verifyExport(@RequestBody String exportJson) {
    return ResponseEntity.ok(auditTrailExporter.verifyExport(exportJson));
  }

  @PostMapping(value = "/api/audit-trail/verify-export", consumes = "application/x-ndjson")
  @PreAuthorize("hasRole('ADMIN')")
  public ResponseEntity<List<ChainVerification>> verifyNdjsonExport(
      @RequestBody String exportNdjson) {
    return ResponseEntity.ok(auditTrailExporter.verifyNdjsonExport(exportNdjson));
  }
}
