package io.procura.backend.audit;

import java.util.UUID;

/**
 * Verification outcome of a single entry.
 *
 * @param entryId the entry id, null for entries that were never persisted
 * @param sequence the entry's sequence
 * @param signatureValid digest and signature recompute to the stored values
 * @param linkValid prior hash matches the predecessor's signature and the sequence is continuous
 * @param verified this entry and every entry before it in the chain are intact
 */
public record EntryVerification(
    UUID entryId, long sequence, boolean signatureValid, boolean linkValid, boolean verified) {}
