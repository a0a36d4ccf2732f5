package io.procura.backend.autonomy;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * The facts the autonomy policy is evaluated against, captured once per request.
 *
 * @param submissionId the submission being evaluated
 * @param estimatedValue estimated contract value in USD, null when unknown
 * @param qualificationScore score from the qualification engine, null when unavailable
 * @param category opportunity category, may be null
 */
public record SubmissionSnapshot(
    UUID submissionId, BigDecimal estimatedValue, BigDecimal qualificationScore, String category) {}
