package io.procura.backend.integration.qualification;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Port for the opportunity qualification engine that scores how well an opportunity fits the
 * company. Scoring internals live outside this service.
 */
public interface QualificationEngine {

  /** Provider identifier (e.g., "internal-ml", "noop"). */
  String providerId();

  /** Current score for the opportunity, or empty when it has not been scored. */
  Optional<BigDecimal> getScore(UUID opportunityId);
}
