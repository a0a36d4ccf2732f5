package io.procura.backend.integration.qualification;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default engine with no scores; every submission therefore goes through the approval chain. */
@Component
public class NoOpQualificationEngine implements QualificationEngine {

  private static final Logger log = LoggerFactory.getLogger(NoOpQualificationEngine.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public Optional<BigDecimal> getScore(UUID opportunityId) {
    log.debug("NoOp qualification: no score for opportunity {}", opportunityId);
    return Optional.empty();
  }
}
