package io.procura.backend.autonomy;

import java.math.BigDecimal;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Autonomy policy as configured under {@code procura.autonomy}.
 *
 * @param enabled whether autonomous approval is allowed at all
 * @param thresholdUsd maximum estimated value in USD
 * @param minScore minimum qualification score
 * @param excludedCategories categories that always go through the approval chain
 */
@ConfigurationProperties(prefix = "procura.autonomy")
public record AutonomyProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("100000") BigDecimal thresholdUsd,
    @DefaultValue("80") BigDecimal minScore,
    Set<String> excludedCategories) {

  public AutonomyPolicy toPolicy() {
    return new AutonomyPolicy(enabled, thresholdUsd, minScore, excludedCategories);
  }
}
