package io.procura.backend.autonomy;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only autonomy policy: when a submission may skip the human approval chain.
 *
 * @param enabled master switch
 * @param thresholdUsd highest estimated value (inclusive) eligible for autonomous approval
 * @param minScore lowest qualification score (inclusive) eligible for autonomous approval
 * @param excludedCategories opportunity categories that always need human approval; stored
 *     lower-cased
 */
public record AutonomyPolicy(
    boolean enabled, BigDecimal thresholdUsd, BigDecimal minScore, Set<String> excludedCategories) {

  public AutonomyPolicy {
    excludedCategories =
        excludedCategories == null
            ? Set.of()
            : excludedCategories.stream()
                .map(category -> category.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
  }

  public boolean excludes(String category) {
    return category != null
        && excludedCategories.contains(category.trim().toLowerCase(Locale.ROOT));
  }
}
