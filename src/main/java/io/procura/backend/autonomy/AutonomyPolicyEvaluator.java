package io.procura.backend.autonomy;

import org.springframework.stereotype.Component;

/**
 * Decides whether a submission qualifies for autonomous approval. Pure function of its two inputs;
 * rules are applied in a fixed order and the first failing rule names the reason.
 */
@Component
public class AutonomyPolicyEvaluator {

  public static final String REASON_DISABLED = "autonomy disabled";
  public static final String REASON_VALUE_UNKNOWN = "estimated value unknown";
  public static final String REASON_VALUE_EXCEEDS = "value exceeds threshold";
  public static final String REASON_SCORE_BELOW = "score below minimum";
  public static final String REASON_CATEGORY_EXCLUDED = "category excluded";
  public static final String REASON_GRANTED = "autonomous approval granted";

  public AutonomyDecision evaluate(SubmissionSnapshot snapshot, AutonomyPolicy policy) {
    if (!policy.enabled()) {
      return AutonomyDecision.denied(REASON_DISABLED);
    }
    if (snapshot.estimatedValue() == null) {
      return AutonomyDecision.denied(REASON_VALUE_UNKNOWN);
    }
    if (snapshot.estimatedValue().compareTo(policy.thresholdUsd()) > 0) {
      return AutonomyDecision.denied(REASON_VALUE_EXCEEDS);
    }
    if (snapshot.qualificationScore() == null
        || snapshot.qualificationScore().compareTo(policy.minScore()) < 0) {
      return AutonomyDecision.denied(REASON_SCORE_BELOW);
    }
    if (policy.excludes(snapshot.category())) {
      return AutonomyDecision.denied(REASON_CATEGORY_EXCLUDED);
    }
    return AutonomyDecision.granted();
  }
}
