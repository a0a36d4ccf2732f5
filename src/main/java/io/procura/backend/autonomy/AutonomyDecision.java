package io.procura.backend.autonomy;

/** Outcome of evaluating the autonomy policy, with the human-readable rule that decided it. */
public record AutonomyDecision(boolean eligible, String reason) {

  static AutonomyDecision granted() {
    return new AutonomyDecision(true, AutonomyPolicyEvaluator.REASON_GRANTED);
  }

  static AutonomyDecision denied(String reason) {
    return new AutonomyDecision(false, reason);
  }
}
