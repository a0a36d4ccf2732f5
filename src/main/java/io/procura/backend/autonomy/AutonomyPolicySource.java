package io.procura.backend.autonomy;

/** Supplies the autonomy policy in force at the time of a request. */
public interface AutonomyPolicySource {

  AutonomyPolicy currentPolicy();
}
