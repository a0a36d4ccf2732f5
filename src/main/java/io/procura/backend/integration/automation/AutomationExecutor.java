package io.procura.backend.integration.automation;

import java.util.UUID;

/**
 * Port for the browser-automation service that uploads a finalized submission to its portal. The
 * run completes asynchronously and reports back through the automation callback endpoint.
 */
public interface AutomationExecutor {

  /** Provider identifier (e.g., "playwright", "noop"). */
  String providerId();

  /**
   * Starts a portal upload run.
   *
   * @return the run id used to correlate the later outcome callback
   */
  String trigger(UUID submissionId);
}
