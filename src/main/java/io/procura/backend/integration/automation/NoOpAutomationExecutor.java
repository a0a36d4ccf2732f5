package io.procura.backend.integration.automation;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class NoOpAutomationExecutor implements AutomationExecutor {

  private static final Logger log = LoggerFactory.getLogger(NoOpAutomationExecutor.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public String trigger(UUID submissionId) {
    var runId = "NOOP-RUN-" + UUID.randomUUID().toString().substring(0, 8);
    log.info("NoOp automation: would upload submission {} (run {})", submissionId, runId);
    return runId;
  }
}
