package io.procura.backend.workflow;

import io.procura.backend.integration.automation.AutomationExecutor;
import java.util.UUID;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/** Retrying wrapper around {@link AutomationExecutor}. The last failure is rethrown. */
@Component
public class AutomationLauncher {

  private final AutomationExecutor automationExecutor;

  public AutomationLauncher(AutomationExecutor automationExecutor) {
    this.automationExecutor = automationExecutor;
  }

  @Retryable(
      retryFor = RuntimeException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2))
  public String launch(UUID submissionId) {
    return automationExecutor.trigger(submissionId);
  }
}
