package io.procura.backend.approval;

import io.procura.backend.integration.notification.NotificationDispatcher;
import io.procura.backend.integration.notification.NotificationKind;
import java.util.UUID;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

/** Retrying wrapper around {@link NotificationDispatcher}. The last failure is rethrown. */
@Component
public class ApprovalNotifier {

  private final NotificationDispatcher notificationDispatcher;

  public ApprovalNotifier(NotificationDispatcher notificationDispatcher) {
    this.notificationDispatcher = notificationDispatcher;
  }

  @Retryable(
      retryFor = RuntimeException.class,
      maxAttempts = 3,
      backoff = @Backoff(delay = 500, multiplier = 2))
  public void notify(
      UUID submissionId, String stepName, String recipientId, NotificationKind kind) {
    notificationDispatcher.notify(submissionId, stepName, recipientId, kind);
  }
}
