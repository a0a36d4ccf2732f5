package io.procura.backend.integration.notification;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

  @Override
  public void notify(
      UUID submissionId, String stepName, String recipientId, NotificationKind kind) {
    log.info(
        "Notification: kind={}, submission={}, step={}, recipient={}",
        kind,
        submissionId,
        stepName,
        recipientId);
  }
}
