package io.procura.backend.integration.notification;

import java.util.UUID;

/** Port for delivering approval notifications (email, chat, in-app). Delivery is external. */
public interface NotificationDispatcher {

  /**
   * Sends one notification.
   *
   * @param stepName the step concerned, or null for submission-level notifications
   * @throws RuntimeException on delivery failure; callers retry
   */
  void notify(UUID submissionId, String stepName, String recipientId, NotificationKind kind);
}
