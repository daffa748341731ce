package com.casework.core.model;

import java.util.Set;
import java.util.UUID;

/**
 * Message handed to the notification port. Delivery happens elsewhere.
 */
public record Notification(
    NotificationKind kind,
    UUID recordId,
    Set<String> recipients,
    String subject,
    String body
) {
    public Notification {
        recipients = recipients == null ? Set.of() : Set.copyOf(recipients);
    }
}
