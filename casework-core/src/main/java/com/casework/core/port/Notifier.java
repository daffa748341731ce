package com.casework.core.port;

import com.casework.core.model.Notification;

/**
 * Outbound notification channel. Implementations may fail; callers treat
 * notifications as best-effort and never roll back on failure.
 */
public interface Notifier {

    void notify(Notification notification);
}
