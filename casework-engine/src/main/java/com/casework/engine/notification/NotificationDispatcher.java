package com.casework.engine.notification;

import com.casework.core.model.Notification;
import com.casework.core.port.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands notifications to the {@link Notifier} without blocking the caller.
 * Delivery failures are logged and never propagate.
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final Notifier notifier;
    private final Executor executor;

    public NotificationDispatcher(Notifier notifier, Executor executor) {
        this.notifier = notifier;
        this.executor = executor;
    }

    /**
     * Dispatcher that delivers on the calling thread. Used in tests.
     */
    public static NotificationDispatcher direct(Notifier notifier) {
        return new NotificationDispatcher(notifier, Runnable::run);
    }

    public CompletableFuture<Void> dispatch(Notification notification) {
        if (notification.recipients().isEmpty()) {
            log.debug("Skipping {} notification for record {}: no recipients",
                notification.kind(), notification.recordId());
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture
                .runAsync(() -> notifier.notify(notification), executor)
                .exceptionally(e -> {
                    log.warn("Failed to deliver {} notification for record {}",
                        notification.kind(), notification.recordId(), e);
                    return null;
                });
        } catch (RejectedExecutionException e) {
            log.warn("Dropped {} notification for record {}: dispatcher is shut down",
                notification.kind(), notification.recordId(), e);
            return CompletableFuture.completedFuture(null);
        }
    }
}
