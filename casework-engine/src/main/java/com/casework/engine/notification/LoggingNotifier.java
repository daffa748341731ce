package com.casework.engine.notification;

import com.casework.core.model.Notification;
import com.casework.core.port.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that only logs. Default until a delivery channel is wired in.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(Notification notification) {
        log.info("Notification {} for record {} to {}: {}",
            notification.kind(), notification.recordId(), notification.recipients(), notification.subject());
    }
}
