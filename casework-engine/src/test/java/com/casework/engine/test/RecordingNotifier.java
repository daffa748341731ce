package com.casework.engine.test;

import com.casework.core.model.Notification;
import com.casework.core.model.NotificationKind;
import com.casework.core.port.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Notifier that keeps every notification for later inspection.
 */
public class RecordingNotifier implements Notifier {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    @Override
    public void notify(Notification notification) {
        sent.add(notification);
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }

    public List<Notification> sent(NotificationKind kind) {
        return sent.stream().filter(n -> n.kind() == kind).toList();
    }

    public void clear() {
        sent.clear();
    }
}
