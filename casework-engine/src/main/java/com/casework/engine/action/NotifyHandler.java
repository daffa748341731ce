package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Notification;
import com.casework.core.model.NotificationKind;
import com.casework.core.model.UserProfile;
import com.casework.core.port.AssigneeDirectory;
import com.casework.engine.notification.NotificationDispatcher;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Sends a templated notification.
 *
 * <p>Config: {@code {"recipients": ["assignee", "reporter", "role:agent", "user:u1"],
 * "subject": "...", "message": "..."}}. Subject and message may use the placeholders
 * {@code record_number}, {@code record_title}, {@code priority}, {@code severity},
 * {@code transition_name}, {@code from_state}, {@code to_state}, {@code current_state},
 * {@code performed_by} and {@code assignee}.
 *
 * <p>Delivery is fire-and-forget; a failing notifier never fails the action.
 */
public class NotifyHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(NotifyHandler.class);

    static final String ROLE_PREFIX = "role:";
    static final String USER_PREFIX = "user:";
    static final String UNASSIGNED = "Unassigned";

    private final AssigneeDirectory directory;
    private final NotificationDispatcher dispatcher;

    public NotifyHandler(AssigneeDirectory directory, NotificationDispatcher dispatcher) {
        this.directory = directory;
        this.dispatcher = dispatcher;
    }

    @Override
    public ActionType type() {
        return ActionType.NOTIFY;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        JsonNode recipientsNode = context.getConfig().get("recipients");
        if (recipientsNode == null || !recipientsNode.isArray() || recipientsNode.isEmpty()) {
            throw ActionException.misconfigured(type(), "'recipients' must be a non-empty array");
        }

        CaseRecord record = context.getRecord();
        Set<String> recipients = new LinkedHashSet<>();
        for (JsonNode entry : recipientsNode) {
            recipients.addAll(resolve(entry.asText(), record));
        }

        Map<String, String> values = placeholders(context);
        Notification notification = new Notification(
            NotificationKind.TRANSITION,
            record.id(),
            recipients,
            MessageTemplate.render(context.optionalText("subject"), values),
            MessageTemplate.render(context.optionalText("message"), values)
        );
        dispatcher.dispatch(notification);
        return record;
    }

    private Set<String> resolve(String recipient, CaseRecord record) throws ActionException {
        if ("assignee".equals(recipient)) {
            return optional(record.assigneeId());
        }
        if ("reporter".equals(recipient)) {
            return optional(record.reporterId());
        }
        if (recipient.startsWith(ROLE_PREFIX)) {
            Set<String> ids = new LinkedHashSet<>();
            for (UserProfile user : directory.usersWithRole(recipient.substring(ROLE_PREFIX.length()))) {
                ids.add(user.id());
            }
            if (ids.isEmpty()) {
                log.debug("Recipient {} resolved to nobody for record {}", recipient, record.id());
            }
            return ids;
        }
        if (recipient.startsWith(USER_PREFIX) && recipient.length() > USER_PREFIX.length()) {
            return Set.of(recipient.substring(USER_PREFIX.length()));
        }
        throw ActionException.misconfigured(type(), "unknown recipient '" + recipient + "'");
    }

    private static Set<String> optional(String id) {
        return id == null ? Set.of() : Set.of(id);
    }

    static Map<String, String> placeholders(ActionContext context) {
        CaseRecord record = context.getRecord();
        Map<String, String> values = new HashMap<>();
        values.put("record_number", record.recordNumber());
        values.put("record_title", record.title());
        values.put("priority", record.priority());
        values.put("severity", record.severity());
        values.put("transition_name", context.getTransition().name());
        values.put("from_state", context.getFromState() == null ? null : context.getFromState().name());
        values.put("to_state", context.getToState() == null ? null : context.getToState().name());
        values.put("current_state", context.getToState() == null ? null : context.getToState().name());
        values.put("performed_by", context.getActor().id());
        values.put("assignee", record.assigneeId() == null ? UNASSIGNED : record.assigneeId());
        return values;
    }
}
