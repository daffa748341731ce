package com.casework.engine.action;

import com.casework.core.matching.CriteriaMatcher;
import com.casework.core.matching.MatchDimension;
import com.casework.core.matching.MatchResult;
import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.UserProfile;
import com.casework.core.port.AssigneeDirectory;
import com.casework.engine.record.RecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Assigns the record to a user holding a role.
 *
 * <p>Config: {@code {"role": "agent", "mode": "AUTO_MATCH" | "MANUAL_SELECT"}}.
 * Auto-match ranks role holders by classification, location and department, skipping the
 * current assignee, and falls back to any role holder when nobody matches. Manual selection
 * takes the user picked in the transition payload; without a pick the assignee is unchanged.
 */
public class AssignRoleHandler implements ActionHandler {

    private static final Logger log = LoggerFactory.getLogger(AssignRoleHandler.class);

    public enum Mode {
        AUTO_MATCH,
        MANUAL_SELECT
    }

    private final AssigneeDirectory directory;
    private final RecordWriter writer;
    private final CriteriaMatcher matcher = CriteriaMatcher.over(
        MatchDimension.CLASSIFICATION,
        MatchDimension.LOCATION,
        MatchDimension.DEPARTMENT
    );

    public AssignRoleHandler(AssigneeDirectory directory, RecordWriter writer) {
        this.directory = directory;
        this.writer = writer;
    }

    @Override
    public ActionType type() {
        return ActionType.ASSIGN_ROLE;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        String role = context.requireText("role");
        Mode mode = mode(context);
        return switch (mode) {
            case AUTO_MATCH -> autoMatch(context, role);
            case MANUAL_SELECT -> manualSelect(context, role);
        };
    }

    private CaseRecord autoMatch(ActionContext context, String role) throws ActionException {
        CaseRecord record = context.getRecord();
        List<UserProfile> candidates = directory.usersWithRole(role).stream()
            .filter(u -> !u.id().equals(record.assigneeId()))
            .toList();
        if (candidates.isEmpty()) {
            throw new ActionException(ActionException.NO_MATCH, "No other active user holds role " + role);
        }

        MatchResult<UserProfile> result = matcher.match(candidates, record.criteria());
        UserProfile chosen;
        if (result.isEmpty()) {
            log.debug("No {} matches record {} attributes, falling back to role only", role, record.id());
            chosen = candidates.get(0);
        } else {
            chosen = result.matches().get(0);
        }
        return AssignUserHandler.assign(writer, context, chosen.id());
    }

    private CaseRecord manualSelect(ActionContext context, String role) throws ActionException {
        String selected = context.getPayload().selectedUserId();
        if (selected == null || selected.isBlank()) {
            return context.getRecord();
        }
        UserProfile user = directory.findUser(selected)
            .filter(UserProfile::active)
            .orElseThrow(() -> new ActionException(ActionException.TARGET_NOT_FOUND,
                "No active user with id " + selected));
        if (!user.roles().contains(role)) {
            throw new ActionException(ActionException.TARGET_NOT_FOUND,
                String.format("User %s does not hold role %s", selected, role));
        }
        return AssignUserHandler.assign(writer, context, user.id());
    }

    private static Mode mode(ActionContext context) throws ActionException {
        String value = Objects.requireNonNullElse(context.optionalText("mode"), Mode.AUTO_MATCH.name());
        try {
            return Mode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ActionException.misconfigured(ActionType.ASSIGN_ROLE, "unknown mode " + value);
        }
    }
}
