package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.UserProfile;
import com.casework.core.port.AssigneeDirectory;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.revision.RevisionSnapshots;

import java.util.Objects;

/**
 * Assigns the record to a fixed user. Config: {@code {"userId": "..."}}.
 */
public class AssignUserHandler implements ActionHandler {

    private final AssigneeDirectory directory;
    private final RecordWriter writer;

    public AssignUserHandler(AssigneeDirectory directory, RecordWriter writer) {
        this.directory = directory;
        this.writer = writer;
    }

    @Override
    public ActionType type() {
        return ActionType.ASSIGN_USER;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        String userId = context.requireText("userId");
        UserProfile user = directory.findUser(userId)
            .filter(UserProfile::active)
            .orElseThrow(() -> new ActionException(ActionException.TARGET_NOT_FOUND,
                "No active user with id " + userId));
        return assign(writer, context, user.id());
    }

    static CaseRecord assign(RecordWriter writer, ActionContext context, String userId) {
        CaseRecord record = context.getRecord();
        if (Objects.equals(record.assigneeId(), userId)) {
            return record;
        }
        return writer.apply(
            record,
            b -> b.assigneeId(userId),
            RevisionActionType.ASSIGNEE_CHANGED,
            context.getActor().id(),
            String.format("Assigned to %s by %s action", userId, context.getAction().type()),
            RevisionSnapshots.change("assigneeId", record.assigneeId(), userId)
        );
    }
}
