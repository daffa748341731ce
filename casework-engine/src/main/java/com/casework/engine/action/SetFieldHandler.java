package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RevisionActionType;
import com.casework.engine.record.RecordFields;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.revision.RevisionSnapshots;

import java.util.Objects;

/**
 * Writes a fixed value into a record field. Config: {@code {"field": "priority", "value": "P1"}}.
 * A missing value clears the field.
 */
public class SetFieldHandler implements ActionHandler {

    private final RecordWriter writer;

    public SetFieldHandler(RecordWriter writer) {
        this.writer = writer;
    }

    @Override
    public ActionType type() {
        return ActionType.SET_FIELD;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        String field = context.requireText("field");
        if (RecordFields.isProtected(field)) {
            throw ActionException.misconfigured(type(), "field '" + field + "' cannot be set by an action");
        }
        String value = context.optionalText("value");
        CaseRecord record = context.getRecord();
        String previous = record.fieldValue(field);
        if (Objects.equals(previous, value)) {
            return record;
        }
        return writer.apply(
            record,
            b -> RecordFields.set(b, field, value),
            RevisionActionType.FIELD_CHANGED,
            context.getActor().id(),
            String.format("Field %s set by transition %s", field, context.getTransition().code()),
            RevisionSnapshots.change(field, previous, value)
        );
    }
}
