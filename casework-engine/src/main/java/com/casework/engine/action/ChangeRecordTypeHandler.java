package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;
import com.casework.core.model.RevisionActionType;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.revision.RevisionSnapshots;

import java.util.Locale;

/**
 * Reclassifies the record. Config: {@code {"recordType": "REQUEST"}}.
 * The record keeps its number and its workflow.
 */
public class ChangeRecordTypeHandler implements ActionHandler {

    private final RecordWriter writer;

    public ChangeRecordTypeHandler(RecordWriter writer) {
        this.writer = writer;
    }

    @Override
    public ActionType type() {
        return ActionType.CHANGE_RECORD_TYPE;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        String value = context.requireText("recordType");
        RecordType target;
        try {
            target = RecordType.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw ActionException.misconfigured(type(), "unknown record type " + value);
        }

        CaseRecord record = context.getRecord();
        if (record.recordType() == target) {
            return record;
        }
        return writer.apply(
            record,
            b -> b.recordType(target),
            RevisionActionType.RECORD_TYPE_CHANGED,
            context.getActor().id(),
            String.format("Record type changed from %s to %s", record.recordType(), target),
            RevisionSnapshots.change("recordType", record.recordType(), target)
        );
    }
}
