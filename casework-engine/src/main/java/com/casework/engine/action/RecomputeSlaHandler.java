package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RevisionActionType;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.revision.RevisionSnapshots;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Restarts the SLA clock and clears the breach flag.
 * Config: {@code {"hours": 8}}; without hours the target state's SLA applies.
 */
public class RecomputeSlaHandler implements ActionHandler {

    private final RecordWriter writer;
    private final Clock clock;

    public RecomputeSlaHandler(RecordWriter writer, Clock clock) {
        this.writer = writer;
        this.clock = clock;
    }

    @Override
    public ActionType type() {
        return ActionType.RECOMPUTE_SLA;
    }

    @Override
    public CaseRecord execute(ActionContext context) throws ActionException {
        int hours = hours(context);
        CaseRecord record = context.getRecord();
        Instant dueAt = clock.instant().plus(Duration.ofHours(hours));
        return writer.apply(
            record,
            b -> b.slaDueAt(dueAt).slaBreached(false),
            RevisionActionType.FIELD_CHANGED,
            context.getActor().id(),
            String.format("SLA recomputed: due in %d hours", hours),
            RevisionSnapshots.change("slaDueAt", record.slaDueAt(), dueAt)
        );
    }

    private int hours(ActionContext context) throws ActionException {
        var configured = context.getConfig().get("hours");
        if (configured != null && !configured.isNull()) {
            if (!configured.canConvertToInt() || configured.asInt() <= 0) {
                throw ActionException.misconfigured(type(), "'hours' must be a positive integer");
            }
            return configured.asInt();
        }
        if (context.getToState() == null || !context.getToState().hasSla()) {
            throw ActionException.misconfigured(type(), "no 'hours' given and the target state has no SLA");
        }
        return context.getToState().slaHours();
    }
}
