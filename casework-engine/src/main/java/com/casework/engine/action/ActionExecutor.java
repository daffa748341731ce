package com.casework.engine.action;

import com.casework.core.model.ActionDefinition;
import com.casework.core.model.ActionType;
import com.casework.core.model.ActionWarning;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RevisionActionType;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.revision.RevisionSnapshots;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a transition's actions, in execution order, after the transition has committed.
 *
 * <p>Each action persists its own change. A failing action is logged, recorded as an
 * ACTION_FAILED revision and reported as a warning; the remaining actions still run and
 * the transition is never rolled back.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);

    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);
    private final RevisionLogService revisions;
    private final CaseRecordRepository records;
    private final CaseMetrics metrics;

    public ActionExecutor(
            Collection<? extends ActionHandler> handlers,
            RevisionLogService revisions,
            CaseRecordRepository records,
            CaseMetrics metrics) {
        for (ActionHandler handler : handlers) {
            ActionHandler previous = this.handlers.put(handler.type(), handler);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate handler for action type " + handler.type());
            }
        }
        this.revisions = revisions;
        this.records = records;
        this.metrics = metrics;
    }

    /**
     * @param context context of the committed transition, carrying the record as committed
     * @return the record after the last action and a warning per failed action
     */
    public ActionRun executeAll(ActionContext context) {
        CaseRecord current = context.getRecord();
        List<ActionWarning> warnings = new ArrayList<>();

        for (ActionDefinition action : context.getTransition().orderedActions()) {
            ActionHandler handler = handlers.get(action.type());
            try {
                if (handler == null) {
                    throw new ActionException(ActionException.MISCONFIGURED,
                        "No handler registered for action type " + action.type());
                }
                current = handler.execute(context.forAction(action, current));
                log.debug("Action {} ({}) completed on record {}", action.id(), action.type(), current.id());
            } catch (ActionException | RuntimeException e) {
                warnings.add(recordFailure(action, current, context, e));
                current = reload(current);
            }
        }
        return new ActionRun(current, warnings);
    }

    private ActionWarning recordFailure(
            ActionDefinition action,
            CaseRecord record,
            ActionContext context,
            Exception failure) {
        log.warn("Action {} ({}) failed on record {}: {}",
            action.id(), action.type(), record.id(), failure.getMessage(), failure);
        metrics.actionFailed(action.type().name());

        ObjectNode snapshot = RevisionSnapshots.object();
        RevisionSnapshots.put(snapshot, "actionId", action.id());
        RevisionSnapshots.put(snapshot, "actionType", action.type());
        RevisionSnapshots.put(snapshot, "transitionId", context.getTransition().id());
        RevisionSnapshots.put(snapshot, "error", failure.getMessage());
        if (failure instanceof ActionException actionFailure) {
            RevisionSnapshots.put(snapshot, "errorCode", actionFailure.getErrorCode());
        }
        try {
            revisions.append(record.id(), RevisionActionType.ACTION_FAILED, context.getActor().id(),
                String.format("Action %s failed: %s", action.type(), failure.getMessage()), snapshot);
        } catch (RuntimeException e) {
            log.error("Could not record failure of action {} on record {}", action.id(), record.id(), e);
        }
        return new ActionWarning(action.id(), action.type(), failure.getMessage());
    }

    // A failed action may have lost a version race; continue from what is stored
    private CaseRecord reload(CaseRecord record) {
        try {
            return records.findById(record.id()).orElse(record);
        } catch (RuntimeException e) {
            log.error("Could not reload record {} after action failure", record.id(), e);
            return record;
        }
    }

    /**
     * Result of running a transition's actions.
     */
    public record ActionRun(CaseRecord record, List<ActionWarning> warnings) {
        public ActionRun {
            warnings = List.copyOf(warnings);
        }
    }
}
