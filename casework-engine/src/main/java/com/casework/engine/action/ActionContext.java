package com.casework.engine.action;

import com.casework.core.model.ActionDefinition;
import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.WorkflowStateDefinition;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Context provided to action handlers during execution.
 */
public class ActionContext {

    private final CaseRecord record;
    private final ActionDefinition action;
    private final Transition transition;
    private final WorkflowStateDefinition fromState;
    private final WorkflowStateDefinition toState;
    private final Actor actor;
    private final TransitionPayload payload;

    public ActionContext(
            CaseRecord record,
            ActionDefinition action,
            Transition transition,
            WorkflowStateDefinition fromState,
            WorkflowStateDefinition toState,
            Actor actor,
            TransitionPayload payload) {
        this.record = record;
        this.action = action;
        this.transition = transition;
        this.fromState = fromState;
        this.toState = toState;
        this.actor = actor;
        this.payload = payload;
    }

    /**
     * Context for a committed transition, before any action is selected.
     */
    public static ActionContext afterTransition(
            CaseRecord record,
            Transition transition,
            WorkflowStateDefinition fromState,
            WorkflowStateDefinition toState,
            Actor actor,
            TransitionPayload payload) {
        return new ActionContext(record, null, transition, fromState, toState, actor, payload);
    }

    /**
     * Same transition, narrowed to one action and the record as it stands now.
     */
    public ActionContext forAction(ActionDefinition nextAction, CaseRecord current) {
        return new ActionContext(current, nextAction, transition, fromState, toState, actor, payload);
    }

    public CaseRecord getRecord() {
        return record;
    }

    public ActionDefinition getAction() {
        return action;
    }

    public Transition getTransition() {
        return transition;
    }

    public WorkflowStateDefinition getFromState() {
        return fromState;
    }

    public WorkflowStateDefinition getToState() {
        return toState;
    }

    public Actor getActor() {
        return actor;
    }

    public TransitionPayload getPayload() {
        return payload;
    }

    public JsonNode getConfig() {
        return action.config();
    }

    /**
     * A non-blank text value from the action's config.
     *
     * @throws ActionException if the key is missing or blank
     */
    public String requireText(String key) throws ActionException {
        String value = optionalText(key);
        if (value == null) {
            throw ActionException.misconfigured(action.type(), "'" + key + "' is required");
        }
        return value;
    }

    /**
     * A text value from the action's config, or null when missing or blank.
     */
    public String optionalText(String key) {
        JsonNode node = getConfig().get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
