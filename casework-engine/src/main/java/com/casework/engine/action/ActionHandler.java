package com.casework.engine.action;

import com.casework.core.model.ActionType;
import com.casework.core.model.CaseRecord;

/**
 * Implementation of one action type.
 * Handlers persist their own changes and return the record as it now stands.
 */
public interface ActionHandler {

    ActionType type();

    /**
     * Execute the action.
     *
     * @param context the record, the transition that fired and the action's config
     * @return the record after the action, or the same record when nothing changed
     * @throws ActionException if the action cannot be carried out
     */
    CaseRecord execute(ActionContext context) throws ActionException;
}
