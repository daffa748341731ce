package com.casework.engine.transition;

import com.casework.core.model.Actor;
import com.casework.core.model.AvailableTransition;
import com.casework.core.model.TransitionHistoryEntry;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionRequest;

import java.util.List;
import java.util.UUID;

/**
 * Moves records between workflow states.
 * This is the only path through which a record's current state changes.
 */
public interface TransitionService {

    /**
     * Execute a transition on a record.
     *
     * @param request the record, transition, expected version, caller and payload
     * @return the record after the transition and its actions, with a warning per failed action
     * @throws com.casework.core.exception.NotFoundException if the record does not exist
     * @throws com.casework.core.exception.StaleVersionException if the record moved past the expected version
     * @throws com.casework.core.exception.TransitionNotFoundException if the transition is unknown to the record's workflow
     * @throws com.casework.core.exception.InvalidTopologyException if the transition does not start at the current state
     * @throws com.casework.core.exception.TerminalStateException if the record is in a terminal state
     * @throws com.casework.core.exception.ForbiddenException if the caller holds none of the allowed roles
     * @throws com.casework.core.exception.RequirementsNotMetException if the payload fails the transition's requirements
     */
    TransitionOutcome executeTransition(TransitionRequest request);

    /**
     * Transitions the actor may execute from the record's current state.
     *
     * @param recordId the record
     * @param actor the caller
     * @return active, permitted transitions in sort order; empty in a terminal state
     */
    List<AvailableTransition> availableTransitions(UUID recordId, Actor actor);

    /**
     * Executed transitions of a record, oldest first.
     */
    List<TransitionHistoryEntry> historyOf(UUID recordId);
}
