package com.casework.core.repository;

import com.casework.core.model.RecordType;
import com.casework.core.model.Transition;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage for workflow definitions, their states and their transitions.
 * Definitions are read-mostly; readers never see a partially written transition.
 */
public interface WorkflowRepository {

    /**
     * Save a new workflow.
     *
     * @throws com.casework.core.exception.WorkflowValidationException if the code is taken
     */
    void saveWorkflow(Workflow workflow);

    void updateWorkflow(Workflow workflow);

    Optional<Workflow> findWorkflow(UUID workflowId);

    Optional<Workflow> findWorkflowByCode(String code);

    /**
     * All workflows regardless of lifecycle, optionally narrowed to one record type.
     *
     * @param recordType the record type, or null for all
     */
    List<Workflow> findWorkflows(RecordType recordType);

    /**
     * Remove a workflow together with its states and transitions.
     */
    void deleteWorkflow(UUID workflowId);

    void saveState(WorkflowStateDefinition state);

    void updateState(WorkflowStateDefinition state);

    void deleteState(UUID stateId);

    Optional<WorkflowStateDefinition> findState(UUID stateId);

    List<WorkflowStateDefinition> findStates(UUID workflowId);

    void saveTransition(Transition transition);

    void updateTransition(Transition transition);

    void deleteTransition(UUID transitionId);

    Optional<Transition> findTransition(UUID transitionId);

    List<Transition> findTransitions(UUID workflowId);

    /**
     * Transitions leaving the given state, ordered by sort order.
     */
    List<Transition> findTransitionsFrom(UUID stateId);
}
