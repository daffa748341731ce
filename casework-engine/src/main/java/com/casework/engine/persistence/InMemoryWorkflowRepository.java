package com.casework.engine.persistence;

import com.casework.core.exception.WorkflowValidationException;
import com.casework.core.model.RecordType;
import com.casework.core.model.Transition;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.repository.WorkflowRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of WorkflowRepository.
 * Stored values are immutable records, so readers never observe a partial write.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<UUID, Workflow> workflows = new ConcurrentHashMap<>();
    private final Map<UUID, WorkflowStateDefinition> states = new ConcurrentHashMap<>();
    private final Map<UUID, Transition> transitions = new ConcurrentHashMap<>();

    @Override
    public synchronized void saveWorkflow(Workflow workflow) {
        if (findWorkflowByCode(workflow.code()).isPresent()) {
            throw new WorkflowValidationException("code", "already in use: " + workflow.code());
        }
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public void updateWorkflow(Workflow workflow) {
        workflows.put(workflow.id(), workflow);
    }

    @Override
    public Optional<Workflow> findWorkflow(UUID workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public Optional<Workflow> findWorkflowByCode(String code) {
        return workflows.values().stream()
            .filter(w -> w.code().equals(code))
            .findFirst();
    }

    @Override
    public List<Workflow> findWorkflows(RecordType recordType) {
        return workflows.values().stream()
            .filter(w -> recordType == null || w.recordType() == recordType)
            .sorted(Comparator.comparing(Workflow::code))
            .toList();
    }

    @Override
    public void deleteWorkflow(UUID workflowId) {
        transitions.values().removeIf(t -> t.workflowId().equals(workflowId));
        states.values().removeIf(s -> s.workflowId().equals(workflowId));
        workflows.remove(workflowId);
    }

    @Override
    public void saveState(WorkflowStateDefinition state) {
        states.put(state.id(), state);
    }

    @Override
    public void updateState(WorkflowStateDefinition state) {
        states.put(state.id(), state);
    }

    @Override
    public void deleteState(UUID stateId) {
        states.remove(stateId);
    }

    @Override
    public Optional<WorkflowStateDefinition> findState(UUID stateId) {
        return Optional.ofNullable(states.get(stateId));
    }

    @Override
    public List<WorkflowStateDefinition> findStates(UUID workflowId) {
        return states.values().stream()
            .filter(s -> s.workflowId().equals(workflowId))
            .sorted(Comparator.comparingInt(WorkflowStateDefinition::sortOrder))
            .toList();
    }

    @Override
    public void saveTransition(Transition transition) {
        transitions.put(transition.id(), transition);
    }

    @Override
    public void updateTransition(Transition transition) {
        transitions.put(transition.id(), transition);
    }

    @Override
    public void deleteTransition(UUID transitionId) {
        transitions.remove(transitionId);
    }

    @Override
    public Optional<Transition> findTransition(UUID transitionId) {
        return Optional.ofNullable(transitions.get(transitionId));
    }

    @Override
    public List<Transition> findTransitions(UUID workflowId) {
        return transitions.values().stream()
            .filter(t -> t.workflowId().equals(workflowId))
            .sorted(Comparator.comparingInt(Transition::sortOrder))
            .toList();
    }

    @Override
    public List<Transition> findTransitionsFrom(UUID stateId) {
        return transitions.values().stream()
            .filter(t -> t.fromStateId().equals(stateId))
            .sorted(Comparator.comparingInt(Transition::sortOrder))
            .toList();
    }
}
