package com.casework.core.model;

import com.casework.core.exception.InvalidTopologyException;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A workflow together with its states and transitions.
 */
public record WorkflowGraph(
    Workflow workflow,
    List<WorkflowStateDefinition> states,
    List<Transition> transitions
) {
    public WorkflowGraph {
        states = states.stream()
            .sorted(Comparator.comparingInt(WorkflowStateDefinition::sortOrder))
            .toList();
        transitions = transitions.stream()
            .sorted(Comparator.comparingInt(Transition::sortOrder))
            .toList();
    }

    public Optional<WorkflowStateDefinition> state(UUID stateId) {
        return states.stream().filter(s -> s.id().equals(stateId)).findFirst();
    }

    public Optional<WorkflowStateDefinition> stateByCode(String code) {
        return states.stream().filter(s -> s.code().equals(code)).findFirst();
    }

    /**
     * The single initial state.
     *
     * @throws InvalidTopologyException if there is none or more than one
     */
    public WorkflowStateDefinition initialState() {
        var initial = states.stream().filter(WorkflowStateDefinition::initial).toList();
        if (initial.isEmpty()) {
            throw InvalidTopologyException.noInitialState(workflow.id());
        }
        if (initial.size() > 1) {
            throw new InvalidTopologyException(String.format(
                "Workflow %s has %d initial states", workflow.code(), initial.size()
            ));
        }
        return initial.get(0);
    }

    public List<Transition> transitionsFrom(UUID stateId) {
        return transitions.stream()
            .filter(t -> t.fromStateId().equals(stateId))
            .toList();
    }

    /**
     * States that cannot be reached from the initial state along active transitions.
     */
    public List<WorkflowStateDefinition> unreachableStates() {
        var start = initialState();
        Set<UUID> visited = new HashSet<>();
        Deque<UUID> queue = new ArrayDeque<>();
        queue.add(start.id());
        visited.add(start.id());

        while (!queue.isEmpty()) {
            UUID current = queue.poll();
            for (Transition transition : transitionsFrom(current)) {
                if (transition.active() && visited.add(transition.toStateId())) {
                    queue.add(transition.toStateId());
                }
            }
        }

        return states.stream()
            .filter(s -> !visited.contains(s.id()))
            .toList();
    }
}
