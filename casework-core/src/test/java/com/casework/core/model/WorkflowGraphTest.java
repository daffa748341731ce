package com.casework.core.model;

import com.casework.core.exception.InvalidTopologyException;
import com.casework.core.matching.MatchConstraints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowGraphTest {

    private final Workflow workflow = Workflow.create(
        "INC-DEFAULT", "Incident default", RecordType.INCIDENT,
        MatchConstraints.none(), "admin", Instant.parse("2026-01-01T00:00:00Z"));

    private final WorkflowStateDefinition open =
        WorkflowStateDefinition.create(workflow.id(), "open", "Open", true, false, 4, 0);
    private final WorkflowStateDefinition inProgress =
        WorkflowStateDefinition.create(workflow.id(), "in_progress", "In progress", false, false, 24, 1);
    private final WorkflowStateDefinition resolved =
        WorkflowStateDefinition.create(workflow.id(), "resolved", "Resolved", false, true, null, 2);
    private final WorkflowStateDefinition orphan =
        WorkflowStateDefinition.create(workflow.id(), "orphan", "Orphan", false, false, null, 3);

    @Test
    @DisplayName("States without an inbound path from the initial state are reported unreachable")
    void unreachableStates() {
        var start = Transition.create(workflow.id(), "start", "Start",
            open.id(), inProgress.id(), List.of(), List.of(), Set.of());
        var resolve = Transition.create(workflow.id(), "resolve", "Resolve",
            inProgress.id(), resolved.id(), List.of(), List.of(), Set.of());

        var graph = new WorkflowGraph(workflow, List.of(open, inProgress, resolved, orphan), List.of(start, resolve));

        assertThat(graph.unreachableStates()).containsExactly(orphan);
        assertThat(graph.initialState()).isEqualTo(open);
        assertThat(graph.transitionsFrom(open.id())).containsExactly(start);
    }

    @Test
    @DisplayName("Inactive transitions do not make their target reachable")
    void inactiveTransitionsIgnoredForReachability() {
        var start = Transition.create(workflow.id(), "start", "Start",
            open.id(), inProgress.id(), List.of(), List.of(), Set.of()).withActive(false);

        var graph = new WorkflowGraph(workflow, List.of(open, inProgress), List.of(start));

        assertThat(graph.unreachableStates()).containsExactly(inProgress);
    }

    @Test
    @DisplayName("A graph without an initial state is an invalid topology")
    void missingInitialState() {
        var graph = new WorkflowGraph(workflow, List.of(inProgress, resolved), List.of());

        assertThatThrownBy(graph::initialState)
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("no initial state");
    }

    @Test
    @DisplayName("Two initial states are an invalid topology")
    void multipleInitialStates() {
        var secondInitial = WorkflowStateDefinition.create(workflow.id(), "new", "New", true, false, null, 5);
        var graph = new WorkflowGraph(workflow, List.of(open, secondInitial), List.of());

        assertThatThrownBy(graph::initialState)
            .isInstanceOf(InvalidTopologyException.class)
            .hasMessageContaining("2 initial states");
    }

    @Test
    void resolvedTerminalStateMarksResolution() {
        assertThat(resolved.isResolution()).isTrue();
        assertThat(inProgress.isResolution()).isFalse();
        assertThat(orphan.hasSla()).isFalse();
        assertThat(open.hasSla()).isTrue();
    }
}
