package com.casework.engine.portability;

import com.casework.core.matching.MatchDimension;
import com.casework.core.model.ActionType;
import com.casework.core.model.RecordType;
import com.casework.core.model.RequirementKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Portable form of a workflow. States are referenced by code instead of id so that an
 * export from one installation imports cleanly into another.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkflowExport(
    String exportVersion,
    Instant exportedAt,
    ExportedWorkflow workflow
) {
    public static final String CURRENT_VERSION = "1.0";

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportedWorkflow(
        String code,
        String name,
        String description,
        RecordType recordType,
        List<String> requiredFields,
        Map<MatchDimension, Set<String>> constraints,
        List<ExportedState> states,
        List<ExportedTransition> transitions
    ) {
        public ExportedWorkflow {
            requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
            constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
            states = states == null ? List.of() : List.copyOf(states);
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportedState(
        String code,
        String name,
        boolean initial,
        boolean terminal,
        Integer slaHours,
        int sortOrder
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportedTransition(
        String code,
        String name,
        String fromStateCode,
        String toStateCode,
        Set<String> allowedRoles,
        List<ExportedRequirement> requirements,
        List<ExportedAction> actions,
        boolean active,
        int sortOrder
    ) {
        public ExportedTransition {
            allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
            requirements = requirements == null ? List.of() : List.copyOf(requirements);
            actions = actions == null ? List.of() : List.copyOf(actions);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportedRequirement(
        RequirementKind kind,
        String fieldName,
        int minCount,
        String errorMessage,
        boolean mandatory
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportedAction(
        ActionType type,
        int executionOrder,
        boolean active,
        JsonNode config
    ) {
    }
}
