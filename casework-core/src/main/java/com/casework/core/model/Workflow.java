package com.casework.core.model;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.Matchable;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Organization-defined workflow for one record type.
 *
 * Invariants:
 * - code is unique across workflows
 * - at most one ACTIVE default workflow per record type
 * - states and transitions are stored separately and reference this workflow by id
 */
public record Workflow(
    UUID id,
    String code,
    String name,
    String description,
    RecordType recordType,
    boolean active,
    boolean defaultForType,
    WorkflowLifecycle lifecycle,
    MatchConstraints constraints,
    List<String> requiredFields,
    String createdBy,
    Instant createdAt,
    Instant updatedAt
) implements Matchable {

    public Workflow {
        constraints = constraints == null ? MatchConstraints.none() : constraints;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
    }

    public static Workflow create(
            String code,
            String name,
            RecordType recordType,
            MatchConstraints constraints,
            String createdBy,
            Instant now) {
        return new Workflow(
            UUID.randomUUID(),
            code,
            name,
            null,
            recordType,
            true,
            false,
            WorkflowLifecycle.ACTIVE,
            constraints,
            List.of(),
            createdBy,
            now,
            now
        );
    }

    @Override
    public String matchId() {
        return id.toString();
    }

    /**
     * Eligible for matching and record creation.
     */
    public boolean isSelectable() {
        return active && lifecycle == WorkflowLifecycle.ACTIVE;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID id;
        private String code;
        private String name;
        private String description;
        private RecordType recordType;
        private boolean active;
        private boolean defaultForType;
        private WorkflowLifecycle lifecycle;
        private MatchConstraints constraints;
        private List<String> requiredFields;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder(Workflow workflow) {
            this.id = workflow.id();
            this.code = workflow.code();
            this.name = workflow.name();
            this.description = workflow.description();
            this.recordType = workflow.recordType();
            this.active = workflow.active();
            this.defaultForType = workflow.defaultForType();
            this.lifecycle = workflow.lifecycle();
            this.constraints = workflow.constraints();
            this.requiredFields = workflow.requiredFields();
            this.createdBy = workflow.createdBy();
            this.createdAt = workflow.createdAt();
            this.updatedAt = workflow.updatedAt();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder recordType(RecordType recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder defaultForType(boolean defaultForType) {
            this.defaultForType = defaultForType;
            return this;
        }

        public Builder lifecycle(WorkflowLifecycle lifecycle) {
            this.lifecycle = lifecycle;
            return this;
        }

        public Builder constraints(MatchConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder requiredFields(List<String> requiredFields) {
            this.requiredFields = requiredFields;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Workflow build() {
            return new Workflow(
                id, code, name, description, recordType, active, defaultForType,
                lifecycle, constraints, requiredFields, createdBy, createdAt, updatedAt
            );
        }
    }
}
