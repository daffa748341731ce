package com.casework.engine.definition;

import com.casework.core.exception.HasDependentRecordsException;
import com.casework.core.exception.InvalidTopologyException;
import com.casework.core.exception.LifecycleTransitionException;
import com.casework.core.exception.NotFoundException;
import com.casework.core.exception.TransitionNotFoundException;
import com.casework.core.exception.WorkflowValidationException;
import com.casework.core.matching.MatchConstraints;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.Actor;
import com.casework.core.model.RecordType;
import com.casework.core.model.Requirement;
import com.casework.core.model.Transition;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowGraph;
import com.casework.core.model.WorkflowLifecycle;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.core.repository.WorkflowRepository;
import com.casework.engine.logging.LoggingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Stores and queries workflow definitions: workflows, their states and their transitions.
 *
 * <p>Structural rules enforced on write:
 * <ul>
 *   <li>at most one initial state per workflow</li>
 *   <li>transition endpoints belong to the transition's workflow</li>
 *   <li>at most one active default workflow per record type</li>
 * </ul>
 * A workflow with no initial state is still storable; it fails when a record is created
 * against it or when {@link #validate(UUID)} runs.
 */
public class WorkflowDefinitionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDefinitionService.class);

    static final String COPY_NAME_SUFFIX = " (Copy)";
    static final String COPY_CODE_SUFFIX = "-COPY";

    private final WorkflowRepository workflows;
    private final CaseRecordRepository records;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public WorkflowDefinitionService(
            WorkflowRepository workflows,
            CaseRecordRepository records,
            UnitOfWork unitOfWork,
            Clock clock) {
        this.workflows = workflows;
        this.records = records;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    // ========== Workflows ==========

    public Workflow createWorkflow(WorkflowDraft draft, Actor actor) {
        validateDraft(draft);
        Instant now = clock.instant();
        Workflow workflow = new Workflow(
            UUID.randomUUID(),
            draft.code(),
            draft.name(),
            draft.description(),
            draft.recordType(),
            draft.active(),
            draft.defaultForType(),
            WorkflowLifecycle.ACTIVE,
            draft.constraints(),
            draft.requiredFields(),
            actor.id(),
            now,
            now
        );

        unitOfWork.run(() -> {
            ensureSingleDefault(workflow);
            workflows.saveWorkflow(workflow);
        });

        try (var ctx = LoggingContext.forWorkflow(workflow.id(), actor.id())) {
            log.info("Created workflow {} for {}", workflow.code(), workflow.recordType());
        }
        return workflow;
    }

    public Workflow updateWorkflow(UUID workflowId, WorkflowDraft draft, Actor actor) {
        validateDraft(draft);
        Workflow existing = getWorkflow(workflowId);
        Workflow updated = existing.toBuilder()
            .code(draft.code())
            .name(draft.name())
            .description(draft.description())
            .recordType(draft.recordType())
            .active(draft.active())
            .defaultForType(draft.defaultForType())
            .constraints(draft.constraints())
            .requiredFields(draft.requiredFields())
            .updatedAt(clock.instant())
            .build();

        unitOfWork.run(() -> {
            if (!existing.code().equals(updated.code()) && workflows.findWorkflowByCode(updated.code()).isPresent()) {
                throw new WorkflowValidationException("code", "already in use: " + updated.code());
            }
            ensureSingleDefault(updated);
            workflows.updateWorkflow(updated);
        });

        log.info("Updated workflow {} by {}", updated.code(), actor.id());
        return updated;
    }

    /**
     * @throws NotFoundException if the workflow does not exist
     */
    public Workflow getWorkflow(UUID workflowId) {
        return workflows.findWorkflow(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    /**
     * Workflows that are not soft-deleted.
     *
     * @param recordType narrow to one record type, or null for all
     * @param activeOnly only workflows whose active flag is set
     */
    public List<Workflow> listWorkflows(RecordType recordType, boolean activeOnly) {
        return workflows.findWorkflows(recordType).stream()
            .filter(w -> w.lifecycle() == WorkflowLifecycle.ACTIVE)
            .filter(w -> !activeOnly || w.active())
            .toList();
    }

    public List<Workflow> listDeletedWorkflows() {
        return workflows.findWorkflows(null).stream()
            .filter(w -> w.lifecycle() == WorkflowLifecycle.SOFT_DELETED)
            .toList();
    }

    // ========== States ==========

    public WorkflowStateDefinition addState(UUID workflowId, StateDraft draft) {
        validateDraft(draft);
        getWorkflow(workflowId);
        WorkflowStateDefinition state = new WorkflowStateDefinition(
            UUID.randomUUID(), workflowId, draft.code(), draft.name(),
            draft.initial(), draft.terminal(), draft.slaHours(), draft.sortOrder());

        unitOfWork.run(() -> {
            checkStatePlacement(state);
            workflows.saveState(state);
        });
        log.debug("Added state {} to workflow {}", state.code(), workflowId);
        return state;
    }

    public WorkflowStateDefinition updateState(UUID stateId, StateDraft draft) {
        validateDraft(draft);
        WorkflowStateDefinition existing = getState(stateId);
        WorkflowStateDefinition updated = new WorkflowStateDefinition(
            existing.id(), existing.workflowId(), draft.code(), draft.name(),
            draft.initial(), draft.terminal(), draft.slaHours(), draft.sortOrder());

        unitOfWork.run(() -> {
            checkStatePlacement(updated);
            workflows.updateState(updated);
        });
        return updated;
    }

    /**
     * Remove a state that no transition references.
     *
     * @throws InvalidTopologyException if a transition still starts or ends at the state
     */
    public void removeState(UUID stateId) {
        WorkflowStateDefinition state = getState(stateId);
        boolean referenced = workflows.findTransitions(state.workflowId()).stream()
            .anyMatch(t -> t.fromStateId().equals(stateId) || t.toStateId().equals(stateId));
        if (referenced) {
            throw new InvalidTopologyException(String.format(
                "State '%s' is still used by transitions; remove them first", state.code()));
        }
        workflows.deleteState(stateId);
    }

    public WorkflowStateDefinition getState(UUID stateId) {
        return workflows.findState(stateId)
            .orElseThrow(() -> new NotFoundException("State", stateId));
    }

    // ========== Transitions ==========

    public Transition addTransition(UUID workflowId, TransitionDraft draft) {
        validateDraft(draft);
        getWorkflow(workflowId);
        checkEndpoints(workflowId, draft.fromStateId(), draft.toStateId());

        Transition transition = new Transition(
            UUID.randomUUID(), workflowId, draft.code(), draft.name(),
            draft.fromStateId(), draft.toStateId(),
            draft.requirements(), withIds(draft.actions()), draft.allowedRoles(),
            draft.active(), draft.sortOrder());
        workflows.saveTransition(transition);
        log.debug("Added transition {} to workflow {}", transition.code(), workflowId);
        return transition;
    }

    public Transition updateTransition(UUID transitionId, TransitionDraft draft) {
        validateDraft(draft);
        Transition existing = getTransition(transitionId);
        checkEndpoints(existing.workflowId(), draft.fromStateId(), draft.toStateId());

        Transition updated = new Transition(
            existing.id(), existing.workflowId(), draft.code(), draft.name(),
            draft.fromStateId(), draft.toStateId(),
            draft.requirements(), withIds(draft.actions()), draft.allowedRoles(),
            draft.active(), draft.sortOrder());
        workflows.updateTransition(updated);
        return updated;
    }

    public void removeTransition(UUID transitionId) {
        getTransition(transitionId);
        workflows.deleteTransition(transitionId);
    }

    /**
     * @throws TransitionNotFoundException if the transition does not exist
     */
    public Transition getTransition(UUID transitionId) {
        return workflows.findTransition(transitionId)
            .orElseThrow(() -> new TransitionNotFoundException(transitionId));
    }

    // ========== Graph queries ==========

    /**
     * @throws InvalidTopologyException if the workflow has no single initial state
     */
    public WorkflowStateDefinition initialStateOf(UUID workflowId) {
        return graphOf(workflowId).initialState();
    }

    public List<Transition> transitionsFrom(UUID stateId) {
        return workflows.findTransitionsFrom(stateId);
    }

    public List<Transition> transitionsOf(UUID workflowId) {
        return workflows.findTransitions(workflowId);
    }

    public WorkflowGraph graphOf(UUID workflowId) {
        Workflow workflow = getWorkflow(workflowId);
        return new WorkflowGraph(workflow, workflows.findStates(workflowId), workflows.findTransitions(workflowId));
    }

    /**
     * Check a workflow's structure.
     *
     * @return warnings for issues that do not prevent use
     * @throws InvalidTopologyException if the workflow has no states or no single initial state
     */
    public ValidationReport validate(UUID workflowId) {
        WorkflowGraph graph = graphOf(workflowId);
        if (graph.states().isEmpty()) {
            throw new InvalidTopologyException("Workflow has no states: " + graph.workflow().code());
        }
        graph.initialState();

        List<String> warnings = new ArrayList<>();
        for (WorkflowStateDefinition state : graph.unreachableStates()) {
            warnings.add(String.format("State '%s' is unreachable from the initial state", state.code()));
        }
        if (graph.states().stream().noneMatch(WorkflowStateDefinition::terminal)) {
            warnings.add("Workflow has no terminal state");
        }
        for (WorkflowStateDefinition state : graph.states()) {
            if (state.terminal() && !graph.transitionsFrom(state.id()).isEmpty()) {
                warnings.add(String.format("Terminal state '%s' has outgoing transitions that can never run", state.code()));
            }
        }
        return new ValidationReport(workflowId, warnings);
    }

    // ========== Lifecycle ==========

    /**
     * Hide a workflow from matching and listings. Existing records keep working.
     */
    public Workflow softDelete(UUID workflowId, Actor actor) {
        Workflow updated = changeLifecycle(getWorkflow(workflowId), WorkflowLifecycle.SOFT_DELETED);
        log.info("Soft-deleted workflow {} by {}", updated.code(), actor.id());
        return updated;
    }

    /**
     * Bring back a soft-deleted workflow. If another default now exists for the
     * record type, the restored workflow comes back without its default flag.
     */
    public Workflow restore(UUID workflowId, Actor actor) {
        Workflow workflow = getWorkflow(workflowId);
        if (workflow.defaultForType() && otherActiveDefaultExists(workflow)) {
            log.warn("Restoring workflow {} without default flag: another default exists for {}",
                workflow.code(), workflow.recordType());
            workflow = workflow.toBuilder().defaultForType(false).build();
        }
        Workflow updated = changeLifecycle(workflow, WorkflowLifecycle.ACTIVE);
        log.info("Restored workflow {} by {}", updated.code(), actor.id());
        return updated;
    }

    /**
     * Permanently remove a soft-deleted workflow with its states and transitions.
     *
     * @throws HasDependentRecordsException if any record still references it
     */
    public void purge(UUID workflowId, Actor actor) {
        Workflow workflow = getWorkflow(workflowId);
        if (!workflow.lifecycle().canTransitionTo(WorkflowLifecycle.PURGED)) {
            throw new LifecycleTransitionException(workflow.lifecycle(), WorkflowLifecycle.PURGED);
        }
        unitOfWork.run(() -> {
            long dependents = records.countByWorkflow(workflowId);
            if (dependents > 0) {
                throw new HasDependentRecordsException(workflowId, dependents);
            }
            workflows.deleteWorkflow(workflowId);
        });
        log.info("Purged workflow {} by {}", workflow.code(), actor.id());
    }

    /**
     * Deep-copy a workflow with fresh ids, keeping its topology.
     * The copy is inactive and never the default.
     */
    public Workflow duplicate(UUID workflowId, Actor actor) {
        WorkflowGraph source = graphOf(workflowId);
        Instant now = clock.instant();

        Workflow copy = source.workflow().toBuilder()
            .id(UUID.randomUUID())
            .code(availableCode(source.workflow().code() + COPY_CODE_SUFFIX))
            .name(source.workflow().name() + COPY_NAME_SUFFIX)
            .active(false)
            .defaultForType(false)
            .lifecycle(WorkflowLifecycle.ACTIVE)
            .createdBy(actor.id())
            .createdAt(now)
            .updatedAt(now)
            .build();

        unitOfWork.run(() -> {
            workflows.saveWorkflow(copy);
            Map<UUID, UUID> stateIds = new HashMap<>();
            for (WorkflowStateDefinition state : source.states()) {
                WorkflowStateDefinition copied = state.withWorkflowId(copy.id());
                stateIds.put(state.id(), copied.id());
                workflows.saveState(copied);
            }
            for (Transition transition : source.transitions()) {
                workflows.saveTransition(transition.copyInto(
                    copy.id(),
                    stateIds.get(transition.fromStateId()),
                    stateIds.get(transition.toStateId())));
            }
        });

        log.info("Duplicated workflow {} as {} by {}", source.workflow().code(), copy.code(), actor.id());
        return copy;
    }

    /**
     * First of {@code base}, {@code base-2}, {@code base-3}, ... not used by any workflow.
     */
    public String availableCode(String base) {
        String candidate = base;
        int suffix = 2;
        while (workflows.findWorkflowByCode(candidate).isPresent()) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    // ========== Helpers ==========

    private Workflow changeLifecycle(Workflow workflow, WorkflowLifecycle target) {
        if (!workflow.lifecycle().canTransitionTo(target)) {
            throw new LifecycleTransitionException(workflow.lifecycle(), target);
        }
        Workflow updated = workflow.toBuilder()
            .lifecycle(target)
            .updatedAt(clock.instant())
            .build();
        workflows.updateWorkflow(updated);
        return updated;
    }

    private void ensureSingleDefault(Workflow workflow) {
        if (workflow.defaultForType() && otherActiveDefaultExists(workflow)) {
            throw new WorkflowValidationException("defaultForType",
                "another active default workflow exists for " + workflow.recordType());
        }
    }

    private boolean otherActiveDefaultExists(Workflow workflow) {
        return workflows.findWorkflows(workflow.recordType()).stream()
            .filter(w -> !w.id().equals(workflow.id()))
            .anyMatch(w -> w.defaultForType() && w.lifecycle() == WorkflowLifecycle.ACTIVE);
    }

    private void checkStatePlacement(WorkflowStateDefinition state) {
        List<WorkflowStateDefinition> siblings = workflows.findStates(state.workflowId()).stream()
            .filter(s -> !s.id().equals(state.id()))
            .toList();
        if (siblings.stream().anyMatch(s -> s.code().equals(state.code()))) {
            throw new WorkflowValidationException("code", "state code already used in workflow: " + state.code());
        }
        if (state.initial() && siblings.stream().anyMatch(WorkflowStateDefinition::initial)) {
            throw new InvalidTopologyException("Workflow already has an initial state; only one is allowed");
        }
    }

    private void checkEndpoints(UUID workflowId, UUID fromStateId, UUID toStateId) {
        for (UUID stateId : new UUID[] {fromStateId, toStateId}) {
            WorkflowStateDefinition state = getState(stateId);
            if (!state.workflowId().equals(workflowId)) {
                throw new InvalidTopologyException(String.format(
                    "State %s belongs to workflow %s, not %s", stateId, state.workflowId(), workflowId));
            }
        }
    }

    private static List<ActionDefinition> withIds(List<ActionDefinition> actions) {
        return actions.stream()
            .map(a -> a.id() != null ? a : new ActionDefinition(UUID.randomUUID(), a.type(), a.executionOrder(), a.active(), a.config()))
            .toList();
    }

    private static void validateDraft(WorkflowDraft draft) {
        requireText(draft.code(), "code");
        requireText(draft.name(), "name");
        if (draft.recordType() == null) {
            throw new WorkflowValidationException("recordType", "is required");
        }
    }

    private static void validateDraft(StateDraft draft) {
        requireText(draft.code(), "code");
        requireText(draft.name(), "name");
        if (draft.slaHours() != null && draft.slaHours() < 0) {
            throw new WorkflowValidationException("slaHours", "must not be negative");
        }
    }

    private static void validateDraft(TransitionDraft draft) {
        requireText(draft.code(), "code");
        requireText(draft.name(), "name");
        if (draft.fromStateId() == null || draft.toStateId() == null) {
            throw new WorkflowValidationException("fromStateId/toStateId", "both endpoints are required");
        }
        for (Requirement requirement : draft.requirements()) {
            switch (requirement.kind()) {
                case FIELD_NOT_EMPTY -> requireText(requirement.fieldName(), "requirements.fieldName");
                case MIN_ATTACHMENTS -> {
                    if (requirement.minCount() < 1) {
                        throw new WorkflowValidationException("requirements.minCount", "must be at least 1");
                    }
                }
                default -> {
                }
            }
        }
        for (ActionDefinition action : draft.actions()) {
            if (action.type() == null) {
                throw new WorkflowValidationException("actions.type", "is required");
            }
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new WorkflowValidationException(field, "must not be blank");
        }
    }

    /**
     * Editable attributes of a workflow.
     */
    public record WorkflowDraft(
        String code,
        String name,
        String description,
        RecordType recordType,
        boolean active,
        boolean defaultForType,
        MatchConstraints constraints,
        List<String> requiredFields
    ) {
        public WorkflowDraft {
            constraints = constraints == null ? MatchConstraints.none() : constraints;
            requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        }

        public static WorkflowDraft of(String code, String name, RecordType recordType) {
            return new WorkflowDraft(code, name, null, recordType, true, false, null, null);
        }

        public WorkflowDraft asDefault() {
            return new WorkflowDraft(code, name, description, recordType, active, true, constraints, requiredFields);
        }

        public WorkflowDraft withConstraints(MatchConstraints newConstraints) {
            return new WorkflowDraft(code, name, description, recordType, active, defaultForType, newConstraints, requiredFields);
        }
    }

    /**
     * Editable attributes of a state.
     */
    public record StateDraft(
        String code,
        String name,
        boolean initial,
        boolean terminal,
        Integer slaHours,
        int sortOrder
    ) {
        public static StateDraft initial(String code, String name, Integer slaHours) {
            return new StateDraft(code, name, true, false, slaHours, 0);
        }

        public static StateDraft intermediate(String code, String name, Integer slaHours, int sortOrder) {
            return new StateDraft(code, name, false, false, slaHours, sortOrder);
        }

        public static StateDraft terminal(String code, String name, int sortOrder) {
            return new StateDraft(code, name, false, true, null, sortOrder);
        }
    }

    /**
     * Editable attributes of a transition.
     */
    public record TransitionDraft(
        String code,
        String name,
        UUID fromStateId,
        UUID toStateId,
        List<Requirement> requirements,
        List<ActionDefinition> actions,
        Set<String> allowedRoles,
        boolean active,
        int sortOrder
    ) {
        public TransitionDraft {
            requirements = requirements == null ? List.of() : List.copyOf(requirements);
            actions = actions == null ? List.of() : List.copyOf(actions);
            allowedRoles = allowedRoles == null ? Set.of() : Set.copyOf(allowedRoles);
        }

        public static TransitionDraft of(String code, String name, UUID fromStateId, UUID toStateId) {
            return new TransitionDraft(code, name, fromStateId, toStateId, null, null, null, true, 0);
        }

        public TransitionDraft withRequirements(Requirement... newRequirements) {
            return new TransitionDraft(code, name, fromStateId, toStateId,
                List.of(newRequirements), actions, allowedRoles, active, sortOrder);
        }

        public TransitionDraft withActions(ActionDefinition... newActions) {
            return new TransitionDraft(code, name, fromStateId, toStateId,
                requirements, List.of(newActions), allowedRoles, active, sortOrder);
        }

        public TransitionDraft withAllowedRoles(String... roles) {
            return new TransitionDraft(code, name, fromStateId, toStateId,
                requirements, actions, Set.of(roles), active, sortOrder);
        }

        public TransitionDraft inactive() {
            return new TransitionDraft(code, name, fromStateId, toStateId,
                requirements, actions, allowedRoles, false, sortOrder);
        }
    }
}
