package com.casework.engine.portability;

import com.casework.core.exception.InvalidTopologyException;
import com.casework.core.exception.WorkflowValidationException;
import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.ActionDefinition;
import com.casework.core.model.ActionType;
import com.casework.core.model.Actor;
import com.casework.core.model.Requirement;
import com.casework.core.model.Transition;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowGraph;
import com.casework.core.model.WorkflowLifecycle;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.port.AssigneeDirectory;
import com.casework.core.repository.UnitOfWork;
import com.casework.core.repository.WorkflowRepository;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.portability.WorkflowExport.ExportedAction;
import com.casework.engine.portability.WorkflowExport.ExportedRequirement;
import com.casework.engine.portability.WorkflowExport.ExportedState;
import com.casework.engine.portability.WorkflowExport.ExportedTransition;
import com.casework.engine.portability.WorkflowExport.ExportedWorkflow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Moves workflow definitions between installations as JSON.
 *
 * <p>Imported workflows start inactive and are never the default. References the target
 * installation cannot resolve, such as unknown users or departments, are kept and reported
 * as warnings; transitions whose states are missing from the export are skipped.
 */
public class WorkflowPortabilityService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPortabilityService.class);

    static final String IMPORTED_CODE_SUFFIX = "-IMPORTED";

    private final WorkflowDefinitionService definitions;
    private final WorkflowRepository workflows;
    private final AssigneeDirectory directory;
    private final UnitOfWork unitOfWork;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public WorkflowPortabilityService(
            WorkflowDefinitionService definitions,
            WorkflowRepository workflows,
            AssigneeDirectory directory,
            UnitOfWork unitOfWork,
            ObjectMapper objectMapper,
            Clock clock) {
        this.definitions = definitions;
        this.workflows = workflows;
        this.directory = directory;
        this.unitOfWork = unitOfWork;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ========== Export ==========

    public WorkflowExport export(UUID workflowId) {
        WorkflowGraph graph = definitions.graphOf(workflowId);
        Map<UUID, String> stateCodes = new HashMap<>();
        List<ExportedState> states = new ArrayList<>();
        for (WorkflowStateDefinition state : graph.states()) {
            stateCodes.put(state.id(), state.code());
            states.add(new ExportedState(
                state.code(), state.name(), state.initial(), state.terminal(), state.slaHours(), state.sortOrder()));
        }

        List<ExportedTransition> transitions = graph.transitions().stream()
            .map(t -> new ExportedTransition(
                t.code(),
                t.name(),
                stateCodes.get(t.fromStateId()),
                stateCodes.get(t.toStateId()),
                t.allowedRoles(),
                t.requirements().stream()
                    .map(r -> new ExportedRequirement(r.kind(), r.fieldName(), r.minCount(), r.errorMessage(), r.mandatory()))
                    .toList(),
                t.actions().stream()
                    .map(a -> new ExportedAction(a.type(), a.executionOrder(), a.active(), a.config()))
                    .toList(),
                t.active(),
                t.sortOrder()))
            .toList();

        Workflow workflow = graph.workflow();
        return new WorkflowExport(
            WorkflowExport.CURRENT_VERSION,
            clock.instant(),
            new ExportedWorkflow(
                workflow.code(),
                workflow.name(),
                workflow.description(),
                workflow.recordType(),
                workflow.requiredFields(),
                workflow.constraints().values(),
                states,
                transitions));
    }

    public String exportJson(UUID workflowId) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(export(workflowId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow export " + workflowId, e);
        }
    }

    // ========== Import ==========

    /**
     * @throws WorkflowValidationException if the document is unreadable
     */
    public ImportResult importJson(String json, Actor actor) {
        WorkflowExport export;
        try {
            export = objectMapper.readValue(json, WorkflowExport.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowValidationException("Unreadable workflow export: " + e.getOriginalMessage());
        }
        return importWorkflow(export, actor);
    }

    /**
     * Create a new workflow from an export, with fresh ids and the same topology.
     *
     * @throws WorkflowValidationException if the export version is unsupported or required data is missing
     * @throws InvalidTopologyException if the export does not have exactly one initial state
     */
    public ImportResult importWorkflow(WorkflowExport export, Actor actor) {
        ExportedWorkflow data = checkImportable(export);
        List<String> warnings = new ArrayList<>();

        String code = data.code();
        if (workflows.findWorkflowByCode(code).isPresent()) {
            code = definitions.availableCode(data.code() + IMPORTED_CODE_SUFFIX);
            warnings.add(String.format("Workflow code '%s' is taken; imported as '%s'", data.code(), code));
        }
        checkDepartments(data.constraints(), warnings);

        Instant now = clock.instant();
        Workflow workflow = new Workflow(
            UUID.randomUUID(),
            code,
            data.name(),
            data.description(),
            data.recordType(),
            false,
            false,
            WorkflowLifecycle.ACTIVE,
            new MatchConstraints(data.constraints()),
            data.requiredFields(),
            actor.id(),
            now,
            now
        );

        Map<String, WorkflowStateDefinition> states = new HashMap<>();
        for (ExportedState s : data.states()) {
            states.put(s.code(), WorkflowStateDefinition.create(
                workflow.id(), s.code(), s.name(), s.initial(), s.terminal(), s.slaHours(), s.sortOrder()));
        }

        List<Transition> transitions = new ArrayList<>();
        for (ExportedTransition t : data.transitions()) {
            WorkflowStateDefinition from = states.get(t.fromStateCode());
            WorkflowStateDefinition to = states.get(t.toStateCode());
            if (from == null || to == null) {
                warnings.add(String.format("Transition '%s' skipped: unknown state '%s'",
                    t.code(), from == null ? t.fromStateCode() : t.toStateCode()));
                continue;
            }
            List<ActionDefinition> actions = new ArrayList<>();
            for (ExportedAction a : t.actions()) {
                checkActionTarget(t.code(), a, warnings);
                actions.add(new ActionDefinition(UUID.randomUUID(), a.type(), a.executionOrder(), a.active(), a.config()));
            }
            transitions.add(new Transition(
                UUID.randomUUID(),
                workflow.id(),
                t.code(),
                t.name(),
                from.id(),
                to.id(),
                t.requirements().stream()
                    .map(r -> new Requirement(r.kind(), r.fieldName(), r.minCount(), r.errorMessage(), r.mandatory()))
                    .toList(),
                actions,
                t.allowedRoles(),
                t.active(),
                t.sortOrder()));
        }

        unitOfWork.run(() -> {
            workflows.saveWorkflow(workflow);
            states.values().forEach(workflows::saveState);
            transitions.forEach(workflows::saveTransition);
        });

        log.info("Imported workflow {} ({} states, {} transitions, {} warnings) by {}",
            workflow.code(), states.size(), transitions.size(), warnings.size(), actor.id());
        return new ImportResult(workflow, warnings);
    }

    private static ExportedWorkflow checkImportable(WorkflowExport export) {
        if (!WorkflowExport.CURRENT_VERSION.equals(export.exportVersion())) {
            throw new WorkflowValidationException("exportVersion", "unsupported version " + export.exportVersion());
        }
        ExportedWorkflow data = export.workflow();
        if (data == null) {
            throw new WorkflowValidationException("workflow", "is required");
        }
        if (isBlank(data.code()) || isBlank(data.name())) {
            throw new WorkflowValidationException("code/name", "workflow code and name are required");
        }
        if (data.recordType() == null) {
            throw new WorkflowValidationException("recordType", "is required");
        }
        if (data.states().isEmpty()) {
            throw new InvalidTopologyException("Imported workflow has no states: " + data.code());
        }

        Set<String> codes = new HashSet<>();
        int initialStates = 0;
        for (ExportedState state : data.states()) {
            if (isBlank(state.code()) || !codes.add(state.code())) {
                throw new WorkflowValidationException("states.code", "missing or duplicate state code: " + state.code());
            }
            if (state.initial()) {
                initialStates++;
            }
        }
        if (initialStates != 1) {
            throw new InvalidTopologyException(String.format(
                "Imported workflow %s has %d initial states", data.code(), initialStates));
        }
        return data;
    }

    private void checkDepartments(Map<MatchDimension, Set<String>> constraints, List<String> warnings) {
        for (String departmentId : constraints.getOrDefault(MatchDimension.DEPARTMENT, Set.of())) {
            if (directory.findDepartment(departmentId).isEmpty()) {
                warnings.add(String.format("Department '%s' in workflow constraints is unknown here", departmentId));
            }
        }
    }

    private void checkActionTarget(String transitionCode, ExportedAction action, List<String> warnings) {
        if (action.config() == null) {
            return;
        }
        if (action.type() == ActionType.ASSIGN_USER) {
            String userId = action.config().path("userId").asText(null);
            if (userId != null && directory.findUser(userId).isEmpty()) {
                warnings.add(String.format("User '%s' assigned by transition '%s' is unknown here", userId, transitionCode));
            }
        } else if (action.type() == ActionType.ASSIGN_DEPARTMENT) {
            String departmentId = action.config().path("departmentId").asText(null);
            if (departmentId != null && directory.findDepartment(departmentId).isEmpty()) {
                warnings.add(String.format(
                    "Department '%s' assigned by transition '%s' is unknown here", departmentId, transitionCode));
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
