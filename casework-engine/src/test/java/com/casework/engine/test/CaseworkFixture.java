package com.casework.engine.test;

import com.casework.core.model.ActionDefinition;
import com.casework.core.model.Actor;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;
import com.casework.core.model.Requirement;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.TransitionRequest;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.port.Notifier;
import com.casework.core.test.MutableClock;
import com.casework.engine.action.ActionExecutor;
import com.casework.engine.action.AssignDepartmentHandler;
import com.casework.engine.action.AssignRoleHandler;
import com.casework.engine.action.AssignUserHandler;
import com.casework.engine.action.ChangeRecordTypeHandler;
import com.casework.engine.action.NotifyHandler;
import com.casework.engine.action.RecomputeSlaHandler;
import com.casework.engine.action.SetFieldHandler;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.definition.WorkflowDefinitionService.StateDraft;
import com.casework.engine.definition.WorkflowDefinitionService.TransitionDraft;
import com.casework.engine.definition.WorkflowDefinitionService.WorkflowDraft;
import com.casework.engine.definition.WorkflowMatcher;
import com.casework.engine.directory.InMemoryAssigneeDirectory;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.notification.NotificationDispatcher;
import com.casework.engine.persistence.InMemoryAttachmentRepository;
import com.casework.engine.persistence.InMemoryCaseRecordRepository;
import com.casework.engine.persistence.InMemoryCommentRepository;
import com.casework.engine.persistence.InMemoryRevisionRepository;
import com.casework.engine.persistence.InMemoryTransitionHistoryRepository;
import com.casework.engine.persistence.InMemoryUnitOfWork;
import com.casework.engine.persistence.InMemoryWorkflowRepository;
import com.casework.engine.record.RecordService;
import com.casework.engine.record.RecordWriter;
import com.casework.engine.requirement.RequirementValidator;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.transition.TransitionEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * The engine wired on in-memory repositories, a mutable clock and a direct notification
 * dispatcher, plus a ready-made incident workflow:
 *
 * <pre>
 *   new --start[agent]--> in_progress --resolve[comment]--> resolved
 *    \--reject[supervisor]--> closed
 * </pre>
 */
public class CaseworkFixture {

    public static final Actor ADMIN = new Actor("admin", Set.of("admin"), true);
    public static final Actor AGENT = Actor.of("agent-1", "agent");
    public static final Actor VIEWER = Actor.of("viewer-1", "viewer");
    public static final Actor REPORTER = Actor.of("reporter-1", "reporter");

    public final MutableClock clock = MutableClock.at("2026-03-02T09:00:00Z");
    public final InMemoryWorkflowRepository workflowRepository = new InMemoryWorkflowRepository();
    public final InMemoryCaseRecordRepository recordRepository = new InMemoryCaseRecordRepository();
    public final InMemoryTransitionHistoryRepository historyRepository = new InMemoryTransitionHistoryRepository();
    public final InMemoryRevisionRepository revisionRepository = new InMemoryRevisionRepository();
    public final InMemoryCommentRepository commentRepository = new InMemoryCommentRepository();
    public final InMemoryAttachmentRepository attachmentRepository = new InMemoryAttachmentRepository();
    public final InMemoryUnitOfWork unitOfWork = new InMemoryUnitOfWork();
    public final InMemoryAssigneeDirectory directory = new InMemoryAssigneeDirectory();
    public final CaseMetrics metrics = CaseMetrics.standalone();
    public final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public final Notifier notifier;
    public final NotificationDispatcher dispatcher;
    public final RevisionLogService revisions;
    public final RecordWriter writer;
    public final WorkflowDefinitionService definitions;
    public final WorkflowMatcher workflowMatcher;
    public final ActionExecutor actionExecutor;
    public final TransitionEngine transitions;
    public final RecordService records;

    public CaseworkFixture() {
        this(new RecordingNotifier());
    }

    public CaseworkFixture(Notifier notifier) {
        this.notifier = notifier;
        this.dispatcher = NotificationDispatcher.direct(notifier);
        this.revisions = new RevisionLogService(revisionRepository, clock);
        this.writer = new RecordWriter(recordRepository, revisions, unitOfWork, clock);
        this.definitions = new WorkflowDefinitionService(workflowRepository, recordRepository, unitOfWork, clock);
        this.workflowMatcher = new WorkflowMatcher(workflowRepository);
        this.actionExecutor = new ActionExecutor(
            List.of(
                new AssignUserHandler(directory, writer),
                new AssignRoleHandler(directory, writer),
                new AssignDepartmentHandler(directory, writer),
                new SetFieldHandler(writer),
                new RecomputeSlaHandler(writer, clock),
                new ChangeRecordTypeHandler(writer),
                new NotifyHandler(directory, dispatcher)),
            revisions,
            recordRepository,
            metrics);
        this.transitions = new TransitionEngine(
            workflowRepository, recordRepository, historyRepository, commentRepository, revisions,
            new RequirementValidator(), actionExecutor, unitOfWork, metrics, clock);
        this.records = new RecordService(
            recordRepository, commentRepository, attachmentRepository, definitions, workflowMatcher,
            transitions, revisions, writer, directory, unitOfWork, metrics, clock);
    }

    public RecordingNotifier recordingNotifier() {
        return (RecordingNotifier) notifier;
    }

    /**
     * Default incident workflow with SLA hours: new 4, in_progress 8.
     */
    public IncidentWorkflow incidentWorkflow() {
        return incidentWorkflow("INCIDENT-STD", true);
    }

    public IncidentWorkflow incidentWorkflow(String code, boolean defaultForType) {
        WorkflowDraft draft = WorkflowDraft.of(code, "Standard incident", RecordType.INCIDENT);
        Workflow workflow = definitions.createWorkflow(defaultForType ? draft.asDefault() : draft, ADMIN);

        WorkflowStateDefinition newState = definitions.addState(workflow.id(), StateDraft.initial("new", "New", 4));
        WorkflowStateDefinition inProgress = definitions.addState(workflow.id(),
            StateDraft.intermediate("in_progress", "In Progress", 8, 1));
        WorkflowStateDefinition resolved = definitions.addState(workflow.id(), StateDraft.terminal("resolved", "Resolved", 2));
        WorkflowStateDefinition closed = definitions.addState(workflow.id(), StateDraft.terminal("closed", "Closed", 3));

        Transition start = definitions.addTransition(workflow.id(),
            TransitionDraft.of("start", "Start work", newState.id(), inProgress.id()).withAllowedRoles("agent"));
        Transition resolve = definitions.addTransition(workflow.id(),
            TransitionDraft.of("resolve", "Resolve", inProgress.id(), resolved.id()).withRequirements(Requirement.comment()));
        Transition reject = definitions.addTransition(workflow.id(),
            TransitionDraft.of("reject", "Reject", newState.id(), closed.id()).withAllowedRoles("supervisor"));

        return new IncidentWorkflow(workflow, newState, inProgress, resolved, closed, start, resolve, reject);
    }

    /**
     * Replace a transition's actions in place.
     */
    public Transition withActions(Transition transition, ActionDefinition... actions) {
        return definitions.updateTransition(transition.id(), new TransitionDraft(
            transition.code(), transition.name(), transition.fromStateId(), transition.toStateId(),
            transition.requirements(), List.of(actions), transition.allowedRoles(),
            transition.active(), transition.sortOrder()));
    }

    public CaseRecord newIncident(String title) {
        return records.createRecord(
            RecordService.NewRecord.builder(RecordType.INCIDENT, title).reporterId(REPORTER.id()).build(),
            REPORTER);
    }

    public TransitionOutcome move(CaseRecord record, Transition transition, Actor actor, TransitionPayload payload) {
        return transitions.executeTransition(
            new TransitionRequest(record.id(), transition.id(), record.version(), actor, payload));
    }

    public TransitionOutcome move(CaseRecord record, Transition transition, Actor actor) {
        return move(record, transition, actor, TransitionPayload.empty());
    }

    public CaseRecord reload(UUID recordId) {
        return recordRepository.findById(recordId).orElseThrow();
    }

    public record IncidentWorkflow(
        Workflow workflow,
        WorkflowStateDefinition newState,
        WorkflowStateDefinition inProgress,
        WorkflowStateDefinition resolved,
        WorkflowStateDefinition closed,
        Transition start,
        Transition resolve,
        Transition reject
    ) {
    }
}
