package com.casework.engine.transition;

import com.casework.core.exception.CaseworkException;
import com.casework.core.exception.ForbiddenException;
import com.casework.core.exception.InvalidTopologyException;
import com.casework.core.exception.NotFoundException;
import com.casework.core.exception.RequirementsNotMetException;
import com.casework.core.exception.StaleVersionException;
import com.casework.core.exception.TerminalStateException;
import com.casework.core.exception.TransitionNotFoundException;
import com.casework.core.model.Actor;
import com.casework.core.model.AvailableTransition;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Comment;
import com.casework.core.model.RequirementViolation;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.Transition;
import com.casework.core.model.TransitionHistoryEntry;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.TransitionRequest;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.CommentRepository;
import com.casework.core.repository.TransitionHistoryRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.core.repository.WorkflowRepository;
import com.casework.engine.action.ActionContext;
import com.casework.engine.action.ActionExecutor;
import com.casework.engine.logging.LoggingContext;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.requirement.RequirementValidator;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.revision.RevisionSnapshots;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Executes transitions in two phases.
 *
 * <p>Phase one validates the request and commits the state change, the history entry,
 * the TRANSITIONED revision and the optional comment in one unit of work. Phase two runs
 * the transition's actions; their failures are reported as warnings and never undo
 * phase one.
 *
 * <p>Validation order: version, transition lookup, source state, terminal state, roles,
 * requirements. The first failing check determines the error.
 */
public class TransitionEngine implements TransitionService {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final WorkflowRepository workflows;
    private final CaseRecordRepository records;
    private final TransitionHistoryRepository history;
    private final CommentRepository comments;
    private final RevisionLogService revisions;
    private final RequirementValidator requirementValidator;
    private final ActionExecutor actionExecutor;
    private final UnitOfWork unitOfWork;
    private final CaseMetrics metrics;
    private final Clock clock;

    public TransitionEngine(
            WorkflowRepository workflows,
            CaseRecordRepository records,
            TransitionHistoryRepository history,
            CommentRepository comments,
            RevisionLogService revisions,
            RequirementValidator requirementValidator,
            ActionExecutor actionExecutor,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock) {
        this.workflows = workflows;
        this.records = records;
        this.history = history;
        this.comments = comments;
        this.revisions = revisions;
        this.requirementValidator = requirementValidator;
        this.actionExecutor = actionExecutor;
        this.unitOfWork = unitOfWork;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public TransitionOutcome executeTransition(TransitionRequest request) {
        Actor actor = request.actor();
        try (var ctx = LoggingContext.forTransition(request.recordId(), request.transitionId(), actor.id())) {
            return doExecute(request);
        } catch (CaseworkException e) {
            metrics.transitionRejected(e.getErrorCode());
            log.info("Transition {} on record {} rejected for {}: {}",
                request.transitionId(), request.recordId(), actor.id(), e.getMessage());
            throw e;
        }
    }

    private TransitionOutcome doExecute(TransitionRequest request) {
        CaseRecord record = loadRecord(request.recordId());
        if (record.version() != request.expectedVersion()) {
            throw new StaleVersionException("CaseRecord", record.id(), request.expectedVersion(), record.version());
        }

        Transition transition = workflows.findTransition(request.transitionId())
            .filter(t -> t.workflowId().equals(record.workflowId()))
            .orElseThrow(() -> new TransitionNotFoundException(request.transitionId()));
        if (!transition.fromStateId().equals(record.currentStateId())) {
            throw new InvalidTopologyException(transition.id(), transition.fromStateId(), record.currentStateId());
        }

        WorkflowStateDefinition fromState = loadState(record.currentStateId());
        if (fromState.terminal()) {
            throw new TerminalStateException(record.id(), fromState.code());
        }
        if (!transition.active()) {
            throw new TransitionNotFoundException(transition.id());
        }
        if (!transition.permits(request.actor())) {
            throw new ForbiddenException(transition.code(), transition.allowedRoles());
        }

        List<RequirementViolation> violations =
            requirementValidator.validate(transition, record, request.payload());
        if (!violations.isEmpty()) {
            throw new RequirementsNotMetException(violations);
        }

        WorkflowStateDefinition toState = loadState(transition.toStateId());
        Instant now = clock.instant();
        Committed committed = unitOfWork.inTransaction(() ->
            commit(record, transition, fromState, toState, request, now));
        CaseRecord moved = committed.record();

        log.info("Record {} moved {} -> {} via {} by {}",
            moved.recordNumber(), fromState.code(), toState.code(), transition.code(), request.actor().id());

        ActionExecutor.ActionRun run = actionExecutor.executeAll(ActionContext.afterTransition(
            moved, transition, fromState, toState, request.actor(), request.payload()));

        metrics.transitionExecuted(workflowCode(record.workflowId()), transition.code());
        return new TransitionOutcome(run.record(), committed.historyEntry(), run.warnings());
    }

    private Committed commit(
            CaseRecord record,
            Transition transition,
            WorkflowStateDefinition fromState,
            WorkflowStateDefinition toState,
            TransitionRequest request,
            Instant now) {
        CaseRecord.Builder builder = record.toBuilder()
            .currentStateId(toState.id())
            .version(record.version() + 1)
            .updatedAt(now);
        if (toState.hasSla()) {
            builder.slaDueAt(now.plus(Duration.ofHours(toState.slaHours()))).slaBreached(false);
        }
        if (toState.terminal()) {
            builder.closedAt(now);
            if (toState.isResolution()) {
                builder.resolvedAt(now);
            }
        }
        CaseRecord moved = builder.build();
        records.update(moved);

        TransitionPayload payload = request.payload();
        String comment = payload.hasComment() ? payload.comment() : null;
        TransitionHistoryEntry entry =
            TransitionHistoryEntry.create(record.id(), transition, request.actor().id(), now, comment);
        history.append(entry);

        ObjectNode snapshot = RevisionSnapshots.object();
        RevisionSnapshots.put(snapshot, "transitionId", transition.id());
        RevisionSnapshots.put(snapshot, "transitionCode", transition.code());
        RevisionSnapshots.put(snapshot, "fromState", fromState.code());
        RevisionSnapshots.put(snapshot, "toState", toState.code());
        RevisionSnapshots.put(snapshot, "comment", comment);
        snapshot.put("version", moved.version());
        revisions.append(record.id(), RevisionActionType.TRANSITIONED, request.actor().id(),
            String.format("%s: %s -> %s", transition.name(), fromState.name(), toState.name()), snapshot);

        if (comment != null) {
            comments.save(Comment.create(record.id(), request.actor().id(), comment, true, now));
        }
        return new Committed(moved, entry);
    }

    @Override
    public List<AvailableTransition> availableTransitions(UUID recordId, Actor actor) {
        CaseRecord record = loadRecord(recordId);
        WorkflowStateDefinition current = loadState(record.currentStateId());
        if (current.terminal()) {
            return List.of();
        }
        return workflows.findTransitionsFrom(current.id()).stream()
            .filter(Transition::active)
            .filter(t -> t.permits(actor))
            .map(t -> {
                WorkflowStateDefinition target = loadState(t.toStateId());
                return new AvailableTransition(t.id(), t.code(), t.name(), target.id(), target.code(), t.requirements());
            })
            .toList();
    }

    @Override
    public List<TransitionHistoryEntry> historyOf(UUID recordId) {
        loadRecord(recordId);
        return history.findByRecord(recordId);
    }

    private CaseRecord loadRecord(UUID recordId) {
        return records.findById(recordId)
            .orElseThrow(() -> new NotFoundException("CaseRecord", recordId));
    }

    private WorkflowStateDefinition loadState(UUID stateId) {
        return workflows.findState(stateId)
            .orElseThrow(() -> new InvalidTopologyException("Record references unknown state " + stateId));
    }

    private String workflowCode(UUID workflowId) {
        return workflows.findWorkflow(workflowId).map(Workflow::code).orElse("unknown");
    }

    private record Committed(CaseRecord record, TransitionHistoryEntry historyEntry) {
    }
}
