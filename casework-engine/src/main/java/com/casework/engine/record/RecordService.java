package com.casework.engine.record;

import com.casework.core.exception.ForbiddenException;
import com.casework.core.exception.NotFoundException;
import com.casework.core.exception.RequirementsNotMetException;
import com.casework.core.exception.StaleVersionException;
import com.casework.core.exception.WorkflowValidationException;
import com.casework.core.matching.MatchCriteria;
import com.casework.core.matching.MatchDimension;
import com.casework.core.model.ActionWarning;
import com.casework.core.model.Actor;
import com.casework.core.model.Attachment;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.Comment;
import com.casework.core.model.RecordType;
import com.casework.core.model.RequirementKind;
import com.casework.core.model.RequirementViolation;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.TransitionOutcome;
import com.casework.core.model.TransitionPayload;
import com.casework.core.model.TransitionRequest;
import com.casework.core.model.UserProfile;
import com.casework.core.model.Workflow;
import com.casework.core.model.WorkflowStateDefinition;
import com.casework.core.port.AssigneeDirectory;
import com.casework.core.repository.AttachmentRepository;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.CommentRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.engine.definition.WorkflowDefinitionService;
import com.casework.engine.definition.WorkflowMatcher;
import com.casework.engine.logging.LoggingContext;
import com.casework.engine.metrics.CaseMetrics;
import com.casework.engine.revision.RevisionLogService;
import com.casework.engine.revision.RevisionSnapshots;
import com.casework.engine.transition.TransitionService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Creates records and applies every record change other than a state change.
 *
 * <p>Field edits and assignment are versioned: the caller passes the version it last read
 * and loses with {@link StaleVersionException} when another writer got there first.
 * Comments and attachments are stored beside the record and leave its version alone.
 */
public class RecordService {

    private static final Logger log = LoggerFactory.getLogger(RecordService.class);

    public static final int DEFAULT_BREACHED_LIMIT = 100;

    private final CaseRecordRepository records;
    private final CommentRepository comments;
    private final AttachmentRepository attachments;
    private final WorkflowDefinitionService definitions;
    private final WorkflowMatcher workflowMatcher;
    private final TransitionService transitions;
    private final RevisionLogService revisions;
    private final RecordWriter writer;
    private final AssigneeDirectory directory;
    private final UnitOfWork unitOfWork;
    private final CaseMetrics metrics;
    private final Clock clock;

    public RecordService(
            CaseRecordRepository records,
            CommentRepository comments,
            AttachmentRepository attachments,
            WorkflowDefinitionService definitions,
            WorkflowMatcher workflowMatcher,
            TransitionService transitions,
            RevisionLogService revisions,
            RecordWriter writer,
            AssigneeDirectory directory,
            UnitOfWork unitOfWork,
            CaseMetrics metrics,
            Clock clock) {
        this.records = records;
        this.comments = comments;
        this.attachments = attachments;
        this.definitions = definitions;
        this.workflowMatcher = workflowMatcher;
        this.transitions = transitions;
        this.revisions = revisions;
        this.writer = writer;
        this.directory = directory;
        this.unitOfWork = unitOfWork;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========== Creation ==========

    /**
     * Create a record in the initial state of its workflow.
     *
     * <p>Without an explicit workflow the best-matching workflow of the record type is used,
     * falling back to the type's default.
     *
     * @throws NotFoundException if no workflow applies
     * @throws WorkflowValidationException if several workflows tie and none is the default
     * @throws com.casework.core.exception.InvalidTopologyException if the workflow has no single initial state
     * @throws RequirementsNotMetException if a field the workflow requires is blank
     */
    public CaseRecord createRecord(NewRecord request, Actor actor) {
        if (request.recordType() == null) {
            throw new WorkflowValidationException("recordType", "is required");
        }
        if (request.title() == null || request.title().isBlank()) {
            throw new WorkflowValidationException("title", "must not be blank");
        }

        Workflow workflow = request.workflowId() != null
            ? explicitWorkflow(request.workflowId(), request.recordType())
            : matchedWorkflow(request);
        WorkflowStateDefinition initial = definitions.initialStateOf(workflow.id());

        Instant now = clock.instant();
        CaseRecord draft = CaseRecord.builder()
            .recordType(request.recordType())
            .title(request.title())
            .description(request.description())
            .workflowId(workflow.id())
            .currentStateId(initial.id())
            .classificationId(request.classificationId())
            .departmentId(request.departmentId())
            .locationId(request.locationId())
            .channel(request.channel())
            .assigneeId(request.assigneeId())
            .reporterId(request.reporterId())
            .priority(request.priority())
            .severity(request.severity())
            .customFields(request.customFields())
            .slaDueAt(initial.hasSla() ? now.plus(Duration.ofHours(initial.slaHours())) : null)
            .sourceRecordId(request.sourceRecordId())
            .createdAt(now)
            .updatedAt(now)
            .build();
        checkRequiredFields(workflow, draft);

        CaseRecord created = unitOfWork.inTransaction(() -> {
            int year = now.atZone(ZoneOffset.UTC).getYear();
            CaseRecord numbered = draft.toBuilder()
                .recordNumber(request.recordType().formatNumber(year, records.nextSequence(request.recordType(), year)))
                .build();
            records.save(numbered);

            ObjectNode snapshot = RevisionSnapshots.record(numbered);
            RevisionSnapshots.put(snapshot, "initialState", initial.code());
            RevisionSnapshots.put(snapshot, "sourceRecordId", numbered.sourceRecordId());
            revisions.append(numbered.id(), RevisionActionType.CREATED, actor.id(),
                String.format("Created %s in workflow %s", numbered.recordNumber(), workflow.code()), snapshot);
            return numbered;
        });

        metrics.recordCreated(created.recordType().name());
        try (var ctx = LoggingContext.forRecord(created.id(), actor.id())) {
            log.info("Created record {} in workflow {} at state {}",
                created.recordNumber(), workflow.code(), initial.code());
        }
        return created;
    }

    private Workflow explicitWorkflow(UUID workflowId, RecordType recordType) {
        Workflow workflow = definitions.getWorkflow(workflowId);
        if (!workflow.isSelectable()) {
            throw new WorkflowValidationException("workflowId", "workflow is inactive or deleted: " + workflow.code());
        }
        if (workflow.recordType() != recordType) {
            throw new WorkflowValidationException("workflowId", String.format(
                "workflow %s handles %s records, not %s", workflow.code(), workflow.recordType(), recordType));
        }
        return workflow;
    }

    private Workflow matchedWorkflow(NewRecord request) {
        MatchCriteria criteria = MatchCriteria.builder()
            .with(MatchDimension.CLASSIFICATION, request.classificationId())
            .with(MatchDimension.LOCATION, request.locationId())
            .with(MatchDimension.DEPARTMENT, request.departmentId())
            .with(MatchDimension.CHANNEL, request.channel())
            .build();
        return workflowMatcher.resolve(request.recordType(), criteria).orElseThrow(() -> {
            if (workflowMatcher.match(request.recordType(), criteria).isEmpty()) {
                return new NotFoundException("Workflow", "matching " + request.recordType() + " " + criteria);
            }
            return new WorkflowValidationException("workflowId",
                "several workflows match equally; choose one explicitly");
        });
    }

    private static void checkRequiredFields(Workflow workflow, CaseRecord record) {
        List<RequirementViolation> missing = new ArrayList<>();
        for (String field : workflow.requiredFields()) {
            String value = record.fieldValue(field);
            if (value == null || value.isBlank()) {
                missing.add(new RequirementViolation(RequirementKind.FIELD_NOT_EMPTY, field,
                    String.format("Field '%s' is required by workflow %s", field, workflow.code())));
            }
        }
        if (!missing.isEmpty()) {
            throw new RequirementsNotMetException(missing);
        }
    }

    // ========== Queries ==========

    public CaseRecord getRecord(UUID recordId) {
        return records.findById(recordId)
            .orElseThrow(() -> new NotFoundException("CaseRecord", recordId));
    }

    public CaseRecord getRecordByNumber(String recordNumber) {
        return records.findByRecordNumber(recordNumber)
            .orElseThrow(() -> new NotFoundException("CaseRecord", recordNumber));
    }

    public List<Comment> commentsOf(UUID recordId) {
        getRecord(recordId);
        return comments.findByRecord(recordId);
    }

    public List<Attachment> attachmentsOf(UUID recordId) {
        getRecord(recordId);
        return attachments.findByRecord(recordId);
    }

    /**
     * Open records whose SLA has been flagged as breached, most overdue first.
     */
    public List<CaseRecord> listBreached(int limit) {
        return records.findBreached(limit > 0 ? limit : DEFAULT_BREACHED_LIMIT);
    }

    // ========== Mutations ==========

    /**
     * Change plain fields. Unknown names become custom fields; a null value clears the field.
     *
     * @throws ForbiddenException if a field owned by the engine is named, such as the current state
     */
    public CaseRecord updateFields(UUID recordId, long expectedVersion, Map<String, String> fields, Actor actor) {
        for (String field : fields.keySet()) {
            if (RecordFields.isProtected(field)) {
                throw new ForbiddenException(String.format(
                    "Field '%s' cannot be updated directly; state changes go through transitions", field));
            }
        }
        CaseRecord current = expect(recordId, expectedVersion);

        Map<String, Object[]> changes = new LinkedHashMap<>();
        fields.forEach((field, value) -> changes.put(field, new Object[] {current.fieldValue(field), value}));
        if (changes.values().stream().allMatch(v -> Objects.equals(v[0], v[1]))) {
            return current;
        }

        try (var ctx = LoggingContext.forRecord(recordId, actor.id())) {
            CaseRecord updated = writer.apply(
                current,
                b -> {
                    fields.forEach((field, value) -> RecordFields.set(b, field, value));
                    return b;
                },
                RevisionActionType.FIELD_CHANGED,
                actor.id(),
                "Updated " + String.join(", ", fields.keySet()),
                RevisionSnapshots.changes(changes)
            );
            log.info("Updated fields {} on record {}", fields.keySet(), updated.recordNumber());
            return updated;
        }
    }

    /**
     * Assign the record to a user, or unassign it with a null assignee.
     *
     * @throws NotFoundException if the user is unknown or inactive
     */
    public CaseRecord assign(UUID recordId, long expectedVersion, String assigneeId, Actor actor) {
        if (assigneeId != null) {
            directory.findUser(assigneeId)
                .filter(UserProfile::active)
                .orElseThrow(() -> new NotFoundException("User", assigneeId));
        }
        CaseRecord current = expect(recordId, expectedVersion);
        if (Objects.equals(current.assigneeId(), assigneeId)) {
            return current;
        }
        CaseRecord updated = writer.apply(
            current,
            b -> b.assigneeId(assigneeId),
            RevisionActionType.ASSIGNEE_CHANGED,
            actor.id(),
            assigneeId == null ? "Unassigned" : "Assigned to " + assigneeId,
            RevisionSnapshots.change("assigneeId", current.assigneeId(), assigneeId)
        );
        log.info("Record {} assigned to {} by {}", updated.recordNumber(), assigneeId, actor.id());
        return updated;
    }

    public Comment addComment(UUID recordId, String body, boolean internal, Actor actor) {
        if (body == null || body.isBlank()) {
            throw new WorkflowValidationException("body", "must not be blank");
        }
        getRecord(recordId);
        Comment comment = Comment.create(recordId, actor.id(), body, internal, clock.instant());
        unitOfWork.run(() -> {
            comments.save(comment);
            ObjectNode snapshot = RevisionSnapshots.object();
            RevisionSnapshots.put(snapshot, "commentId", comment.id());
            snapshot.put("internal", internal);
            revisions.append(recordId, RevisionActionType.COMMENT_ADDED, actor.id(),
                internal ? "Internal comment added" : "Comment added", snapshot);
        });
        return comment;
    }

    /**
     * Register an uploaded file's metadata. The content lives in external storage.
     */
    public Attachment addAttachment(
            UUID recordId,
            String fileName,
            String contentType,
            long sizeBytes,
            String storageKey,
            Actor actor) {
        if (fileName == null || fileName.isBlank()) {
            throw new WorkflowValidationException("fileName", "must not be blank");
        }
        if (sizeBytes < 0) {
            throw new WorkflowValidationException("sizeBytes", "must not be negative");
        }
        getRecord(recordId);
        Attachment attachment = Attachment.create(
            recordId, fileName, contentType, sizeBytes, storageKey, actor.id(), clock.instant());
        unitOfWork.run(() -> {
            attachments.save(attachment);
            ObjectNode snapshot = RevisionSnapshots.object();
            RevisionSnapshots.put(snapshot, "attachmentId", attachment.id());
            RevisionSnapshots.put(snapshot, "fileName", fileName);
            snapshot.put("sizeBytes", sizeBytes);
            revisions.append(recordId, RevisionActionType.ATTACHMENT_ADDED, actor.id(),
                "Attachment added: " + fileName, snapshot);
        });
        return attachment;
    }

    /**
     * Spin off a REQUEST record from an existing record, optionally moving the source
     * along a transition first. The new request copies the source's routing attributes and
     * reporter, and points back at it through {@code sourceRecordId}.
     *
     * @throws WorkflowValidationException if the source already is a request
     */
    public Conversion convertToRequest(ConvertToRequest request, Actor actor) {
        CaseRecord source = getRecord(request.recordId());
        if (source.recordType() == RecordType.REQUEST) {
            throw new WorkflowValidationException("recordType", "a request cannot be converted to another request");
        }

        List<ActionWarning> warnings = List.of();
        if (request.transitionId() != null) {
            TransitionOutcome outcome = transitions.executeTransition(new TransitionRequest(
                source.id(), request.transitionId(), request.expectedVersion(), actor, request.payload()));
            source = outcome.record();
            warnings = outcome.warnings();
        } else if (source.version() != request.expectedVersion()) {
            throw new StaleVersionException("CaseRecord", source.id(), request.expectedVersion(), source.version());
        }

        NewRecord newRequest = NewRecord.builder(RecordType.REQUEST, firstText(request.title(), source.title()))
            .description(firstText(request.description(), source.description()))
            .workflowId(request.workflowId())
            .classificationId(firstText(request.classificationId(), source.classificationId()))
            .departmentId(firstText(request.departmentId(), source.departmentId()))
            .locationId(source.locationId())
            .channel(source.channel())
            .assigneeId(firstText(request.assigneeId(), source.assigneeId()))
            .reporterId(source.reporterId())
            .priority(source.priority())
            .severity(source.severity())
            .customFields(source.customFields())
            .sourceRecordId(source.id())
            .build();
        CaseRecord created = createRecord(newRequest, actor);

        log.info("Record {} converted to request {}", source.recordNumber(), created.recordNumber());
        return new Conversion(source, created, warnings);
    }

    private CaseRecord expect(UUID recordId, long expectedVersion) {
        CaseRecord current = getRecord(recordId);
        if (current.version() != expectedVersion) {
            throw new StaleVersionException("CaseRecord", recordId, expectedVersion, current.version());
        }
        return current;
    }

    private static String firstText(String preferred, String fallback) {
        return preferred != null && !preferred.isBlank() ? preferred : fallback;
    }

    /**
     * Attributes of a record to create.
     */
    public record NewRecord(
        RecordType recordType,
        String title,
        String description,
        UUID workflowId,
        String classificationId,
        String departmentId,
        String locationId,
        String channel,
        String assigneeId,
        String reporterId,
        String priority,
        String severity,
        Map<String, String> customFields,
        UUID sourceRecordId
    ) {
        public NewRecord {
            customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
        }

        public static Builder builder(RecordType recordType, String title) {
            return new Builder(recordType, title);
        }

        public static class Builder {
            private final RecordType recordType;
            private final String title;
            private String description;
            private UUID workflowId;
            private String classificationId;
            private String departmentId;
            private String locationId;
            private String channel;
            private String assigneeId;
            private String reporterId;
            private String priority;
            private String severity;
            private Map<String, String> customFields;
            private UUID sourceRecordId;

            private Builder(RecordType recordType, String title) {
                this.recordType = recordType;
                this.title = title;
            }

            public Builder description(String description) {
                this.description = description;
                return this;
            }

            public Builder workflowId(UUID workflowId) {
                this.workflowId = workflowId;
                return this;
            }

            public Builder classificationId(String classificationId) {
                this.classificationId = classificationId;
                return this;
            }

            public Builder departmentId(String departmentId) {
                this.departmentId = departmentId;
                return this;
            }

            public Builder locationId(String locationId) {
                this.locationId = locationId;
                return this;
            }

            public Builder channel(String channel) {
                this.channel = channel;
                return this;
            }

            public Builder assigneeId(String assigneeId) {
                this.assigneeId = assigneeId;
                return this;
            }

            public Builder reporterId(String reporterId) {
                this.reporterId = reporterId;
                return this;
            }

            public Builder priority(String priority) {
                this.priority = priority;
                return this;
            }

            public Builder severity(String severity) {
                this.severity = severity;
                return this;
            }

            public Builder customFields(Map<String, String> customFields) {
                this.customFields = customFields;
                return this;
            }

            public Builder sourceRecordId(UUID sourceRecordId) {
                this.sourceRecordId = sourceRecordId;
                return this;
            }

            public NewRecord build() {
                return new NewRecord(recordType, title, description, workflowId, classificationId,
                    departmentId, locationId, channel, assigneeId, reporterId, priority, severity,
                    customFields, sourceRecordId);
            }
        }
    }

    /**
     * Conversion of a record into a request.
     *
     * @param transitionId transition to execute on the source first, or null
     * @param workflowId workflow of the new request, or null to match one
     * @param title overrides the source title when non-blank
     * @param description overrides the source description when non-blank
     * @param classificationId overrides the source classification when non-blank
     * @param assigneeId overrides the source assignee when non-blank
     * @param departmentId overrides the source department when non-blank
     */
    public record ConvertToRequest(
        UUID recordId,
        long expectedVersion,
        UUID transitionId,
        TransitionPayload payload,
        UUID workflowId,
        String title,
        String description,
        String classificationId,
        String assigneeId,
        String departmentId
    ) {
        public static ConvertToRequest of(UUID recordId, long expectedVersion) {
            return new ConvertToRequest(recordId, expectedVersion, null, null, null, null, null, null, null, null);
        }

        public ConvertToRequest viaTransition(UUID newTransitionId, TransitionPayload newPayload) {
            return new ConvertToRequest(recordId, expectedVersion, newTransitionId, newPayload,
                workflowId, title, description, classificationId, assigneeId, departmentId);
        }

        public ConvertToRequest intoWorkflow(UUID newWorkflowId) {
            return new ConvertToRequest(recordId, expectedVersion, transitionId, payload,
                newWorkflowId, title, description, classificationId, assigneeId, departmentId);
        }
    }

    /**
     * @param source the source record after the optional transition
     * @param request the new request
     * @param warnings failed actions of the optional transition
     */
    public record Conversion(CaseRecord source, CaseRecord request, List<ActionWarning> warnings) {
    }
}
