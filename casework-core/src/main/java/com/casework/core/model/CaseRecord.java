package com.casework.core.model;

import com.casework.core.matching.MatchCriteria;
import com.casework.core.matching.MatchDimension;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A tracked case (incident, request, complaint or query).
 *
 * Invariants:
 * - version starts at 1 and increases by exactly one per persisted mutation
 * - currentStateId always belongs to workflowId
 * - currentStateId only changes through the transition engine
 * - once slaBreached is true it stays true until a state with an SLA is entered
 */
public record CaseRecord(
    UUID id,
    String recordNumber,
    RecordType recordType,

    String title,
    String description,

    // Workflow position
    UUID workflowId,
    UUID currentStateId,

    // Routing attributes
    String classificationId,
    String departmentId,
    String locationId,
    String channel,

    // People
    String assigneeId,
    String reporterId,

    String priority,
    String severity,
    Map<String, String> customFields,

    // SLA
    Instant slaDueAt,
    boolean slaBreached,

    // Links and lifecycle timestamps
    UUID sourceRecordId,
    Instant resolvedAt,
    Instant closedAt,
    Instant createdAt,
    Instant updatedAt,

    // Optimistic locking
    long version
) {
    public static final long INITIAL_VERSION = 1L;

    public CaseRecord {
        customFields = customFields == null ? Map.of() : Map.copyOf(customFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Value of a named field, looking at built-in attributes before custom fields.
     */
    public String fieldValue(String fieldName) {
        return switch (fieldName) {
            case "title" -> title;
            case "description" -> description;
            case "priority" -> priority;
            case "severity" -> severity;
            case "channel" -> channel;
            case "assigneeId" -> assigneeId;
            case "reporterId" -> reporterId;
            case "classificationId" -> classificationId;
            case "departmentId" -> departmentId;
            case "locationId" -> locationId;
            default -> customFields.get(fieldName);
        };
    }

    /**
     * Routing attributes in the form the criteria matcher consumes.
     */
    public MatchCriteria criteria() {
        return MatchCriteria.builder()
            .with(MatchDimension.CLASSIFICATION, classificationId)
            .with(MatchDimension.LOCATION, locationId)
            .with(MatchDimension.DEPARTMENT, departmentId)
            .with(MatchDimension.CHANNEL, channel)
            .with(MatchDimension.RECORD_TYPE, recordType == null ? null : recordType.name())
            .build();
    }

    public boolean isClosed() {
        return closedAt != null;
    }

    public boolean isSlaOverdue(Instant now) {
        return !slaBreached && slaDueAt != null && slaDueAt.isBefore(now);
    }

    public static class Builder {
        private UUID id;
        private String recordNumber;
        private RecordType recordType;
        private String title;
        private String description;
        private UUID workflowId;
        private UUID currentStateId;
        private String classificationId;
        private String departmentId;
        private String locationId;
        private String channel;
        private String assigneeId;
        private String reporterId;
        private String priority;
        private String severity;
        private Map<String, String> customFields = Map.of();
        private Instant slaDueAt;
        private boolean slaBreached;
        private UUID sourceRecordId;
        private Instant resolvedAt;
        private Instant closedAt;
        private Instant createdAt;
        private Instant updatedAt;
        private long version = INITIAL_VERSION;

        public Builder() {
            this.id = UUID.randomUUID();
        }

        public Builder(CaseRecord record) {
            this.id = record.id();
            this.recordNumber = record.recordNumber();
            this.recordType = record.recordType();
            this.title = record.title();
            this.description = record.description();
            this.workflowId = record.workflowId();
            this.currentStateId = record.currentStateId();
            this.classificationId = record.classificationId();
            this.departmentId = record.departmentId();
            this.locationId = record.locationId();
            this.channel = record.channel();
            this.assigneeId = record.assigneeId();
            this.reporterId = record.reporterId();
            this.priority = record.priority();
            this.severity = record.severity();
            this.customFields = record.customFields();
            this.slaDueAt = record.slaDueAt();
            this.slaBreached = record.slaBreached();
            this.sourceRecordId = record.sourceRecordId();
            this.resolvedAt = record.resolvedAt();
            this.closedAt = record.closedAt();
            this.createdAt = record.createdAt();
            this.updatedAt = record.updatedAt();
            this.version = record.version();
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder recordNumber(String recordNumber) {
            this.recordNumber = recordNumber;
            return this;
        }

        public Builder recordType(RecordType recordType) {
            this.recordType = recordType;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder workflowId(UUID workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder currentStateId(UUID currentStateId) {
            this.currentStateId = currentStateId;
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

        public Builder customField(String name, String value) {
            var copy = new HashMap<>(customFields);
            if (value == null) {
                copy.remove(name);
            } else {
                copy.put(name, value);
            }
            this.customFields = copy;
            return this;
        }

        public Builder slaDueAt(Instant slaDueAt) {
            this.slaDueAt = slaDueAt;
            return this;
        }

        public Builder slaBreached(boolean slaBreached) {
            this.slaBreached = slaBreached;
            return this;
        }

        public Builder sourceRecordId(UUID sourceRecordId) {
            this.sourceRecordId = sourceRecordId;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
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

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public CaseRecord build() {
            return new CaseRecord(
                id, recordNumber, recordType, title, description,
                workflowId, currentStateId,
                classificationId, departmentId, locationId, channel,
                assigneeId, reporterId, priority, severity, customFields,
                slaDueAt, slaBreached, sourceRecordId,
                resolvedAt, closedAt, createdAt, updatedAt, version
            );
        }
    }
}
