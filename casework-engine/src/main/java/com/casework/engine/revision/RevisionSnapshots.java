package com.casework.engine.revision;

import com.casework.core.model.CaseRecord;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

/**
 * Builders for revision payload snapshots. Values are stored as text.
 */
public final class RevisionSnapshots {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RevisionSnapshots() {
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    /**
     * Key attributes of a record at the time of the revision.
     */
    public static ObjectNode record(CaseRecord record) {
        ObjectNode node = NODES.objectNode();
        put(node, "recordNumber", record.recordNumber());
        put(node, "recordType", record.recordType());
        put(node, "workflowId", record.workflowId());
        put(node, "currentStateId", record.currentStateId());
        put(node, "assigneeId", record.assigneeId());
        put(node, "departmentId", record.departmentId());
        put(node, "slaDueAt", record.slaDueAt());
        node.put("slaBreached", record.slaBreached());
        node.put("version", record.version());
        return node;
    }

    /**
     * A single field change with its old and new values.
     */
    public static ObjectNode change(String field, Object oldValue, Object newValue) {
        ObjectNode node = NODES.objectNode();
        node.put("field", field);
        put(node, "old", oldValue);
        put(node, "new", newValue);
        return node;
    }

    /**
     * Several field changes keyed by field name. Unchanged entries are skipped.
     *
     * @param changes field name to a two-element array of old and new value
     */
    public static ObjectNode changes(Map<String, Object[]> changes) {
        ObjectNode node = NODES.objectNode();
        ObjectNode fields = node.putObject("changes");
        changes.forEach((field, values) -> {
            if (!Objects.equals(values[0], values[1])) {
                ObjectNode entry = fields.putObject(field);
                put(entry, "old", values[0]);
                put(entry, "new", values[1]);
            }
        });
        return node;
    }

    public static void put(ObjectNode node, String key, Object value) {
        node.put(key, value == null ? null : value.toString());
    }
}
