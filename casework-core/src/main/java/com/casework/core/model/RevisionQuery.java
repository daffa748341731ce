package com.casework.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Filter and page for revision lookups. Null filters match everything.
 * Pages are zero-based; results are ordered by timestamp descending.
 */
public record RevisionQuery(
    UUID recordId,
    RevisionActionType actionType,
    String performedBy,
    Instant from,
    Instant to,
    int page,
    int size
) {
    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 500;

    public RevisionQuery {
        if (page < 0) {
            page = 0;
        }
        if (size <= 0) {
            size = DEFAULT_SIZE;
        }
        size = Math.min(size, MAX_SIZE);
    }

    public static RevisionQuery forRecord(UUID recordId) {
        return new RevisionQuery(recordId, null, null, null, null, 0, DEFAULT_SIZE);
    }

    public boolean matches(Revision revision) {
        if (recordId != null && !recordId.equals(revision.recordId())) {
            return false;
        }
        if (actionType != null && actionType != revision.actionType()) {
            return false;
        }
        if (performedBy != null && !performedBy.equals(revision.performedBy())) {
            return false;
        }
        if (from != null && revision.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || revision.timestamp().isBefore(to);
    }

    public RevisionQuery withActionType(RevisionActionType type) {
        return new RevisionQuery(recordId, type, performedBy, from, to, page, size);
    }

    public RevisionQuery withPerformedBy(String actorId) {
        return new RevisionQuery(recordId, actionType, actorId, from, to, page, size);
    }

    public RevisionQuery between(Instant newFrom, Instant newTo) {
        return new RevisionQuery(recordId, actionType, performedBy, newFrom, newTo, page, size);
    }

    public RevisionQuery page(int newPage, int newSize) {
        return new RevisionQuery(recordId, actionType, performedBy, from, to, newPage, newSize);
    }

    public long offset() {
        return (long) page * size;
    }
}
