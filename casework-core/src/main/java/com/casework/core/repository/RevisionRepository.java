package com.casework.core.repository;

import com.casework.core.model.Page;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionQuery;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit log.
 */
public interface RevisionRepository {

    /**
     * Append a revision, assigning the next revision number for its record.
     *
     * @return the stored revision
     */
    Revision append(Revision revision);

    /**
     * Filtered, paginated lookup ordered by timestamp descending.
     */
    Page<Revision> query(RevisionQuery query);

    /**
     * All revisions of a record in revision-number order.
     */
    List<Revision> findByRecord(UUID recordId);

    /**
     * Remove revisions older than the cutoff. Used only by retention cleanup.
     *
     * @return number of deleted revisions
     */
    int deleteOlderThan(Instant cutoff);
}
