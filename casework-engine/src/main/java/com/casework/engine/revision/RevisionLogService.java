package com.casework.engine.revision;

import com.casework.core.exception.ForbiddenException;
import com.casework.core.model.Actor;
import com.casework.core.model.Page;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionActionType;
import com.casework.core.model.RevisionQuery;
import com.casework.core.repository.RevisionRepository;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only audit log of record mutations.
 *
 * <p>Revisions are written in the same unit of work as the mutation they describe.
 * The only deletion path is {@link #purgeOlderThan}, which requires the
 * {@value #RETENTION_AUTHORITY} authority.
 */
public class RevisionLogService {

    private static final Logger log = LoggerFactory.getLogger(RevisionLogService.class);

    public static final String RETENTION_AUTHORITY = "audit:retention";

    private final RevisionRepository repository;
    private final Clock clock;

    public RevisionLogService(RevisionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Revision append(
            UUID recordId,
            RevisionActionType actionType,
            String performedBy,
            String description,
            JsonNode payloadSnapshot) {
        Revision revision = repository.append(Revision.create(
            recordId, actionType, performedBy, clock.instant(), description, payloadSnapshot));
        log.debug("Revision {} {} on record {} by {}",
            revision.revisionNumber(), actionType, recordId, performedBy);
        return revision;
    }

    /**
     * Filtered page of revisions, newest first.
     */
    public Page<Revision> query(RevisionQuery query) {
        return repository.query(query);
    }

    /**
     * Every revision of a record in revision-number order.
     */
    public List<Revision> revisionsOf(UUID recordId) {
        return repository.findByRecord(recordId);
    }

    /**
     * Delete revisions older than the cutoff.
     *
     * @throws ForbiddenException if the actor lacks the retention authority
     */
    public int purgeOlderThan(Instant cutoff, Actor actor) {
        if (!actor.hasRole(RETENTION_AUTHORITY)) {
            throw new ForbiddenException(String.format(
                "Purging revisions requires the '%s' authority", RETENTION_AUTHORITY));
        }
        int deleted = repository.deleteOlderThan(cutoff);
        log.info("Purged {} revisions older than {} on behalf of {}", deleted, cutoff, actor.id());
        return deleted;
    }
}
