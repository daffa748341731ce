package com.casework.core.repository;

import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for case records.
 * Every update is a compare-and-swap on the record version.
 */
public interface CaseRecordRepository {

    /**
     * Save a new record.
     *
     * @param record the record, at its initial version
     */
    void save(CaseRecord record);

    /**
     * Update an existing record with optimistic locking.
     * The stored version must equal {@code record.version() - 1}.
     *
     * @param record the record carrying its incremented version
     * @throws com.casework.core.exception.StaleVersionException if another writer got there first
     */
    void update(CaseRecord record);

    Optional<CaseRecord> findById(UUID recordId);

    Optional<CaseRecord> findByRecordNumber(String recordNumber);

    /**
     * Records whose SLA deadline passed, that are not yet flagged and not closed.
     *
     * @param now current time
     * @param limit maximum number of results
     * @return candidates ordered by deadline, oldest first
     */
    List<CaseRecord> findSlaBreachCandidates(Instant now, int limit);

    /**
     * Flip the breach flag if the record is still open, unflagged and past its deadline,
     * incrementing the version.
     *
     * @param recordId the record
     * @param now time of the flip
     * @return the updated record if this call performed the flip, empty if it no longer qualifies
     */
    Optional<CaseRecord> markSlaBreached(UUID recordId, Instant now);

    /**
     * Records flagged as breached and still open, most overdue first.
     */
    List<CaseRecord> findBreached(int limit);

    long countBreached();

    long countByWorkflow(UUID workflowId);

    /**
     * Next value of the per-type, per-year numbering sequence, starting at 1.
     */
    long nextSequence(RecordType recordType, int year);
}
