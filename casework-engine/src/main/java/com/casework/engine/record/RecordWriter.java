package com.casework.engine.record;

import com.casework.core.model.CaseRecord;
import com.casework.core.model.RevisionActionType;
import com.casework.core.repository.CaseRecordRepository;
import com.casework.core.repository.UnitOfWork;
import com.casework.engine.revision.RevisionLogService;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Applies one versioned mutation to a record together with its revision.
 * Both writes share a unit of work; a stale version leaves neither behind.
 */
public class RecordWriter {

    private final CaseRecordRepository records;
    private final RevisionLogService revisions;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public RecordWriter(
            CaseRecordRepository records,
            RevisionLogService revisions,
            UnitOfWork unitOfWork,
            Clock clock) {
        this.records = records;
        this.revisions = revisions;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    /**
     * @param current the record as last read; its version is the expected version
     * @param change edits applied on a builder seeded from {@code current}
     * @return the stored record at {@code current.version() + 1}
     * @throws com.casework.core.exception.StaleVersionException if another writer got there first
     */
    public CaseRecord apply(
            CaseRecord current,
            UnaryOperator<CaseRecord.Builder> change,
            RevisionActionType revisionType,
            String performedBy,
            String description,
            JsonNode snapshot) {
        return unitOfWork.inTransaction(() -> {
            CaseRecord updated = change.apply(current.toBuilder())
                .version(current.version() + 1)
                .updatedAt(clock.instant())
                .build();
            records.update(updated);
            revisions.append(updated.id(), revisionType, performedBy, description, snapshot);
            return updated;
        });
    }
}
