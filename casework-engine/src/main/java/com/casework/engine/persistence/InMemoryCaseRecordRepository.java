package com.casework.engine.persistence;

import com.casework.core.exception.StaleVersionException;
import com.casework.core.model.CaseRecord;
import com.casework.core.model.RecordType;
import com.casework.core.repository.CaseRecordRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of CaseRecordRepository.
 * Version checks run inside {@link ConcurrentHashMap#compute} so concurrent writers
 * observe the same compare-and-swap semantics as the JDBC implementation.
 */
public class InMemoryCaseRecordRepository implements CaseRecordRepository {

    private final Map<UUID, CaseRecord> records = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public void save(CaseRecord record) {
        if (records.putIfAbsent(record.id(), record) != null) {
            throw new IllegalStateException("Record already exists: " + record.id());
        }
    }

    @Override
    public void update(CaseRecord record) {
        long expected = record.version() - 1;
        records.compute(record.id(), (id, stored) -> {
            if (stored == null) {
                throw new StaleVersionException("CaseRecord", id);
            }
            if (stored.version() != expected) {
                throw new StaleVersionException("CaseRecord", id, expected, stored.version());
            }
            return record;
        });
    }

    @Override
    public Optional<CaseRecord> findById(UUID recordId) {
        return Optional.ofNullable(records.get(recordId));
    }

    @Override
    public Optional<CaseRecord> findByRecordNumber(String recordNumber) {
        return records.values().stream()
            .filter(r -> recordNumber.equals(r.recordNumber()))
            .findFirst();
    }

    @Override
    public List<CaseRecord> findSlaBreachCandidates(Instant now, int limit) {
        return records.values().stream()
            .filter(r -> r.isSlaOverdue(now))
            .filter(r -> !r.isClosed())
            .sorted(Comparator.comparing(CaseRecord::slaDueAt))
            .limit(limit)
            .toList();
    }

    @Override
    public Optional<CaseRecord> markSlaBreached(UUID recordId, Instant now) {
        CaseRecord[] flipped = new CaseRecord[1];
        records.computeIfPresent(recordId, (id, stored) -> {
            if (!stored.isSlaOverdue(now) || stored.isClosed()) {
                return stored;
            }
            flipped[0] = stored.toBuilder()
                .slaBreached(true)
                .updatedAt(now)
                .incrementVersion()
                .build();
            return flipped[0];
        });
        return Optional.ofNullable(flipped[0]);
    }

    @Override
    public List<CaseRecord> findBreached(int limit) {
        return records.values().stream()
            .filter(CaseRecord::slaBreached)
            .filter(r -> !r.isClosed())
            .sorted(Comparator.comparing(CaseRecord::slaDueAt, Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(limit)
            .toList();
    }

    @Override
    public long countBreached() {
        return records.values().stream()
            .filter(CaseRecord::slaBreached)
            .filter(r -> !r.isClosed())
            .count();
    }

    @Override
    public long countByWorkflow(UUID workflowId) {
        return records.values().stream()
            .filter(r -> workflowId.equals(r.workflowId()))
            .count();
    }

    @Override
    public long nextSequence(RecordType recordType, int year) {
        return sequences.computeIfAbsent(recordType.name() + ":" + year, k -> new AtomicLong())
            .incrementAndGet();
    }
}
