package com.casework.engine.persistence;

import com.casework.core.model.Page;
import com.casework.core.model.Revision;
import com.casework.core.model.RevisionQuery;
import com.casework.core.repository.RevisionRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of RevisionRepository.
 */
public class InMemoryRevisionRepository implements RevisionRepository {

    private final Map<UUID, List<Revision>> revisions = new ConcurrentHashMap<>();

    @Override
    public Revision append(Revision revision) {
        Revision[] stored = new Revision[1];
        revisions.compute(revision.recordId(), (id, existing) -> {
            List<Revision> list = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            long next = list.isEmpty() ? 1L : list.get(list.size() - 1).revisionNumber() + 1;
            stored[0] = revision.withRevisionNumber(next);
            list.add(stored[0]);
            return list;
        });
        return stored[0];
    }

    @Override
    public Page<Revision> query(RevisionQuery query) {
        List<Revision> matching = revisions.values().stream()
            .flatMap(List::stream)
            .filter(query::matches)
            .sorted(Comparator.comparing(Revision::timestamp)
                .thenComparing(Revision::revisionNumber)
                .reversed())
            .toList();

        List<Revision> items = matching.stream()
            .skip(query.offset())
            .limit(query.size())
            .toList();
        return new Page<>(items, query.page(), query.size(), matching.size());
    }

    @Override
    public List<Revision> findByRecord(UUID recordId) {
        return List.copyOf(revisions.getOrDefault(recordId, List.of()));
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int[] removed = new int[1];
        for (UUID recordId : revisions.keySet()) {
            revisions.computeIfPresent(recordId, (id, list) -> {
                List<Revision> kept = list.stream()
                    .filter(r -> !r.timestamp().isBefore(cutoff))
                    .toList();
                removed[0] += list.size() - kept.size();
                return new ArrayList<>(kept);
            });
        }
        return removed[0];
    }
}
