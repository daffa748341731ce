package com.casework.engine.persistence;

import com.casework.core.model.TransitionHistoryEntry;
import com.casework.core.repository.TransitionHistoryRepository;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of TransitionHistoryRepository.
 */
public class InMemoryTransitionHistoryRepository implements TransitionHistoryRepository {

    private final Map<UUID, List<TransitionHistoryEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public void append(TransitionHistoryEntry entry) {
        entries.computeIfAbsent(entry.recordId(), k -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<TransitionHistoryEntry> findByRecord(UUID recordId) {
        return List.copyOf(entries.getOrDefault(recordId, List.of()));
    }
}
