package com.casework.core.repository;

import com.casework.core.model.TransitionHistoryEntry;

import java.util.List;
import java.util.UUID;

/**
 * Append-only transition history.
 */
public interface TransitionHistoryRepository {

    void append(TransitionHistoryEntry entry);

    /**
     * History of a record, oldest first.
     */
    List<TransitionHistoryEntry> findByRecord(UUID recordId);
}
