package com.casework.engine.persistence;

import com.casework.core.repository.UnitOfWork;

import java.util.function.Supplier;

/**
 * Unit of work for the in-memory repositories.
 * Writes are serialized on a single lock; there is no rollback, so callers run
 * every check that can fail before the first write.
 */
public class InMemoryUnitOfWork implements UnitOfWork {

    private final Object lock = new Object();

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        synchronized (lock) {
            return work.get();
        }
    }
}
