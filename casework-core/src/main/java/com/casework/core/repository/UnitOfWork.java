package com.casework.core.repository;

import java.util.function.Supplier;

/**
 * Runs a group of repository writes atomically.
 * If the work throws, none of its writes become visible.
 */
public interface UnitOfWork {

    <T> T inTransaction(Supplier<T> work);

    default void run(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
