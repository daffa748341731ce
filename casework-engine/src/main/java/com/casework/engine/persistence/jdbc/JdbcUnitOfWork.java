package com.casework.engine.persistence.jdbc;

import com.casework.core.repository.UnitOfWork;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Unit of work backed by a Spring transaction.
 * Repository calls made inside join the transaction and roll back together.
 */
public class JdbcUnitOfWork implements UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    public JdbcUnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
