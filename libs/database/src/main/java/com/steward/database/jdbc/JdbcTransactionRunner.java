package com.steward.database.jdbc;

import com.steward.access.store.TransactionRunner;
import java.util.function.Supplier;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link TransactionRunner} backed by a Spring {@link TransactionTemplate}.
 *
 * <p>Joins a transaction already open on the calling thread ({@code PROPAGATION_REQUIRED}). A
 * runtime exception thrown by the work rolls everything back and reaches the caller unchanged.
 */
public class JdbcTransactionRunner implements TransactionRunner {

    private final TransactionTemplate template;

    public JdbcTransactionRunner(PlatformTransactionManager transactionManager) {
        this.template = new TransactionTemplate(transactionManager);
        this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return template.execute(status -> work.get());
    }
}
