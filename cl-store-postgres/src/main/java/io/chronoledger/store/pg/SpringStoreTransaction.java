package io.chronoledger.store.pg;

import io.chronoledger.store.StoreTransaction;
import io.chronoledger.store.TemporalStatements;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Objects;

/**
 * The Spring-managed transaction bound to the current thread. Before-commit callbacks run
 * as {@link TransactionSynchronization#beforeCommit(boolean)}, so an exception they throw
 * rolls the whole transaction back.
 */
public final class SpringStoreTransaction implements StoreTransaction {
    private final TemporalStatements statements;
    private final TransactionStatus status;

    public SpringStoreTransaction(TemporalStatements statements, TransactionStatus status) {
        this.statements = Objects.requireNonNull(statements);
        this.status = Objects.requireNonNull(status);
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException("no Spring managed transaction is active on this thread");
        }
    }

    @Override
    public TemporalStatements statements() { return statements; }

    @Override
    public void setRollbackOnly() {
        status.setRollbackOnly();
    }

    @Override
    public void onBeforeCommit(Runnable callback) {
        Objects.requireNonNull(callback);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override public void beforeCommit(boolean readOnly) { callback.run(); }
        });
    }
}
