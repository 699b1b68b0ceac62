package io.chronoledger.store.pg;

import io.chronoledger.core.ConcurrentEntityModificationException;
import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.store.SessionFactory;
import io.chronoledger.store.TemporalSession;
import io.chronoledger.store.TemporalStatements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Function;

/** Runs each session in its own transaction from a {@link TransactionTemplate}. */
public final class SpringSessionFactory implements SessionFactory {
    private static final Logger log = LoggerFactory.getLogger(SpringSessionFactory.class);

    private final TransactionTemplate transactions;
    private final TemporalStatements statements;
    private final PolicyRegistry policies;
    private final Clock clock;

    public SpringSessionFactory(TransactionTemplate transactions, TemporalStatements statements,
                                PolicyRegistry policies, Clock clock) {
        this.transactions = Objects.requireNonNull(transactions);
        this.statements = Objects.requireNonNull(statements);
        this.policies = Objects.requireNonNull(policies);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public <T> T inSession(Function<TemporalSession, T> work) {
        try {
            return transactions.execute(status -> {
                var result = work.apply(TemporalSession.open(new SpringStoreTransaction(statements, status), policies, clock));
                if (status.isRollbackOnly()) {
                    // the template would roll back silently and hand back the result
                    throw new IllegalStateException("transaction was marked rollback-only");
                }
                return result;
            });
        } catch (ConcurrencyFailureException e) {
            // serialization failures surface at commit
            log.warn("Transaction lost a write conflict: {}", e.getMessage());
            throw new ConcurrentEntityModificationException(null, "write conflict at commit", e);
        }
    }
}
