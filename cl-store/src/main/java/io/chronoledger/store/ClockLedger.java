package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.OutOfOrderException;
import io.chronoledger.core.TemporalEntity;

import java.time.Instant;
import java.util.Objects;

/** Append-only version records of each entity. */
public final class ClockLedger {
    private final TemporalStatements statements;

    public ClockLedger(TemporalStatements statements) {
        this.statements = Objects.requireNonNull(statements);
    }

    /** First version of a newly created entity. */
    public ClockRecord start(TemporalEntity entity, Instant at) {
        var first = ClockRecord.open(entity.id(), 1, at, entity.activity());
        statements.insertClock(entity.entityType(), first);
        return first;
    }

    /**
     * Close the current version at {@code at} and open the next one. Called at most once per
     * entity per flush, after every change of the batch is known.
     */
    public ClockRecord advance(TemporalEntity entity, Instant at) {
        var type = entity.entityType();
        var current = statements.openClock(type, entity.id())
                .orElseThrow(() -> new IllegalStateException("no open clock for " + entity));
        if (at.isBefore(current.tickStart())) {
            throw new OutOfOrderException(entity.id(), current.tickStart(), at);
        }
        statements.closeClock(type, entity.id(), current.vclock(), at);
        var next = ClockRecord.open(entity.id(), current.vclock() + 1, at, entity.activity());
        statements.insertClock(type, next);
        return next;
    }
}
