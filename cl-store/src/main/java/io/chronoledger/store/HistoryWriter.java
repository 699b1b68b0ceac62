package io.chronoledger.store;

import io.chronoledger.core.AttributeChange;
import io.chronoledger.core.HistoryRow;
import io.chronoledger.core.TemporalEntity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Appends one history row per changed attribute. Rows of one batch share the vclock and
 * instant; rerunning a batch for the same vclock writes nothing new.
 */
public final class HistoryWriter {
    private final TemporalStatements statements;

    public HistoryWriter(TemporalStatements statements) {
        this.statements = Objects.requireNonNull(statements);
    }

    public void record(TemporalEntity entity, int vclock, Instant at, List<AttributeChange> changes) {
        var type = entity.entityType();
        for (var change : changes) {
            var open = statements.openHistory(type, entity.id(), change.name());
            if (open.isPresent()) {
                var current = open.get();
                if (current.vclock() == vclock) {
                    if (!current.values().equals(change.after())) {
                        throw new IllegalStateException(change.name() + " of " + entity
                                + " already recorded a different value at vclock " + vclock);
                    }
                    continue;
                }
                if (current.vclock() > vclock) {
                    throw new IllegalStateException(change.name() + " of " + entity
                            + " is already at vclock " + current.vclock() + ", cannot record " + vclock);
                }
                statements.closeHistory(type, entity.id(), change.name(), current.vclock(), at);
            }
            statements.insertHistory(type, HistoryRow.open(entity.id(), change.name(), vclock, change.after(), at));
        }
    }
}
