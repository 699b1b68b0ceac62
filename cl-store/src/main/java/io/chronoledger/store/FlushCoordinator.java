package io.chronoledger.store;

import io.chronoledger.core.ActivityRequiredException;
import io.chronoledger.core.AttributeChange;
import io.chronoledger.core.ChangeSetDetector;
import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.ConcurrentEntityModificationException;
import io.chronoledger.core.DuplicateActivityException;
import io.chronoledger.core.EntityState;
import io.chronoledger.core.OutOfOrderException;
import io.chronoledger.core.RecordingScope;
import io.chronoledger.core.ScopeMisuseException;
import io.chronoledger.core.TemporalEntity;
import io.chronoledger.core.UnscopedMutationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns the pending changes of a session into versions: detector, then history writer,
 * then clock ledger, then the entity row, for each dirty entity in id order.
 *
 * Every entity is validated before the first statement: scope, activity, composite
 * integrity, the open version and the flush instant. All statements go to the caller's
 * transaction; in-memory entities adopt their new state only after every entity succeeded.
 */
public final class FlushCoordinator {
    private static final Logger log = LoggerFactory.getLogger(FlushCoordinator.class);

    private final TemporalStatements statements;
    private final ChangeSetDetector detector = new ChangeSetDetector();
    private final ClockLedger ledger;
    private final HistoryWriter writer;
    private final Clock clock;

    public FlushCoordinator(TemporalStatements statements, Clock clock) {
        this.statements = Objects.requireNonNull(statements);
        this.clock = Objects.requireNonNull(clock);
        this.ledger = new ClockLedger(statements);
        this.writer = new HistoryWriter(statements);
    }

    private record Plan(TemporalEntity entity, List<AttributeChange> changes) {
        boolean versioned() { return entity.isNew() || !changes.isEmpty(); }
    }

    /** @return the versions opened by this flush, in entity order */
    public List<ClockRecord> flush(Collection<TemporalEntity> entities, RecordingScope scope) {
        if (scope.isActive()) {
            throw new ScopeMisuseException("cannot flush inside an open recording scope (depth " + scope.depth() + ")");
        }
        var dirty = entities.stream()
                .filter(e -> e.isDirty() || e.isUnscopedDirty())
                .sorted(Comparator.comparing(TemporalEntity::id))
                .toList();
        if (dirty.isEmpty()) return List.of();

        for (var e : dirty) {
            if (e.policy().scopeRequired() && e.isUnscopedDirty()) {
                var field = e.unscopedFields().iterator().next();
                log.warn("Rejecting flush: {} changed {} outside a recording scope", e, field);
                throw new UnscopedMutationException(e.id(), e.entityType(), field);
            }
        }

        var at = clock.instant();
        var plans = new ArrayList<Plan>(dirty.size());
        for (var e : dirty) {
            var changes = e.isNew()
                    ? detector.initial(e.policy(), statements.canonical(e.values()))
                    : detector.diff(e.policy(), statements.canonical(e.baseline()), statements.canonical(e.values()));
            var plan = new Plan(e, changes);
            if (plan.versioned()) check(e, at);
            plans.add(plan);
        }

        log.debug("Flushing {} entities at {}", plans.size(), at);
        var opened = new ArrayList<ClockRecord>();
        var versions = new int[plans.size()];
        for (int i = 0; i < plans.size(); i++) {
            var plan = plans.get(i);
            var e = plan.entity();
            if (e.isNew()) {
                writer.record(e, 1, at, plan.changes());
                opened.add(ledger.start(e, at));
                statements.insertEntity(new EntityState(e.id(), e.entityType(), 1, e.values()));
                versions[i] = 1;
            } else if (plan.versioned()) {
                var next = e.vclock() + 1;
                writer.record(e, next, at, plan.changes());
                opened.add(ledger.advance(e, at));
                statements.updateEntity(new EntityState(e.id(), e.entityType(), next, e.values()), e.vclock());
                versions[i] = next;
            } else {
                // only untracked fields changed: new state, same version
                statements.updateEntity(e.state(), e.vclock());
                versions[i] = e.vclock();
            }
        }

        for (int i = 0; i < plans.size(); i++) {
            plans.get(i).entity().markFlushed(versions[i]);
        }
        log.debug("Flush opened {} versions", opened.size());
        return opened;
    }

    /** Everything that could stop the entity from taking a new version at {@code at}. */
    private void check(TemporalEntity e, Instant at) {
        var activity = e.activity();
        if (e.policy().activityRequired() && activity == null) {
            throw new ActivityRequiredException(e.entityType(), e.id());
        }
        if (e.isNew()) return;
        var current = statements.openClock(e.entityType(), e.id())
                .orElseThrow(() -> new ConcurrentEntityModificationException(e.id(), e + " has no open version"));
        if (current.vclock() != e.vclock()) {
            throw new ConcurrentEntityModificationException(e.id(),
                    e + " was loaded at vclock " + e.vclock() + " but the ledger is at " + current.vclock());
        }
        if (at.isBefore(current.tickStart())) {
            throw new OutOfOrderException(e.id(), current.tickStart(), at);
        }
        if (activity != null && statements.clocks(e.entityType(), e.id()).stream()
                .anyMatch(c -> activity.equals(c.activity()))) {
            throw new DuplicateActivityException(e.id(), activity);
        }
    }
}
