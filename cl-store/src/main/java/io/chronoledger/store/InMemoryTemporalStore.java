package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.ConcurrentEntityModificationException;
import io.chronoledger.core.DuplicateActivityException;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.EntityState;
import io.chronoledger.core.HistoryRow;
import io.chronoledger.core.PolicyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Heap backed store with snapshot isolation.
 *
 * A transaction works on private copies of the entities it touches and publishes them on
 * commit, unless another transaction committed any entity it wrote in the meantime; then the
 * commit fails with {@link ConcurrentEntityModificationException} and nothing is applied.
 * Every commit of an entity bumps its revision, so changes that keep the vclock conflict too.
 */
public final class InMemoryTemporalStore implements TemporalStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTemporalStore.class);

    private final Map<EntityId, Ledger> byId = new HashMap<>();
    private final SubmissionPublisher<ClockRecord> bus = new SubmissionPublisher<>();

    /** Everything stored for one entity. */
    private static final class Ledger {
        EntityState state;
        long revision;
        final List<ClockRecord> clocks = new ArrayList<>();
        final Map<String, List<HistoryRow>> history = new HashMap<>();

        Ledger copy() {
            var c = new Ledger();
            c.state = state;
            c.revision = revision;
            c.clocks.addAll(clocks);
            history.forEach((k, v) -> c.history.put(k, new ArrayList<>(v)));
            return c;
        }
    }

    public InMemoryTransaction begin() { return new InMemoryTransaction(); }

    /** Sessions that each run in their own transaction against this store. */
    public SessionFactory sessions(PolicyRegistry policies, Clock clock) {
        return new SessionFactory() {
            @Override
            public <T> T inSession(Function<TemporalSession, T> work) {
                try (var tx = begin()) {
                    var result = work.apply(TemporalSession.open(tx, policies, clock));
                    tx.commit();
                    return result;
                }
            }
        };
    }

    @Override
    public synchronized List<ClockRecord> clocks(String entityType, EntityId id) {
        var l = byId.get(id);
        return l == null ? List.of() : List.copyOf(l.clocks);
    }

    @Override
    public synchronized List<HistoryRow> history(String entityType, EntityId id, String attribute) {
        var l = byId.get(id);
        return l == null ? List.of() : List.copyOf(l.history.getOrDefault(attribute, List.of()));
    }

    @Override
    public Flow.Publisher<ClockRecord> subscribe() {
        return bus;
    }

    private synchronized Ledger snapshot(EntityId id) {
        var l = byId.get(id);
        return l == null ? null : l.copy();
    }

    private synchronized void apply(Map<EntityId, Long> readAt, Map<EntityId, Ledger> writes) {
        for (var id : writes.keySet()) {
            var current = byId.get(id);
            long committed = current == null ? 0 : current.revision;
            if (committed != readAt.get(id)) {
                log.warn("Write conflict on {}: read revision {}, committed {}", id, readAt.get(id), committed);
                throw new ConcurrentEntityModificationException(id,
                        "entity " + id + " was modified concurrently (read revision " + readAt.get(id)
                                + ", committed " + committed + ")");
            }
        }
        writes.forEach((id, l) -> l.revision = readAt.get(id) + 1);
        byId.putAll(writes);
    }

    /** A unit of work against the store; reads see the transaction's own writes. */
    public final class InMemoryTransaction implements StoreTransaction, TemporalStatements, AutoCloseable {
        private final Map<EntityId, Ledger> working = new HashMap<>();
        private final Map<EntityId, Long> readAt = new HashMap<>();
        private final Set<EntityId> written = new LinkedHashSet<>();
        private final List<Runnable> beforeCommit = new ArrayList<>();
        private final List<ClockRecord> opened = new ArrayList<>();
        private boolean finished;
        private boolean rollbackOnly;

        private InMemoryTransaction() {}

        @Override public TemporalStatements statements() { return this; }

        @Override
        public void onBeforeCommit(Runnable callback) {
            ensureOpen();
            beforeCommit.add(Objects.requireNonNull(callback));
        }

        @Override
        public void setRollbackOnly() {
            ensureOpen();
            rollbackOnly = true;
        }

        public void commit() {
            ensureOpen();
            if (rollbackOnly) {
                rollback();
                throw new IllegalStateException("transaction was marked rollback-only");
            }
            try {
                for (var callback : List.copyOf(beforeCommit)) callback.run();
                var writes = new HashMap<EntityId, Ledger>();
                written.forEach(id -> writes.put(id, working.get(id)));
                apply(readAt, writes);
            } finally {
                finished = true;
            }
            log.debug("Committed {} entities, {} new versions", written.size(), opened.size());
            // a version opened by an explicit flush may have been closed by a later one
            for (var record : opened) {
                working.get(record.entityId()).clocks.stream()
                        .filter(c -> c.vclock() == record.vclock())
                        .findFirst()
                        .ifPresent(bus::submit);
            }
        }

        public void rollback() {
            finished = true;
            working.clear();
            written.clear();
        }

        public boolean isFinished() { return finished; }

        /** Rolls back unless committed. */
        @Override
        public void close() {
            if (!finished) rollback();
        }

        private void ensureOpen() {
            if (finished) throw new IllegalStateException("transaction already finished");
        }

        private Ledger read(EntityId id) {
            ensureOpen();
            if (!working.containsKey(id)) {
                var l = snapshot(id);
                working.put(id, l);
                readAt.put(id, l == null ? 0L : l.revision);
            }
            return working.get(id);
        }

        private Ledger write(EntityId id) {
            var l = read(id);
            if (l == null || l.state == null) throw new IllegalStateException("no entity " + id);
            written.add(id);
            return l;
        }

        @Override
        public Optional<EntityState> loadEntity(EntityId id) {
            var l = read(id);
            return l == null ? Optional.empty() : Optional.ofNullable(l.state);
        }

        @Override
        public void insertEntity(EntityState state) {
            var l = read(state.id());
            if (l != null && l.state != null) {
                throw new ConcurrentEntityModificationException(state.id(), "entity " + state.id() + " already exists");
            }
            if (l == null) {
                l = new Ledger();
                working.put(state.id(), l);
            }
            l.state = state;
            written.add(state.id());
        }

        @Override
        public void updateEntity(EntityState state, int expectedVclock) {
            var l = write(state.id());
            if (l.state.vclock() != expectedVclock) {
                throw new ConcurrentEntityModificationException(state.id(),
                        "entity " + state.id() + " is at vclock " + l.state.vclock() + ", expected " + expectedVclock);
            }
            l.state = state;
        }

        @Override
        public List<ClockRecord> clocks(String entityType, EntityId id) {
            var l = read(id);
            return l == null ? List.of() : List.copyOf(l.clocks);
        }

        @Override
        public List<HistoryRow> history(String entityType, EntityId id, String attribute) {
            var l = read(id);
            return l == null ? List.of() : List.copyOf(l.history.getOrDefault(attribute, List.of()));
        }

        @Override
        public Optional<ClockRecord> openClock(String entityType, EntityId id) {
            return clocks(entityType, id).stream().filter(ClockRecord::isOpen).findFirst();
        }

        @Override
        public void insertClock(String entityType, ClockRecord record) {
            var l = staged(record.entityId());
            for (var c : l.clocks) {
                if (c.vclock() == record.vclock()) {
                    throw new IllegalStateException("vclock " + record.vclock() + " of " + record.entityId() + " exists");
                }
                if (record.activity() != null && record.activity().equals(c.activity())) {
                    throw new DuplicateActivityException(record.entityId(), record.activity());
                }
            }
            l.clocks.add(record);
            l.clocks.sort(Comparator.comparingInt(ClockRecord::vclock));
            opened.add(record);
        }

        @Override
        public void closeClock(String entityType, EntityId id, int vclock, Instant tickEnd) {
            replaceOpen(staged(id).clocks, c -> c.vclock() == vclock && c.isOpen(), c -> c.closedAt(tickEnd),
                    "no open clock " + vclock + " for " + id);
        }

        @Override
        public Optional<HistoryRow> openHistory(String entityType, EntityId id, String attribute) {
            return history(entityType, id, attribute).stream().filter(HistoryRow::isOpen).findFirst();
        }

        @Override
        public void insertHistory(String entityType, HistoryRow row) {
            var rows = staged(row.entityId()).history.computeIfAbsent(row.attribute(), k -> new ArrayList<>());
            if (rows.stream().anyMatch(r -> r.vclock() == row.vclock())) {
                throw new IllegalStateException(row.attribute() + " of " + row.entityId()
                        + " already has a row at vclock " + row.vclock());
            }
            rows.add(row);
            rows.sort(Comparator.comparingInt(HistoryRow::vclock));
        }

        @Override
        public void closeHistory(String entityType, EntityId id, String attribute, int vclock, Instant tickEnd) {
            var rows = staged(id).history.getOrDefault(attribute, new ArrayList<>());
            replaceOpen(rows, r -> r.vclock() == vclock && r.isOpen(), r -> r.closedAt(tickEnd),
                    "no open " + attribute + " row " + vclock + " for " + id);
        }

        /** Ledger of an entity that may still be uncommitted-new in this transaction. */
        private Ledger staged(EntityId id) {
            var l = read(id);
            if (l == null) {
                l = new Ledger();
                working.put(id, l);
            }
            written.add(id);
            return l;
        }

        private <R> void replaceOpen(List<R> rows, Predicate<R> match, UnaryOperator<R> close, String missing) {
            for (int i = 0; i < rows.size(); i++) {
                if (match.test(rows.get(i))) {
                    rows.set(i, close.apply(rows.get(i)));
                    return;
                }
            }
            throw new IllegalStateException(missing);
        }
    }
}
