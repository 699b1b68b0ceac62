package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.ConcurrentEntityModificationException;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.core.TemporalPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTemporalStoreTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private final PolicyRegistry policies = PolicyRegistry.of(
            TemporalPolicy.builder("widget").track("description").build());
    private final InMemoryTemporalStore store = new InMemoryTemporalStore();
    private final MutableClock clock = new MutableClock(T0);

    @Test
    void secondCommitterOfTheSameVersionLoses() {
        var id = EntityId.random();
        store.sessions(policies, clock).run(s -> s.create("widget", id, Map.of("description", "a")));
        clock.advance(Duration.ofSeconds(1));

        try (var first = store.begin(); var second = store.begin()) {
            var s1 = TemporalSession.open(first, policies, clock);
            var s2 = TemporalSession.open(second, policies, clock);
            var w1 = s1.load(id);
            var w2 = s2.load(id);
            try (var tick = s1.tick()) {
                w1.set("description", "from first");
            }
            try (var tick = s2.tick()) {
                w2.set("description", "from second");
            }

            first.commit();
            assertThatThrownBy(second::commit).isInstanceOf(ConcurrentEntityModificationException.class);
        }

        assertThat(store.clocks("widget", id)).hasSize(2);
        assertThat(store.history("widget", id, "description").get(1).value()).isEqualTo("from first");
    }

    @Test
    void concurrentCreatesOfOneIdConflict() {
        var id = EntityId.random();

        try (var first = store.begin(); var second = store.begin()) {
            TemporalSession.open(first, policies, clock).create("widget", id, Map.of("description", "a"));
            TemporalSession.open(second, policies, clock).create("widget", id, Map.of("description", "b"));

            first.commit();
            assertThatThrownBy(second::commit).isInstanceOf(ConcurrentEntityModificationException.class);
        }
        assertThat(store.history("widget", id, "description")).hasSize(1);
    }

    @Test
    void untrackedChangesConflictAlthoughTheVersionStays() {
        var id = EntityId.random();
        store.sessions(policies, clock).run(s -> s.create("widget", id, Map.of("description", "a")));

        try (var first = store.begin(); var second = store.begin()) {
            TemporalSession.open(first, policies, clock).load(id).set("note", "from first");
            TemporalSession.open(second, policies, clock).load(id).set("note", "from second");

            first.commit();
            assertThatThrownBy(second::commit).isInstanceOf(ConcurrentEntityModificationException.class);
        }

        try (var tx = store.begin()) {
            var state = tx.loadEntity(id).orElseThrow();
            assertThat(state.vclock()).isEqualTo(1);
            assertThat(state.values()).containsEntry("note", "from first");
        }
    }

    @Test
    void rollbackOnlyTransactionRefusesToCommit() {
        var id = EntityId.random();

        try (var tx = store.begin()) {
            TemporalSession.open(tx, policies, clock).create("widget", id, Map.of("description", "a"));
            tx.setRollbackOnly();

            assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
            assertThat(tx.isFinished()).isTrue();
        }
        assertThat(store.clocks("widget", id)).isEmpty();
    }

    @Test
    void uncommittedWritesAreInvisible() {
        var id = EntityId.random();

        try (var tx = store.begin()) {
            var s = TemporalSession.open(tx, policies, clock);
            s.create("widget", id, Map.of("description", "a"));
            s.flush();

            assertThat(s.queries().clocks("widget", id)).hasSize(1);
            assertThat(store.clocks("widget", id)).isEmpty();
            tx.rollback();
        }
        assertThat(store.clocks("widget", id)).isEmpty();
    }

    @Test
    void finishedTransactionRejectsFurtherWork() {
        var tx = store.begin();
        tx.commit();

        assertThat(tx.isFinished()).isTrue();
        assertThatThrownBy(tx::commit).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> tx.loadEntity(EntityId.random())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void subscribe_receivesVersionsAfterCommit() throws Exception {
        var received = new CopyOnWriteArrayList<ClockRecord>();
        var latch = new CountDownLatch(2);
        store.subscribe().subscribe(new Flow.Subscriber<>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ClockRecord r) { received.add(r); latch.countDown(); }
            @Override public void onError(Throwable t) {}
            @Override public void onComplete() {}
        });
        var sessions = store.sessions(policies, clock);
        var id = EntityId.random();

        try (var rolledBack = store.begin()) {
            TemporalSession.open(rolledBack, policies, clock).create("widget", EntityId.random(), Map.of());
            rolledBack.rollback();
        }
        sessions.run(s -> s.create("widget", id, Map.of("description", "a")));
        clock.advance(Duration.ofSeconds(1));
        sessions.run(s -> {
            var w = s.load(id);
            try (var tick = s.tick()) {
                w.set("description", "b");
            }
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).extracting(ClockRecord::vclock).isEqualTo(List.of(1, 2));
        assertThat(received).allMatch(r -> r.entityId().equals(id));
    }

    @Test
    void subscribe_receivesEachVersionAsCommitted() throws Exception {
        var received = new CopyOnWriteArrayList<ClockRecord>();
        var latch = new CountDownLatch(3);
        store.subscribe().subscribe(new Flow.Subscriber<>() {
            @Override public void onSubscribe(Flow.Subscription s) { s.request(Long.MAX_VALUE); }
            @Override public void onNext(ClockRecord r) { received.add(r); latch.countDown(); }
            @Override public void onError(Throwable t) {}
            @Override public void onComplete() {}
        });
        var id = EntityId.random();
        var t1 = T0.plusSeconds(1);
        var t2 = T0.plusSeconds(2);

        store.sessions(policies, clock).run(s -> {
            var w = s.create("widget", id, Map.of("description", "a"));
            s.flush();
            clock.set(t1);
            try (var tick = s.tick()) {
                w.set("description", "b");
            }
            s.flush();
            clock.set(t2);
            try (var tick = s.tick()) {
                w.set("description", "c");
            }
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly(
                new ClockRecord(id, 1, T0, t1, null),
                new ClockRecord(id, 2, t1, t2, null),
                ClockRecord.open(id, 3, t2, null));
        assertThat(received).isEqualTo(store.clocks("widget", id));
    }
}
