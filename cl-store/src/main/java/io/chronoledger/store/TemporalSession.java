package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.EntityNotFoundException;
import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.core.RecordingScope;
import io.chronoledger.core.TemporalDeleteException;
import io.chronoledger.core.TemporalEntity;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Unit of work over one store transaction: an identity map of the entities it created or
 * loaded, the recording scope they are mutated under, and the flush that turns their
 * changes into versions right before the transaction commits.
 *
 * Not thread safe; a session must not outlive or leave its transaction.
 */
public final class TemporalSession {
    private final StoreTransaction transaction;
    private final PolicyRegistry policies;
    private final FlushCoordinator coordinator;
    private final RecordingScope scope = new RecordingScope();
    private final Map<EntityId, TemporalEntity> entities = new LinkedHashMap<>();
    private RuntimeException failure;

    private TemporalSession(StoreTransaction transaction, PolicyRegistry policies, Clock clock) {
        this.transaction = Objects.requireNonNull(transaction);
        this.policies = Objects.requireNonNull(policies);
        this.coordinator = new FlushCoordinator(transaction.statements(), clock);
    }

    /** A session whose pending changes are flushed when {@code transaction} commits. */
    public static TemporalSession open(StoreTransaction transaction, PolicyRegistry policies, Clock clock) {
        var session = new TemporalSession(transaction, policies, clock);
        transaction.onBeforeCommit(session::flush);
        return session;
    }

    public TemporalEntity create(String entityType, EntityId id, Map<String, ?> values) {
        return create(entityType, id, values, null);
    }

    public TemporalEntity create(String entityType, EntityId id, Map<String, ?> values, String activity) {
        if (entities.containsKey(id) || transaction.statements().loadEntity(id).isPresent()) {
            throw new IllegalArgumentException("entity " + id + " already exists");
        }
        var entity = TemporalEntity.create(policies.policyFor(entityType), id, values, activity, scope);
        entities.put(id, entity);
        return entity;
    }

    /** The session's copy of the entity, loading its last flushed state on first access. */
    public TemporalEntity load(EntityId id) {
        return find(id).orElseThrow(() -> new EntityNotFoundException(id));
    }

    public Optional<TemporalEntity> find(EntityId id) {
        var known = entities.get(id);
        if (known != null) return Optional.of(known);
        return transaction.statements().loadEntity(id).map(state -> {
            var entity = TemporalEntity.loaded(policies.policyFor(state.entityType()), state, scope);
            entities.put(id, entity);
            return entity;
        });
    }

    public RecordingScope scope() { return scope; }

    public RecordingScope.Tick tick() { return scope.enter(); }

    public RecordingScope.Tick tick(String activity) { return scope.enter(activity); }

    public void delete(TemporalEntity entity) {
        throw new TemporalDeleteException(entity.id());
    }

    /**
     * Record pending changes now instead of waiting for commit. A failed flush marks the
     * transaction rollback-only, and every later flush of this session fails too.
     */
    public List<ClockRecord> flush() {
        if (failure != null) {
            throw new IllegalStateException("session failed an earlier flush", failure);
        }
        try {
            return coordinator.flush(entities.values(), scope);
        } catch (RuntimeException e) {
            failure = e;
            transaction.setRollbackOnly();
            throw e;
        }
    }

    /** Reads within this transaction, including versions flushed but not yet committed. */
    public TemporalQueries queries() { return transaction.statements(); }
}
