package io.chronoledger.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory view of a temporal entity inside one session.
 *
 * Changes go through {@link #set(String, Object)}, which keeps the pending value next to
 * the last flushed baseline. Mutations are always accepted; a tracked change made outside a
 * recording scope under a scope-requiring policy is only flagged here and rejected when the
 * session flushes.
 */
public final class TemporalEntity {
    private final EntityId id;
    private final TemporalPolicy policy;
    private final RecordingScope scope;
    private final Map<String, Object> values;
    private final Set<String> unscopedFields = new LinkedHashSet<>();
    private Map<String, Object> baseline;
    private int vclock;
    private boolean created;
    private String activity;

    private TemporalEntity(EntityId id, TemporalPolicy policy, RecordingScope scope,
                           Map<String, ?> values, int vclock, boolean created, String activity) {
        this.id = Objects.requireNonNull(id, "id");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.values = new LinkedHashMap<>(values);
        this.baseline = created ? Map.of() : Values.copyOf(values);
        this.vclock = vclock;
        this.created = created;
        this.activity = activity;
    }

    /**
     * A new entity at version 1. Declared defaults fill tracked attributes the caller
     * did not supply.
     */
    public static TemporalEntity create(TemporalPolicy policy, EntityId id, Map<String, ?> values,
                                        String activity, RecordingScope scope) {
        if (policy.activityRequired() && activity == null) {
            throw new ActivityRequiredException(policy.entityType(), id);
        }
        var initial = new LinkedHashMap<String, Object>(values);
        for (var attribute : policy.attributes()) {
            if (attribute.hasDefault() && !initial.containsKey(attribute.name())) {
                initial.put(attribute.name(), attribute.defaultValue().valueFor(id));
            }
        }
        return new TemporalEntity(id, policy, scope, initial, 1, true, activity);
    }

    /** An entity loaded from its last flushed state. */
    public static TemporalEntity loaded(TemporalPolicy policy, EntityState state, RecordingScope scope) {
        if (!policy.entityType().equals(state.entityType())) {
            throw new IllegalArgumentException(state.id() + " is a " + state.entityType()
                    + ", not a " + policy.entityType());
        }
        return new TemporalEntity(state.id(), policy, scope, state.values(), state.vclock(), false, null);
    }

    public TemporalEntity set(String field, Object value) {
        Objects.requireNonNull(field, "field");
        values.put(field, value);
        if (policy.isTracked(field)) {
            if (scope.isActive()) {
                var scoped = scope.activity();
                if (scoped != null) activity = scoped;
            } else if (policy.scopeRequired()) {
                unscopedFields.add(field);
            }
        }
        return this;
    }

    public Object get(String field) { return values.get(field); }

    /** Whether the field was ever assigned, including an explicit null. */
    public boolean isAssigned(String field) { return values.containsKey(field); }

    public EntityId id() { return id; }
    public String entityType() { return policy.entityType(); }
    public TemporalPolicy policy() { return policy; }

    /** Current version; 1 for an entity created in this session. */
    public int vclock() { return vclock; }

    public boolean isNew() { return created; }

    public boolean isDirty() { return created || !values.equals(baseline); }

    public boolean isUnscopedDirty() { return !unscopedFields.isEmpty(); }

    public Set<String> unscopedFields() { return Collections.unmodifiableSet(unscopedFields); }

    /** Activity the pending changes will be recorded under, if any. */
    public String activity() { return activity; }

    public Map<String, Object> values() { return Values.copyOf(values); }

    public Map<String, Object> baseline() { return baseline; }

    public EntityState state() { return new EntityState(id, policy.entityType(), vclock, values); }

    /** Adopt the pending state as the new baseline after a successful flush. */
    public void markFlushed(int newVclock) {
        if (newVclock < vclock) {
            throw new IllegalStateException("vclock of " + id + " cannot go from " + vclock + " to " + newVclock);
        }
        vclock = newVclock;
        baseline = Values.copyOf(values);
        unscopedFields.clear();
        activity = null;
        created = false;
    }

    @Override
    public String toString() {
        return policy.entityType() + "[" + id + "@" + vclock + "]";
    }
}
