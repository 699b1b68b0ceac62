package io.chronoledger.core;

import java.util.Map;
import java.util.Objects;

/** Last flushed state of an entity as the store keeps it. Unassigned attributes have no key. */
public record EntityState(EntityId id, String entityType, int vclock, Map<String, Object> values) {
    public EntityState {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(entityType, "entityType");
        values = Values.copyOf(values);
    }
}
