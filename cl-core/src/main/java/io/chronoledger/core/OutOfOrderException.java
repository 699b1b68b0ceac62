package io.chronoledger.core;

import java.time.Instant;

/** A clock advance was requested at an instant before the entity's current version began. */
public class OutOfOrderException extends TemporalException {
    private final EntityId entityId;

    public OutOfOrderException(EntityId entityId, Instant current, Instant requested) {
        super("clock for " + entityId + " cannot move from " + current + " back to " + requested);
        this.entityId = entityId;
    }

    public EntityId entityId() { return entityId; }
}
