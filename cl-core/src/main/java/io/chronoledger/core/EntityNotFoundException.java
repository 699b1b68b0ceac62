package io.chronoledger.core;

public class EntityNotFoundException extends TemporalException {
    private final EntityId entityId;

    public EntityNotFoundException(EntityId entityId) {
        super("no entity " + entityId);
        this.entityId = entityId;
    }

    public EntityId entityId() { return entityId; }
}
