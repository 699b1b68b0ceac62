package io.chronoledger.core;

/** An entity whose policy requires a recording scope was changed outside of one. */
public class UnscopedMutationException extends TemporalException {
    private final EntityId entityId;
    private final String attribute;

    public UnscopedMutationException(EntityId entityId, String entityType, String attribute) {
        super(entityType + " " + entityId + ": " + attribute + " was changed outside a recording scope");
        this.entityId = entityId;
        this.attribute = attribute;
    }

    public EntityId entityId() { return entityId; }
    public String attribute() { return attribute; }
}
