package io.chronoledger.core;

/**
 * Another transaction committed a newer version of the entity first. Never retried here;
 * callers may retry with a fresh snapshot.
 */
public class ConcurrentEntityModificationException extends TemporalException {
    private final EntityId entityId;

    public ConcurrentEntityModificationException(EntityId entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public ConcurrentEntityModificationException(EntityId entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public EntityId entityId() { return entityId; }
}
