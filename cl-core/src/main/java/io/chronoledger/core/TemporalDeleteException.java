package io.chronoledger.core;

/** Temporal entities keep their history forever and cannot be deleted. */
public class TemporalDeleteException extends TemporalException {
    public TemporalDeleteException(EntityId entityId) {
        super("cannot delete temporal entity " + entityId);
    }
}
