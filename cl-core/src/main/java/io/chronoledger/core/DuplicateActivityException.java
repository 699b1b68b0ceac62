package io.chronoledger.core;

/** An activity may stamp at most one version of a given entity. */
public class DuplicateActivityException extends TemporalException {
    public DuplicateActivityException(EntityId entityId, String activity) {
        super("activity " + activity + " already recorded a version of " + entityId);
    }

    public DuplicateActivityException(EntityId entityId, String activity, Throwable cause) {
        super("activity " + activity + " already recorded a version of " + entityId, cause);
    }
}
