package io.chronoledger.core;

/** The entity's policy requires every version to name an activity and none was given. */
public class ActivityRequiredException extends TemporalException {
    public ActivityRequiredException(String entityType, EntityId entityId) {
        super("activity is missing for " + entityType + " " + entityId);
    }
}
