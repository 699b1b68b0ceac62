package io.chronoledger.core;

/**
 * Value a tracked attribute takes at creation when the caller did not supply one.
 * Materialised defaults count as provided values and are recorded in the initial history.
 */
@FunctionalInterface
public interface AttributeDefault {
    Object valueFor(EntityId id);

    static AttributeDefault constant(Object value) {
        return id -> value;
    }
}
