package io.chronoledger.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/** Stable identity of a temporal entity. Ordered so flushes visit entities deterministically. */
public record EntityId(UUID value) implements Comparable<EntityId> {
    public EntityId {
        Objects.requireNonNull(value, "value");
    }

    public static EntityId random() { return new EntityId(UUID.randomUUID()); }

    @JsonCreator
    public static EntityId of(String value) { return new EntityId(UUID.fromString(value)); }

    @Override
    public int compareTo(EntityId other) { return value.compareTo(other.value); }

    @JsonValue public String json() { return value.toString(); }
    @Override public String toString(){ return value.toString(); }
}
