package io.chronoledger.core;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A unit of history. A single attribute has exactly one member named after itself;
 * a composite groups two or more member fields that are always recorded together.
 */
public record TrackedAttribute(String name, List<String> members, boolean composite, AttributeDefault defaultValue) {
    public TrackedAttribute {
        Objects.requireNonNull(name, "name");
        members = List.copyOf(members);
        if (composite) {
            if (members.size() < 2) {
                throw new IllegalArgumentException("composite " + name + " needs at least two members");
            }
            if (new HashSet<>(members).size() != members.size()) {
                throw new IllegalArgumentException("composite " + name + " repeats a member: " + members);
            }
            if (defaultValue != null) {
                throw new IllegalArgumentException("composite " + name + " cannot declare a default");
            }
        } else if (!members.equals(List.of(name))) {
            throw new IllegalArgumentException("single attribute " + name + " must be its own only member");
        }
    }

    public static TrackedAttribute single(String name) {
        return new TrackedAttribute(name, List.of(name), false, null);
    }

    public static TrackedAttribute single(String name, AttributeDefault defaultValue) {
        return new TrackedAttribute(name, List.of(name), false, Objects.requireNonNull(defaultValue));
    }

    public static TrackedAttribute composite(String name, String... members) {
        return new TrackedAttribute(name, List.of(members), true, null);
    }

    public boolean hasDefault() { return defaultValue != null; }
}
