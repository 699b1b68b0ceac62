package io.chronoledger.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Per entity type descriptor: which attributes carry history, which of them are
 * composites, and whether changes must happen inside a recording scope and/or carry
 * an activity.
 */
public record TemporalPolicy(String entityType,
                             List<TrackedAttribute> attributes,
                             boolean scopeRequired,
                             boolean activityRequired) {

    public TemporalPolicy {
        Objects.requireNonNull(entityType, "entityType");
        attributes = List.copyOf(attributes);
        var names = new LinkedHashMap<String, TrackedAttribute>();
        var fields = new LinkedHashMap<String, TrackedAttribute>();
        for (var a : attributes) {
            if (names.put(a.name(), a) != null) {
                throw new IllegalArgumentException(entityType + " tracks " + a.name() + " twice");
            }
            for (var m : a.members()) {
                var other = fields.put(m, a);
                if (other != null) {
                    throw new IllegalArgumentException(entityType + "." + m
                            + " belongs to both " + other.name() + " and " + a.name());
                }
            }
        }
    }

    public Optional<TrackedAttribute> attribute(String name) {
        return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    /** The tracked attribute a field is recorded under, if any. */
    public Optional<TrackedAttribute> attributeForField(String field) {
        return attributes.stream().filter(a -> a.members().contains(field)).findFirst();
    }

    public boolean isTracked(String field) { return attributeForField(field).isPresent(); }

    public static Builder builder(String entityType) { return new Builder(entityType); }

    public static final class Builder {
        private final String entityType;
        private final List<TrackedAttribute> attributes = new ArrayList<>();
        private boolean scopeRequired;
        private boolean activityRequired;

        private Builder(String entityType) { this.entityType = entityType; }

        public Builder track(String... names) {
            for (var n : names) attributes.add(TrackedAttribute.single(n));
            return this;
        }

        public Builder track(String name, AttributeDefault defaultValue) {
            attributes.add(TrackedAttribute.single(name, defaultValue));
            return this;
        }

        public Builder composite(String name, String... members) {
            attributes.add(TrackedAttribute.composite(name, members));
            return this;
        }

        public Builder scopeRequired(boolean required) { this.scopeRequired = required; return this; }

        public Builder activityRequired(boolean required) { this.activityRequired = required; return this; }

        public TemporalPolicy build() {
            return new TemporalPolicy(entityType, attributes, scopeRequired, activityRequired);
        }
    }
}
