package io.chronoledger.core;

import java.util.Map;
import java.util.Objects;

/** Detected change of one tracked attribute; {@code before} is empty when it had no value yet. */
public record AttributeChange(TrackedAttribute attribute, Map<String, Object> before, Map<String, Object> after) {
    public AttributeChange {
        Objects.requireNonNull(attribute, "attribute");
        before = Values.copyOf(before);
        after = Values.copyOf(after);
    }

    public String name() { return attribute.name(); }
}
