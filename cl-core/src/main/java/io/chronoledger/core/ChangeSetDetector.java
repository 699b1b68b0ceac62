package io.chronoledger.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes which tracked attributes changed between two states of an entity.
 *
 * Pure: no I/O and no mutation of its inputs. A state is a map from field name to value;
 * a missing key means the field was never assigned, while a {@code null} value is an
 * explicit assignment. Composites are compared as a unit and always reported with every
 * member value.
 */
public final class ChangeSetDetector {

    /** Changes to record when an entity is created: every attribute with a provided value. */
    public List<AttributeChange> initial(TemporalPolicy policy, Map<String, ?> values) {
        var out = new ArrayList<AttributeChange>();
        for (var attribute : policy.attributes()) {
            resolve(attribute, values)
                    .ifPresent(after -> out.add(new AttributeChange(attribute, Map.of(), after)));
        }
        return out;
    }

    /**
     * Changes between the last flushed {@code baseline} and the {@code pending} state.
     * Empty when nothing tracked differs.
     */
    public List<AttributeChange> diff(TemporalPolicy policy, Map<String, ?> baseline, Map<String, ?> pending) {
        var out = new ArrayList<AttributeChange>();
        for (var attribute : policy.attributes()) {
            var after = resolve(attribute, pending);
            if (after.isEmpty()) continue;
            var before = resolve(attribute, baseline);
            if (before.isEmpty() || !before.get().equals(after.get())) {
                out.add(new AttributeChange(attribute, before.orElse(Map.of()), after.get()));
            }
        }
        return out;
    }

    /**
     * Member values of an attribute in a state; empty when none of its members was ever
     * assigned.
     *
     * @throws CompositeIntegrityException when only some members of a composite are present
     */
    Optional<Map<String, Object>> resolve(TrackedAttribute attribute, Map<String, ?> state) {
        var found = new LinkedHashMap<String, Object>();
        var missing = new ArrayList<String>();
        for (var member : attribute.members()) {
            if (state.containsKey(member)) found.put(member, state.get(member));
            else missing.add(member);
        }
        if (found.isEmpty()) return Optional.empty();
        if (!missing.isEmpty()) throw new CompositeIntegrityException(attribute.name(), missing);
        return Optional.of(Values.copyOf(found));
    }
}
