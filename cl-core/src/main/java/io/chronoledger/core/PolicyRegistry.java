package io.chronoledger.core;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Looks up the temporal policy declared for an entity type. */
public final class PolicyRegistry {
    private final Map<String, TemporalPolicy> byType = new LinkedHashMap<>();

    public PolicyRegistry(Collection<TemporalPolicy> policies) {
        for (var p : policies) {
            if (byType.put(p.entityType(), p) != null) {
                throw new IllegalArgumentException("duplicate policy for " + p.entityType());
            }
        }
    }

    public static PolicyRegistry of(TemporalPolicy... policies) {
        return new PolicyRegistry(List.of(policies));
    }

    public TemporalPolicy policyFor(String entityType) {
        var p = byType.get(entityType);
        if (p == null) throw new UnknownEntityTypeException(entityType);
        return p;
    }

    public Collection<TemporalPolicy> policies() { return List.copyOf(byType.values()); }
}
