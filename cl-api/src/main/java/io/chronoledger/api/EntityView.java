package io.chronoledger.api;

import io.chronoledger.core.TemporalEntity;

import java.util.Map;

public record EntityView(
        String id,
        String type,
        int vclock,
        Map<String, Object> values
) {
    static EntityView of(TemporalEntity e) {
        return new EntityView(e.id().toString(), e.entityType(), e.vclock(), e.values());
    }
}
