package io.chronoledger.api;

import io.chronoledger.core.AttributeDefault;
import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.core.TemporalPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Temporal policies declared in configuration:
 *
 * <pre>
 * chronoledger:
 *   policies:
 *     - type: widget
 *       track: [description, price]
 *       composites:
 *         position: [lat, lng]
 *       defaults:
 *         status: draft
 *       scope-required: true
 * </pre>
 */
@ConfigurationProperties(prefix = "chronoledger")
public record LedgerProperties(@DefaultValue List<Policy> policies,
                               @DefaultValue("REPEATABLE_READ") String isolation) {

    public record Policy(String type,
                         String table,
                         @DefaultValue List<String> track,
                         @DefaultValue Map<String, List<String>> composites,
                         @DefaultValue Map<String, String> defaults,
                         boolean scopeRequired,
                         boolean activityRequired) {

        TemporalPolicy toPolicy() {
            var b = TemporalPolicy.builder(type)
                    .scopeRequired(scopeRequired)
                    .activityRequired(activityRequired);
            track.forEach(b::track);
            defaults.forEach((name, value) -> b.track(name, AttributeDefault.constant(value)));
            composites.forEach((name, members) -> b.composite(name, members.toArray(String[]::new)));
            return b.build();
        }

        String tableName() {
            return table == null || table.isBlank() ? type.toLowerCase(Locale.ROOT) : table;
        }
    }

    public PolicyRegistry registry() {
        return new PolicyRegistry(policies.stream().map(Policy::toPolicy).toList());
    }

    public String tableFor(String entityType) {
        return policies.stream()
                .filter(p -> p.type().equals(entityType))
                .map(Policy::tableName)
                .findFirst()
                .orElse(entityType.toLowerCase(Locale.ROOT));
    }
}
