package io.chronoledger.store.pg;

import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.core.TemporalPolicy;
import io.chronoledger.core.UnknownEntityTypeException;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Which table holds the clock of each entity type and the history of each tracked
 * attribute. Built once when the schema is set up and handed to the store.
 *
 * Names follow {@code <entity table>_clock} and {@code <entity table>_history_<attribute>};
 * names PostgreSQL would truncate are shortened here with a hash suffix so they stay unique.
 * Attribute names are folded to lower case, so two attributes differing only in case are
 * rejected, as are two entity types sharing a table.
 */
public final class HistoryTables {
    /** NAMEDATALEN - 1 */
    static final int MAX_IDENTIFIER = 63;
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    public record Layout(TemporalPolicy policy, String entityTable, String clockTable, Map<String, String> historyTables) {
        public Layout {
            historyTables = Map.copyOf(historyTables);
        }
    }

    private final Map<String, Layout> byType = new LinkedHashMap<>();

    private HistoryTables(Collection<Layout> layouts) {
        var owners = new LinkedHashMap<String, String>();
        for (var l : layouts) {
            var other = owners.putIfAbsent(l.entityTable(), l.policy().entityType());
            if (other != null) {
                throw new IllegalArgumentException(other + " and " + l.policy().entityType()
                        + " both map to table " + l.entityTable());
            }
            byType.put(l.policy().entityType(), l);
        }
    }

    /** Layout for every registered policy; {@code tableNames} maps an entity type to its table. */
    public static HistoryTables build(PolicyRegistry policies, Function<String, String> tableNames) {
        return new HistoryTables(policies.policies().stream()
                .map(p -> layout(p, tableNames.apply(p.entityType())))
                .toList());
    }

    /** Tables named after the entity type itself. */
    public static HistoryTables build(PolicyRegistry policies) {
        return build(policies, type -> type.toLowerCase(Locale.ROOT));
    }

    static Layout layout(TemporalPolicy policy, String entityTable) {
        checkIdentifier(entityTable);
        var history = new LinkedHashMap<String, String>();
        var owners = new LinkedHashMap<String, String>();
        for (var a : policy.attributes()) {
            var column = a.name().toLowerCase(Locale.ROOT);
            checkIdentifier(column);
            var table = truncate(entityTable + "_history_" + column);
            var other = owners.putIfAbsent(table, a.name());
            if (other != null) {
                throw new IllegalArgumentException(policy.entityType() + " attributes " + other + " and "
                        + a.name() + " both map to table " + table);
            }
            history.put(a.name(), table);
        }
        return new Layout(policy, entityTable, truncate(entityTable + "_clock"), history);
    }

    public Layout layout(String entityType) {
        var l = byType.get(entityType);
        if (l == null) throw new UnknownEntityTypeException(entityType);
        return l;
    }

    public String clockTable(String entityType) { return layout(entityType).clockTable(); }

    public String historyTable(String entityType, String attribute) {
        var t = layout(entityType).historyTables().get(attribute);
        if (t == null) throw new IllegalArgumentException(entityType + " does not track " + attribute);
        return t;
    }

    public List<Layout> layouts() { return List.copyOf(byType.values()); }

    /** Shorten identifiers longer than PostgreSQL keeps, keeping them distinct. */
    static String truncate(String identifier) {
        if (identifier.length() <= MAX_IDENTIFIER) return identifier;
        var md5 = DigestUtils.md5DigestAsHex(identifier.getBytes(StandardCharsets.UTF_8));
        return identifier.substring(0, MAX_IDENTIFIER - 8) + "_" + md5.substring(md5.length() - 4);
    }

    private static void checkIdentifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("not a plain SQL identifier: " + name);
        }
    }
}
