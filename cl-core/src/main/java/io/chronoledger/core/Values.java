package io.chronoledger.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Attribute value maps. Unlike {@link Map#copyOf} these keep explicit {@code null} values. */
public final class Values {
    private Values() {}

    public static Map<String, Object> copyOf(Map<String, ?> values) {
        return values == null || values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Map<String, Object> single(String key, Object value) {
        var m = new LinkedHashMap<String, Object>();
        m.put(key, value);
        return Collections.unmodifiableMap(m);
    }
}
