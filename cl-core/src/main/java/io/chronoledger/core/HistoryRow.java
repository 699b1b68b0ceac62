package io.chronoledger.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Recorded value of one tracked attribute, current from {@code vclock} on and valid
 * between {@code tickStart} and {@code tickEnd} (null while it is still current).
 * A composite row carries every member value.
 */
public record HistoryRow(EntityId entityId,
                         String attribute,
                         int vclock,
                         Map<String, Object> values,
                         Instant tickStart,
                         Instant tickEnd) {
    public HistoryRow {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(attribute, "attribute");
        Objects.requireNonNull(tickStart, "tickStart");
        values = Values.copyOf(values);
    }

    public static HistoryRow open(EntityId entityId, String attribute, int vclock,
                                  Map<String, Object> values, Instant tickStart) {
        return new HistoryRow(entityId, attribute, vclock, values, tickStart, null);
    }

    public boolean isOpen() { return tickEnd == null; }

    public HistoryRow closedAt(Instant end) {
        return new HistoryRow(entityId, attribute, vclock, values, tickStart, end);
    }

    /** Value of a single attribute row. */
    public Object value() { return values.get(attribute); }

    public Object value(String member) { return values.get(member); }

    /** Whether this row was the effective one at the given instant. */
    public boolean covers(Instant at) {
        return !at.isBefore(tickStart) && (tickEnd == null || at.isBefore(tickEnd));
    }
}
