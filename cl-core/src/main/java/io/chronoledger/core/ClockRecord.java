package io.chronoledger.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One version of an entity: effective from {@code tickStart} until {@code tickEnd},
 * or still current when {@code tickEnd} is null.
 */
public record ClockRecord(EntityId entityId, int vclock, Instant tickStart, Instant tickEnd, String activity) {
    public ClockRecord {
        Objects.requireNonNull(entityId, "entityId");
        Objects.requireNonNull(tickStart, "tickStart");
        if (vclock < 1) throw new IllegalArgumentException("vclock must be positive: " + vclock);
    }

    public static ClockRecord open(EntityId entityId, int vclock, Instant tickStart, String activity) {
        return new ClockRecord(entityId, vclock, tickStart, null, activity);
    }

    public boolean isOpen() { return tickEnd == null; }

    public ClockRecord closedAt(Instant end) {
        return new ClockRecord(entityId, vclock, tickStart, end, activity);
    }
}
