package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.HistoryRow;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Side-effect free read paths over recorded versions and history. */
public interface TemporalQueries {

    /** Every version of the entity, ascending by vclock. */
    List<ClockRecord> clocks(String entityType, EntityId id);

    /** Every recorded value of one tracked attribute, ascending by vclock. */
    List<HistoryRow> history(String entityType, EntityId id, String attribute);

    default Optional<Instant> dateCreated(String entityType, EntityId id) {
        return clocks(entityType, id).stream().findFirst().map(ClockRecord::tickStart);
    }

    default Optional<Instant> dateModified(String entityType, EntityId id) {
        var clocks = clocks(entityType, id);
        return clocks.isEmpty() ? Optional.empty() : Optional.of(clocks.get(clocks.size() - 1).tickStart());
    }

    /** The history row that was effective at {@code at}, if the attribute had a value then. */
    default Optional<HistoryRow> valueAt(String entityType, EntityId id, String attribute, Instant at) {
        return history(entityType, id, attribute).stream().filter(r -> r.covers(at)).findFirst();
    }
}
