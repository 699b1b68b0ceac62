package io.chronoledger.store;

import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.EntityState;
import io.chronoledger.core.HistoryRow;
import io.chronoledger.core.Values;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Statements the ledger and history writer execute. Every call runs inside the caller's
 * open transaction and becomes visible to others only when it commits.
 */
public interface TemporalStatements extends TemporalQueries {

    /** Last flushed state of the entity, the baseline for change detection. */
    Optional<EntityState> loadEntity(EntityId id);

    /**
     * @throws io.chronoledger.core.ConcurrentEntityModificationException if the id is taken
     */
    void insertEntity(EntityState state);

    /**
     * Replace the stored state, provided its vclock is still {@code expectedVclock}.
     *
     * @throws io.chronoledger.core.ConcurrentEntityModificationException otherwise
     */
    void updateEntity(EntityState state, int expectedVclock);

    Optional<ClockRecord> openClock(String entityType, EntityId id);

    /**
     * @throws io.chronoledger.core.DuplicateActivityException if the record's activity
     *         already stamped a version of the same entity
     */
    void insertClock(String entityType, ClockRecord record);

    void closeClock(String entityType, EntityId id, int vclock, Instant tickEnd);

    Optional<HistoryRow> openHistory(String entityType, EntityId id, String attribute);

    void insertHistory(String entityType, HistoryRow row);

    void closeHistory(String entityType, EntityId id, String attribute, int vclock, Instant tickEnd);

    /**
     * Values as they read back after being stored. Change detection compares canonical
     * forms, so an equal value of another Java type is not a change.
     */
    default Map<String, Object> canonical(Map<String, ?> values) {
        return Values.copyOf(values);
    }
}
