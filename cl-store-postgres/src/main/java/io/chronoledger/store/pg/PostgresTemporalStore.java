package io.chronoledger.store.pg;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chronoledger.core.ClockRecord;
import io.chronoledger.core.ConcurrentEntityModificationException;
import io.chronoledger.core.DuplicateActivityException;
import io.chronoledger.core.EntityId;
import io.chronoledger.core.EntityState;
import io.chronoledger.core.HistoryRow;
import io.chronoledger.core.TemporalException;
import io.chronoledger.core.Values;
import io.chronoledger.store.TemporalStatements;
import io.chronoledger.store.TemporalStore;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.function.Supplier;

/**
 * Store over PostgreSQL through a {@link JdbcTemplate}. Statements join whatever Spring
 * transaction is bound to the calling thread.
 *
 * Entity state lives in {@code cl_entity}; clocks and history in the per-type and
 * per-attribute tables named by {@link HistoryTables}. Attribute values are kept as
 * {@code jsonb}. Versions written in a transaction reach subscribers after it commits, in
 * the state they were committed in.
 */
public final class PostgresTemporalStore implements TemporalStore, TemporalStatements {
    static final String ENTITY_TABLE = "cl_entity";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper json;
    private final HistoryTables tables;
    private final SubmissionPublisher<ClockRecord> bus = new SubmissionPublisher<>();

    public PostgresTemporalStore(JdbcTemplate jdbc, ObjectMapper json, HistoryTables tables) {
        this.jdbcTemplate = Objects.requireNonNull(jdbc);
        this.json = Objects.requireNonNull(json);
        this.tables = Objects.requireNonNull(tables);
    }

    public HistoryTables tables() { return tables; }

    /** Values as they come back out of a {@code jsonb} column. */
    @Override
    public Map<String, Object> canonical(Map<String, ?> values) {
        return Values.copyOf(readValues(toJson(values)));
    }

    /* ---------- entity state ---------- */

    @Override
    public Optional<EntityState> loadEntity(EntityId id) {
        final String sql = "SELECT entity_id, entity_type, vclock, state FROM " + ENTITY_TABLE + " WHERE entity_id = ?";
        return jdbcTemplate.query(sql, entityMapper(), id.value()).stream().findFirst();
    }

    @Override
    public void insertEntity(EntityState state) {
        final String sql = "INSERT INTO " + ENTITY_TABLE
                + " (entity_id, entity_type, vclock, state) VALUES (?, ?, ?, ?::jsonb)";
        try {
            translated(state.id(), () -> jdbcTemplate.update(sql,
                    state.id().value(), state.entityType(), state.vclock(), toJson(state.values())));
        } catch (DuplicateKeyException e) {
            throw new ConcurrentEntityModificationException(state.id(), "entity " + state.id() + " already exists", e);
        }
    }

    @Override
    public void updateEntity(EntityState state, int expectedVclock) {
        final String sql = "UPDATE " + ENTITY_TABLE
                + " SET vclock = ?, state = ?::jsonb WHERE entity_id = ? AND vclock = ?";
        int updated = translated(state.id(), () -> jdbcTemplate.update(sql,
                state.vclock(), toJson(state.values()), state.id().value(), expectedVclock));
        if (updated == 0) {
            throw new ConcurrentEntityModificationException(state.id(),
                    "entity " + state.id() + " is no longer at vclock " + expectedVclock);
        }
    }

    /* ---------- clock ---------- */

    @Override
    public List<ClockRecord> clocks(String entityType, EntityId id) {
        final String sql = "SELECT entity_id, vclock, tick_start, tick_end, activity FROM "
                + tables.clockTable(entityType) + " WHERE entity_id = ? ORDER BY vclock ASC";
        return jdbcTemplate.query(sql, clockMapper(), id.value());
    }

    @Override
    public Optional<ClockRecord> openClock(String entityType, EntityId id) {
        final String sql = "SELECT entity_id, vclock, tick_start, tick_end, activity FROM "
                + tables.clockTable(entityType) + " WHERE entity_id = ? AND tick_end IS NULL";
        return jdbcTemplate.query(sql, clockMapper(), id.value()).stream().findFirst();
    }

    @Override
    public void insertClock(String entityType, ClockRecord record) {
        if (record.activity() != null && activityTaken(entityType, record)) {
            throw new DuplicateActivityException(record.entityId(), record.activity());
        }
        final String sql = "INSERT INTO " + tables.clockTable(entityType)
                + " (entity_id, vclock, tick_start, tick_end, activity) VALUES (?, ?, ?, ?, ?)";
        try {
            translated(record.entityId(), () -> jdbcTemplate.update(sql,
                    record.entityId().value(),
                    record.vclock(),
                    Timestamp.from(record.tickStart()),
                    record.tickEnd() == null ? null : Timestamp.from(record.tickEnd()),
                    record.activity()));
        } catch (DuplicateKeyException e) {
            throw new ConcurrentEntityModificationException(record.entityId(),
                    "vclock " + record.vclock() + " of " + record.entityId() + " was recorded concurrently", e);
        }
        publishAfterCommit(record);
    }

    @Override
    public void closeClock(String entityType, EntityId id, int vclock, Instant tickEnd) {
        final String sql = "UPDATE " + tables.clockTable(entityType)
                + " SET tick_end = ? WHERE entity_id = ? AND vclock = ? AND tick_end IS NULL";
        int updated = translated(id, () -> jdbcTemplate.update(sql, Timestamp.from(tickEnd), id.value(), vclock));
        if (updated == 0) {
            throw new ConcurrentEntityModificationException(id, "vclock " + vclock + " of " + id + " is not open");
        }
        var pending = pendingVersions();
        if (pending != null) pending.computeIfPresent(versionKey(id, vclock), (k, r) -> r.closedAt(tickEnd));
    }

    /* ---------- history ---------- */

    @Override
    public List<HistoryRow> history(String entityType, EntityId id, String attribute) {
        final String sql = "SELECT entity_id, vclock, value, tick_start, tick_end FROM "
                + tables.historyTable(entityType, attribute) + " WHERE entity_id = ? ORDER BY vclock ASC";
        return jdbcTemplate.query(sql, historyMapper(attribute), id.value());
    }

    @Override
    public Optional<HistoryRow> openHistory(String entityType, EntityId id, String attribute) {
        final String sql = "SELECT entity_id, vclock, value, tick_start, tick_end FROM "
                + tables.historyTable(entityType, attribute) + " WHERE entity_id = ? AND tick_end IS NULL";
        return jdbcTemplate.query(sql, historyMapper(attribute), id.value()).stream().findFirst();
    }

    @Override
    public void insertHistory(String entityType, HistoryRow row) {
        final String sql = "INSERT INTO " + tables.historyTable(entityType, row.attribute())
                + " (entity_id, vclock, value, tick_start, tick_end) VALUES (?, ?, ?::jsonb, ?, ?)";
        try {
            translated(row.entityId(), () -> jdbcTemplate.update(sql,
                    row.entityId().value(),
                    row.vclock(),
                    toJson(row.values()),
                    Timestamp.from(row.tickStart()),
                    row.tickEnd() == null ? null : Timestamp.from(row.tickEnd())));
        } catch (DuplicateKeyException e) {
            throw new ConcurrentEntityModificationException(row.entityId(),
                    row.attribute() + " of " + row.entityId() + " was recorded concurrently at vclock " + row.vclock(), e);
        }
    }

    @Override
    public void closeHistory(String entityType, EntityId id, String attribute, int vclock, Instant tickEnd) {
        final String sql = "UPDATE " + tables.historyTable(entityType, attribute)
                + " SET tick_end = ? WHERE entity_id = ? AND vclock = ? AND tick_end IS NULL";
        int updated = translated(id, () -> jdbcTemplate.update(sql, Timestamp.from(tickEnd), id.value(), vclock));
        if (updated == 0) {
            throw new ConcurrentEntityModificationException(id,
                    attribute + " row " + vclock + " of " + id + " is not open");
        }
    }

    @Override
    public Flow.Publisher<ClockRecord> subscribe() {
        return bus;
    }

    /* ---------- helpers ---------- */

    private boolean activityTaken(String entityType, ClockRecord record) {
        final String sql = "SELECT count(*) FROM " + tables.clockTable(entityType)
                + " WHERE entity_id = ? AND activity = ?";
        Integer n = jdbcTemplate.queryForObject(sql, Integer.class, record.entityId().value(), record.activity());
        return n != null && n > 0;
    }

    /** New versions reach subscribers only once their transaction committed. */
    private void publishAfterCommit(ClockRecord record) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            bus.submit(record);
            return;
        }
        var pending = pendingVersions();
        if (pending == null) {
            var versions = new LinkedHashMap<String, ClockRecord>();
            TransactionSynchronizationManager.bindResource(this, versions);
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override public void afterCommit() { versions.values().forEach(bus::submit); }

                @Override
                public void afterCompletion(int status) {
                    TransactionSynchronizationManager.unbindResourceIfPossible(PostgresTemporalStore.this);
                }
            });
            pending = versions;
        }
        pending.put(versionKey(record.entityId(), record.vclock()), record);
    }

    /** Versions written by the transaction bound to this thread, or null outside one. */
    @SuppressWarnings("unchecked")
    private Map<String, ClockRecord> pendingVersions() {
        return (Map<String, ClockRecord>) TransactionSynchronizationManager.getResource(this);
    }

    private static String versionKey(EntityId id, int vclock) {
        return id + ":" + vclock;
    }

    private <T> T translated(EntityId id, Supplier<T> call) {
        try {
            return call.get();
        } catch (ConcurrencyFailureException e) {
            throw new ConcurrentEntityModificationException(id, "write conflict on " + id, e);
        }
    }

    private RowMapper<EntityState> entityMapper() {
        return (ResultSet rs, int rowNum) -> new EntityState(
                new EntityId(UUID.fromString(rs.getString("entity_id"))),
                rs.getString("entity_type"),
                rs.getInt("vclock"),
                readValues(rs.getString("state")));
    }

    private RowMapper<ClockRecord> clockMapper() {
        return (ResultSet rs, int rowNum) -> new ClockRecord(
                new EntityId(UUID.fromString(rs.getString("entity_id"))),
                rs.getInt("vclock"),
                rs.getTimestamp("tick_start").toInstant(),
                instant(rs.getTimestamp("tick_end")),
                rs.getString("activity"));
    }

    private RowMapper<HistoryRow> historyMapper(String attribute) {
        return (ResultSet rs, int rowNum) -> new HistoryRow(
                new EntityId(UUID.fromString(rs.getString("entity_id"))),
                attribute,
                rs.getInt("vclock"),
                readValues(rs.getString("value")),
                rs.getTimestamp("tick_start").toInstant(),
                instant(rs.getTimestamp("tick_end")));
    }

    private static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    String toJson(Object o) {
        try { return json.writeValueAsString(o); }
        catch (Exception e) { throw new TemporalException("cannot serialise " + o, e); }
    }

    Map<String, Object> readValues(String jsonStr) {
        try { return json.readValue(jsonStr, new TypeReference<LinkedHashMap<String, Object>>() {
        }); }
        catch (Exception e) { throw new TemporalException("cannot read stored values " + jsonStr, e); }
    }
}
