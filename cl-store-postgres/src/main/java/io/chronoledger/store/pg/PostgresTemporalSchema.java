package io.chronoledger.store.pg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates the entity, clock and history tables when they do not exist yet. Each history
 * table allows one row per vclock and at most one open row per entity.
 */
public final class PostgresTemporalSchema {
    private static final Logger log = LoggerFactory.getLogger(PostgresTemporalSchema.class);

    private final JdbcTemplate jdbc;
    private final HistoryTables tables;

    public PostgresTemporalSchema(JdbcTemplate jdbc, HistoryTables tables) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.tables = Objects.requireNonNull(tables);
    }

    public List<String> statements() {
        var ddl = new ArrayList<String>();
        ddl.add("""
          CREATE TABLE IF NOT EXISTS cl_entity (
            entity_id   uuid PRIMARY KEY,
            entity_type text NOT NULL,
            vclock      integer NOT NULL CHECK (vclock > 0),
            state       jsonb NOT NULL
          )""");
        for (var layout : tables.layouts()) {
            var clock = layout.clockTable();
            ddl.add("""
              CREATE TABLE IF NOT EXISTS %s (
                entity_id  uuid NOT NULL REFERENCES cl_entity (entity_id) DEFERRABLE INITIALLY DEFERRED,
                vclock     integer NOT NULL CHECK (vclock > 0),
                tick_start timestamptz NOT NULL,
                tick_end   timestamptz,
                activity   text,
                PRIMARY KEY (entity_id, vclock),
                UNIQUE (entity_id, activity)
              )""".formatted(clock));
            ddl.add(openIndex(clock));
            for (var history : layout.historyTables().values()) {
                ddl.add("""
                  CREATE TABLE IF NOT EXISTS %s (
                    entity_id  uuid NOT NULL REFERENCES cl_entity (entity_id) DEFERRABLE INITIALLY DEFERRED,
                    vclock     integer NOT NULL CHECK (vclock > 0),
                    value      jsonb NOT NULL,
                    tick_start timestamptz NOT NULL,
                    tick_end   timestamptz,
                    PRIMARY KEY (entity_id, vclock)
                  )""".formatted(history));
                ddl.add(openIndex(history));
            }
        }
        return ddl;
    }

    public void install() {
        var ddl = statements();
        ddl.forEach(jdbc::execute);
        log.info("Temporal schema ready: {} statements for {} entity types", ddl.size(), tables.layouts().size());
    }

    private static String openIndex(String table) {
        return "CREATE UNIQUE INDEX IF NOT EXISTS " + HistoryTables.truncate(table + "_open_idx")
                + " ON " + table + " (entity_id) WHERE tick_end IS NULL";
    }
}
