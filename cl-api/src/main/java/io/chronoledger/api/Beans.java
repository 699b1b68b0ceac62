package io.chronoledger.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.chronoledger.core.PolicyRegistry;
import io.chronoledger.store.InMemoryTemporalStore;
import io.chronoledger.store.SessionFactory;
import io.chronoledger.store.pg.HistoryTables;
import io.chronoledger.store.pg.PostgresTemporalSchema;
import io.chronoledger.store.pg.PostgresTemporalStore;
import io.chronoledger.store.pg.SpringSessionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

@Configuration
public class Beans {

    @Bean
    PolicyRegistry policyRegistry(LedgerProperties props) {
        return props.registry();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Configuration
    @Profile("inmem")
    static class InMemory {
        @Bean
        InMemoryTemporalStore inMemoryStore() {
            return new InMemoryTemporalStore();
        }

        @Bean
        SessionFactory inMemorySessions(InMemoryTemporalStore store, PolicyRegistry policies, Clock clock) {
            return store.sessions(policies, clock);
        }
    }

    @Configuration
    @Profile("pg")
    static class Postgres {
        @Bean
        HistoryTables historyTables(PolicyRegistry policies, LedgerProperties props) {
            return HistoryTables.build(policies, props::tableFor);
        }

        @Bean(initMethod = "install")
        PostgresTemporalSchema temporalSchema(JdbcTemplate jdbc, HistoryTables tables) {
            return new PostgresTemporalSchema(jdbc, tables);
        }

        @Bean
        @DependsOn("temporalSchema")
        PostgresTemporalStore postgresStore(JdbcTemplate jdbc, ObjectMapper mapper, HistoryTables tables) {
            return new PostgresTemporalStore(jdbc, mapper, tables);
        }

        @Bean
        SessionFactory postgresSessions(PlatformTransactionManager txManager, PostgresTemporalStore store,
                                        PolicyRegistry policies, Clock clock, LedgerProperties props) {
            var template = new TransactionTemplate(txManager);
            template.setIsolationLevelName("ISOLATION_" + props.isolation());
            return new SpringSessionFactory(template, store, policies, clock);
        }
    }
}
