package com.di.ladder.config;

import com.di.ladder.engine.LadderEngine;
import com.di.ladder.kind.CombatantKind;
import com.di.ladder.kind.TeamKind;
import com.di.ladder.model.Combatant;
import com.di.ladder.model.TagTeam;
import com.di.ladder.sql.SqlQueriesProperties;
import com.di.ladder.store.CombatantRowBinding;
import com.di.ladder.store.InMemoryLadderStore;
import com.di.ladder.store.JdbcLadderStore;
import com.di.ladder.store.LadderStore;
import com.di.ladder.store.TagTeamRowBinding;
import com.di.ladder.util.LadderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One ladder engine per entity kind. The store behind both is chosen by
 * {@code ladder.persistence.mode}: {@code memory} (default) or {@code jdbc}.
 */
@Slf4j
@Configuration
public class LadderEngineConfig {

    @Bean
    public CombatantKind combatantKind(LadderProperties properties) {
        return new CombatantKind(properties.getInstances().getCombatantCapacity());
    }

    @Bean
    public TeamKind teamKind(LadderProperties properties) {
        return new TeamKind(properties.getInstances().getTeamCapacity());
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry ladderMeterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Configuration
    @ConditionalOnProperty(name = "ladder.persistence.mode", havingValue = "memory", matchIfMissing = true)
    static class InMemoryStores {

        @Bean
        public LadderStore<Combatant> combatantStore(CombatantKind kind, LadderProperties properties) {
            log.info("[CONFIG] Using in-memory {} store", kind.name());
            return new InMemoryLadderStore<>(kind, properties.getPersistence().getLockTimeout());
        }

        @Bean
        public LadderStore<TagTeam> teamStore(TeamKind kind, LadderProperties properties) {
            log.info("[CONFIG] Using in-memory {} store", kind.name());
            return new InMemoryLadderStore<>(kind, properties.getPersistence().getLockTimeout());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "ladder.persistence.mode", havingValue = "jdbc")
    static class JdbcStores {

        @Bean
        public LadderStore<Combatant> combatantStore(CombatantKind kind, JdbcTemplate jdbcTemplate,
                                                     TransactionTemplate transactionTemplate,
                                                     SqlQueriesProperties sql, LadderProperties properties) {
            log.info("[CONFIG] Using JDBC {} store", kind.name());
            return new JdbcLadderStore<>(kind, jdbcTemplate, transactionTemplate, sql.getCombatant(), sql.getLock(),
                    new CombatantRowBinding(), properties.getPersistence().getLockTimeout());
        }

        @Bean
        public LadderStore<TagTeam> teamStore(TeamKind kind, JdbcTemplate jdbcTemplate,
                                              TransactionTemplate transactionTemplate,
                                              SqlQueriesProperties sql, LadderProperties properties) {
            log.info("[CONFIG] Using JDBC {} store", kind.name());
            return new JdbcLadderStore<>(kind, jdbcTemplate, transactionTemplate, sql.getTeam(), sql.getLock(),
                    new TagTeamRowBinding(), properties.getPersistence().getLockTimeout());
        }
    }

    @Bean
    public LadderEngine<Combatant> combatantLadder(CombatantKind kind, LadderStore<Combatant> combatantStore,
                                                   LadderProperties properties, MeterRegistry meterRegistry) {
        return LadderEngine.assemble(kind, combatantStore, properties, new LadderMetrics(meterRegistry, kind.name()));
    }

    @Bean
    public LadderEngine<TagTeam> teamLadder(TeamKind kind, LadderStore<TagTeam> teamStore,
                                            LadderProperties properties, MeterRegistry meterRegistry) {
        return LadderEngine.assemble(kind, teamStore, properties, new LadderMetrics(meterRegistry, kind.name()));
    }
}
