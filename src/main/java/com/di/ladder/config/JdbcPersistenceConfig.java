package com.di.ladder.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * PostgreSQL pool and transaction plumbing, active only for {@code ladder.persistence.mode=jdbc}.
 * DataSource auto-configuration is excluded so memory mode starts without a database.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "ladder.persistence.mode", havingValue = "jdbc")
public class JdbcPersistenceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource ladderDataSource(LadderProperties properties) {
        LadderProperties.Datasource ds = properties.getDatasource();
        if (ds.getJdbcUrl() == null || ds.getJdbcUrl().isBlank()) {
            throw new IllegalStateException("ladder.datasource.jdbc-url is required when ladder.persistence.mode=jdbc");
        }

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(ds.getJdbcUrl());
        hikariConfig.setUsername(ds.getUsername());
        hikariConfig.setPassword(ds.getPassword());
        hikariConfig.setDriverClassName(ds.getDriverClassName());
        hikariConfig.setMaximumPoolSize(ds.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(Math.min(ds.getMinimumIdle(), ds.getMaximumPoolSize()));
        hikariConfig.setConnectionTimeout(ds.getConnectionTimeout().toMillis());
        hikariConfig.setPoolName("HikariPool-ladder");
        if (ds.getJdbcUrl().contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
        }

        log.info("[POOL] Creating ladder pool | url={} | user={} | maxPoolSize={}",
                sanitizeUrl(ds.getJdbcUrl()), ds.getUsername(), ds.getMaximumPoolSize());
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public JdbcTemplate ladderJdbcTemplate(DataSource ladderDataSource) {
        return new JdbcTemplate(ladderDataSource);
    }

    @Bean
    public DataSourceTransactionManager ladderTransactionManager(DataSource ladderDataSource) {
        return new DataSourceTransactionManager(ladderDataSource);
    }

    @Bean
    public TransactionTemplate ladderTransactionTemplate(DataSourceTransactionManager ladderTransactionManager) {
        return new TransactionTemplate(ladderTransactionManager);
    }

    private static String sanitizeUrl(String url) {
        int query = url.indexOf('?');
        return query < 0 ? url : url.substring(0, query);
    }
}
