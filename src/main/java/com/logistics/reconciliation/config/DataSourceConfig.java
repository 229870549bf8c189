package com.logistics.reconciliation.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Connection pools for the two stores.
 * <p>
 * Target is the primary data source: JPA, the transaction manager and the
 * per-page transactions all bind to it. Source is opened read-only.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
@Slf4j
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    @Primary
    public HikariDataSource targetDataSource(ReconciliationProperties properties) {
        return createPool("target-pool", properties.getTarget(), false);
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource sourceDataSource(ReconciliationProperties properties) {
        return createPool("source-pool", properties.getSource(), true);
    }

    @Bean
    @Primary
    public NamedParameterJdbcTemplate targetJdbcTemplate(@Qualifier("targetDataSource") DataSource dataSource,
                                                         ReconciliationProperties properties) {
        return createTemplate(dataSource, properties.getTarget());
    }

    @Bean
    public NamedParameterJdbcTemplate sourceJdbcTemplate(@Qualifier("sourceDataSource") DataSource dataSource,
                                                         ReconciliationProperties properties) {
        return createTemplate(dataSource, properties.getSource());
    }

    /**
     * One Target transaction per written page.
     */
    @Bean
    public TransactionTemplate pageTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionTemplate.PROPAGATION_REQUIRES_NEW);
        return template;
    }

    private HikariDataSource createPool(String poolName, ReconciliationProperties.StoreConnection connection,
                                        boolean readOnly) {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(poolName);
        dataSource.setJdbcUrl(connection.jdbcUrl());
        dataSource.setUsername(connection.getUsername());
        dataSource.setPassword(connection.getPassword());
        if (connection.getDriverClassName() != null && !connection.getDriverClassName().isBlank()) {
            dataSource.setDriverClassName(connection.getDriverClassName());
        }
        dataSource.setMaximumPoolSize(connection.getMaximumPoolSize());
        dataSource.setConnectionTimeout(connection.getConnectionTimeout().toMillis());
        dataSource.setReadOnly(readOnly);
        log.info("Configured {} for {} (read-only: {})", poolName, connection.jdbcUrl(), readOnly);
        return dataSource;
    }

    private NamedParameterJdbcTemplate createTemplate(DataSource dataSource,
                                                      ReconciliationProperties.StoreConnection connection) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.setQueryTimeout((int) connection.getQueryTimeout().toSeconds());
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }
}
