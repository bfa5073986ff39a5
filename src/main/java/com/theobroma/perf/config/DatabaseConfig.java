package com.theobroma.perf.config;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import com.theobroma.perf.instrumentation.QueryExecutor;
import com.theobroma.perf.instrumentation.QueryTimer;
import com.theobroma.perf.instrumentation.TimedQueryExecutor;
import com.theobroma.perf.repository.JdbcQueryExecutor;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Database configuration.
 *
 * Configures the HikariCP pool for the PostGIS database and the timed plain-JDBC
 * {@link QueryExecutor}. jOOQ access is configured separately in {@link JooqConfig}.
 *
 * Pool settings mirror the API's long-standing engine settings:
 * - connections validated before use (pre-ping)
 * - connections recycled after 5 minutes
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    /**
     * HikariCP settings: connection details from spring.datasource, pool defaults below,
     * then any spring.datasource.hikari.* override bound on top.
     *
     * Bound as a plain {@link HikariConfig} so overrides land before the pool starts.
     *
     * @param properties Spring Boot DataSource properties
     * @return pool settings, not yet started
     */
    @Bean
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariConfig hikariConfig(DataSourceProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(properties.getUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        config.setDriverClassName(properties.getDriverClassName());

        config.setMaximumPoolSize(10);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setMaxLifetime(300_000);
        config.setKeepaliveTime(60_000);
        config.setValidationTimeout(3000);
        config.setPoolName("TheobromaHikariPool");

        config.addDataSourceProperty("cachePrepStmts", "true");
        config.addDataSourceProperty("prepStmtCacheSize", "250");
        return config;
    }

    /**
     * Primary DataSource bean with HikariCP connection pooling.
     *
     * Connection details can be overridden via environment variables (DATABASE_URL,
     * DATABASE_USER, DATABASE_PASSWORD).
     *
     * @param hikariConfig bound pool settings
     * @param meterRegistry Micrometer registry for pool metrics
     * @return configured HikariCP DataSource
     */
    @Bean
    @Primary
    public HikariDataSource dataSource(HikariConfig hikariConfig, MeterRegistry meterRegistry) {
        hikariConfig.setMetricRegistry(meterRegistry);

        HikariDataSource dataSource = new HikariDataSource(hikariConfig);

        log.info("HikariCP DataSource configured: pool={}, max={}, min={}",
            hikariConfig.getPoolName(),
            hikariConfig.getMaximumPoolSize(),
            hikariConfig.getMinimumIdle());

        return dataSource;
    }

    /**
     * Plain JDBC executor, timed like every jOOQ query.
     *
     * @param dataSource pooled data source
     * @param queryTimer statistics entry point
     * @return timed executor
     */
    @Bean
    public QueryExecutor queryExecutor(DataSource dataSource, QueryTimer queryTimer) {
        return new TimedQueryExecutor(new JdbcQueryExecutor(dataSource), queryTimer);
    }
}
