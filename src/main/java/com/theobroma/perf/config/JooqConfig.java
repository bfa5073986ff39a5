package com.theobroma.perf.config;

import javax.sql.DataSource;

import org.jooq.DSLContext;
import org.jooq.SQLDialect;
import org.jooq.impl.DataSourceConnectionProvider;
import org.jooq.impl.DefaultConfiguration;
import org.jooq.impl.DefaultDSLContext;
import org.jooq.impl.DefaultExecuteListenerProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.datasource.TransactionAwareDataSourceProxy;

import com.theobroma.perf.instrumentation.QueryTimer;
import com.theobroma.perf.instrumentation.QueryTimingListener;

/**
 * jOOQ configuration.
 *
 * Provides the DSLContext used by all data-access code, configured with:
 * - PostgreSQL dialect
 * - Spring-managed transactions
 * - Connection pooling via DataSource
 * - {@link QueryTimingListener}, so every query is timed and counted
 */
@Configuration
public class JooqConfig {

    /**
     * Creates jOOQ DSLContext bean for SQL query construction.
     *
     * @param dataSource HikariCP connection pool
     * @param queryTimer statistics entry point for the timing listener
     * @return Configured DSLContext
     */
    @Bean
    public DSLContext dslContext(DataSource dataSource, QueryTimer queryTimer) {
        // Wrap DataSource to participate in Spring transactions
        TransactionAwareDataSourceProxy proxy = new TransactionAwareDataSourceProxy(dataSource);

        DefaultConfiguration configuration = new DefaultConfiguration();
        configuration.setSQLDialect(SQLDialect.POSTGRES);
        configuration.setConnectionProvider(new DataSourceConnectionProvider(proxy));
        configuration.setExecuteListenerProvider(new DefaultExecuteListenerProvider(new QueryTimingListener(queryTimer)));

        return new DefaultDSLContext(configuration);
    }
}
