package com.theobroma.perf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the Theobroma plantation API.
 *
 * Serves farm, lot and tree data from PostgreSQL/PostGIS through batch queries and
 * profiles every database query it runs:
 * - execution time statistics and slow query history (/debug/query-stats)
 * - slow query warnings, and per-query logging on demand
 * - Micrometer query metrics exported to Prometheus
 *
 * @version 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
public class TheobromaPerfApplication {

    public static void main(String[] args) {
        SpringApplication.run(TheobromaPerfApplication.class, args);
    }
}
