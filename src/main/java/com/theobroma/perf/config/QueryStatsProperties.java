package com.theobroma.perf.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Query statistics settings, bound from {@code theobroma.query-stats.*}.
 *
 * <pre>
 * theobroma:
 *   query-stats:
 *     slow-query-threshold-seconds: 0.5
 *     ring-capacity: 50
 *     recent-limit: 10
 *     detailed-logging: false
 *     sql-preview-length: 200
 * </pre>
 *
 * These are start-up values. Threshold and verbosity can be changed at runtime
 * through the debug endpoints without a restart.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "theobroma.query-stats")
public class QueryStatsProperties {

    /** Queries strictly slower than this are classified as slow. */
    private double slowQueryThresholdSeconds = 0.5;

    /** Number of slow samples retained; oldest evicted first. */
    private int ringCapacity = 50;

    /** Number of retained slow samples exposed by the statistics snapshot. */
    private int recentLimit = 10;

    /** Start in DETAILED verbosity (log every query). */
    private boolean detailedLogging = false;

    /** Maximum SQL characters in slow-query log lines; detailed lines use half. */
    private int sqlPreviewLength = 200;
}
