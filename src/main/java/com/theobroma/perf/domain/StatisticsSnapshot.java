package com.theobroma.perf.domain;

import java.util.List;

/**
 * Frozen point-in-time copy of the query statistics.
 *
 * Durations are in seconds. With no recorded queries every numeric field is zero
 * and the recent list is empty.
 *
 * @param totalQueries number of recorded executions
 * @param avgQueryTime mean duration, 0 when empty
 * @param maxQueryTime longest duration, 0 when empty
 * @param minQueryTime shortest duration, 0 when empty
 * @param slowQueriesCount executions above the slow threshold at record time
 * @param recentSlowQueries most recent retained slow samples, in insertion order
 */
public record StatisticsSnapshot(
    long totalQueries,
    double avgQueryTime,
    double maxQueryTime,
    double minQueryTime,
    long slowQueriesCount,
    List<QuerySample> recentSlowQueries
) {

    public StatisticsSnapshot {
        recentSlowQueries = recentSlowQueries == null ? List.of() : List.copyOf(recentSlowQueries);
    }

    public static StatisticsSnapshot empty() {
        return new StatisticsSnapshot(0L, 0.0, 0.0, 0.0, 0L, List.of());
    }
}
