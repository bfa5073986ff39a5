package com.theobroma.perf.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import jakarta.annotation.PostConstruct;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.theobroma.perf.domain.QuerySample;
import com.theobroma.perf.domain.StatisticsSnapshot;
import com.theobroma.perf.domain.VerbosityMode;
import com.theobroma.perf.instrumentation.SlowQueryClassifier;
import com.theobroma.perf.instrumentation.StatisticsAggregator;
import com.theobroma.perf.instrumentation.VerbosityController;
import com.theobroma.perf.util.MetricsHelper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Exposes the query statistics and their controls to the debug endpoints.
 *
 * The snapshot is converted to its external shape here: durations in seconds
 * rounded to 4 decimal places, snake_case keys, ISO-8601 timestamps taken from the
 * injected {@link Clock}. An empty history yields zeros, never an error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryStatsService {

    static final String STATS_NOTE = "Use this endpoint to monitor query performance and identify bottlenecks";
    static final String DETAILED_WARNING = "This will generate verbose logs. Use disable-detailed-logging to turn off.";

    private static final int DURATION_SCALE = 4;

    private final StatisticsAggregator aggregator;
    private final SlowQueryClassifier classifier;
    private final VerbosityController verbosity;
    private final MetricsHelper metricsHelper;
    private final Clock clock;

    @PostConstruct
    void registerGauges() {
        metricsHelper.registerGauge("db.query.stats.total", aggregator::totalCount);
        metricsHelper.registerGauge("db.query.stats.slow", aggregator::slowCount);
    }

    /**
     * Current statistics in their external shape.
     */
    public QueryPerformanceReport queryStats() {
        StatisticsSnapshot snapshot = aggregator.snapshot();

        List<SlowQueryView> recent = snapshot.recentSlowQueries().stream()
            .map(QueryStatsService::toView)
            .collect(Collectors.toList());

        QueryPerformance performance = new QueryPerformance(
            snapshot.totalQueries(),
            round(snapshot.avgQueryTime()),
            round(snapshot.maxQueryTime()),
            round(snapshot.minQueryTime()),
            snapshot.slowQueriesCount(),
            recent
        );

        return new QueryPerformanceReport(performance, now(), STATS_NOTE);
    }

    public Map<String, Object> resetStats() {
        aggregator.reset();
        log.info("Query performance statistics reset");
        return acknowledgement("Query performance statistics have been reset");
    }

    public Map<String, Object> enableDetailedLogging() {
        verbosity.enableDetailed();

        Map<String, Object> body = acknowledgement("Detailed query logging has been enabled");
        body.put("warning", DETAILED_WARNING);
        return body;
    }

    public Map<String, Object> disableDetailedLogging() {
        verbosity.disableDetailed();

        Map<String, Object> body = acknowledgement("Detailed query logging has been disabled");
        body.put("note", String.format("Only slow queries (>%dms) will be logged now", thresholdMillis()));
        return body;
    }

    /**
     * Changes the slow query threshold for future classifications.
     *
     * @param seconds new threshold, finite and not negative
     * @return acknowledgement with the threshold in effect
     * @throws IllegalArgumentException if the value is rejected; the previous threshold stays
     */
    public Map<String, Object> updateSlowQueryThreshold(double seconds) {
        classifier.setThresholdSeconds(seconds);

        Map<String, Object> body = acknowledgement("Slow query threshold updated");
        body.put("slow_query_threshold_seconds", classifier.getThresholdSeconds());
        return body;
    }

    public VerbosityMode currentMode() {
        return verbosity.currentMode();
    }

    private Map<String, Object> acknowledgement(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", message);
        body.put("timestamp", now());
        return body;
    }

    private long thresholdMillis() {
        return Math.round(classifier.getThresholdSeconds() * 1000);
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static SlowQueryView toView(QuerySample sample) {
        return new SlowQueryView(
            sample.query(),
            sample.parameters(),
            round(sample.durationSeconds()),
            sample.timestamp().toString(),
            sample.success()
        );
    }

    static double round(double seconds) {
        return BigDecimal.valueOf(seconds).setScale(DURATION_SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    // =========================================================================
    // External shape
    // =========================================================================

    public record QueryPerformanceReport(
        @JsonProperty("query_performance") QueryPerformance queryPerformance,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("note") String note
    ) {}

    public record QueryPerformance(
        @JsonProperty("total_queries") long totalQueries,
        @JsonProperty("avg_query_time") double avgQueryTime,
        @JsonProperty("max_query_time") double maxQueryTime,
        @JsonProperty("min_query_time") double minQueryTime,
        @JsonProperty("slow_queries_count") long slowQueriesCount,
        @JsonProperty("recent_slow_queries") List<SlowQueryView> recentSlowQueries
    ) {}

    public record SlowQueryView(
        @JsonProperty("query") String query,
        @JsonProperty("parameters") List<Object> parameters,
        @JsonProperty("execution_time") double executionTime,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("success") boolean success
    ) {}
}
