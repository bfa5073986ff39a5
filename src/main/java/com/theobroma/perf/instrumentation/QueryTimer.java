package com.theobroma.perf.instrumentation;

import java.time.Clock;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.theobroma.perf.config.QueryStatsProperties;
import com.theobroma.perf.domain.QuerySample;
import com.theobroma.perf.util.MetricsHelper;

import lombok.extern.slf4j.Slf4j;

/**
 * Times database calls and feeds the statistics.
 *
 * Every call is reported exactly once, failed ones included: a failing call is timed,
 * recorded with {@code success=false}, and its exception rethrown unchanged. The
 * bookkeeping itself never throws into the caller.
 *
 * Logging, on the {@code query.profiler} logger:
 * <pre>
 * WARN  SLOW QUERY (0.6123s): SELECT ...        always, for slow queries
 * INFO  QUERY (0.0123s): SELECT ...             every query while verbosity is DETAILED
 * </pre>
 * Failed executions are prefixed with {@code FAILED}. Verbosity is read when the
 * query completes, so a toggle applies to the next completion.
 *
 * jOOQ traffic reaches this class through {@link QueryTimingListener}; other callers
 * wrap their call in {@link #time}.
 */
@Slf4j(topic = "query.profiler")
@Component
public class QueryTimer {

    private static final int DEFAULT_PREVIEW_LENGTH = 200;

    private final StatisticsAggregator aggregator;
    private final VerbosityController verbosity;
    private final MetricsHelper metricsHelper;
    private final Clock clock;
    private final int slowPreviewLength;
    private final int detailedPreviewLength;

    @Autowired
    public QueryTimer(StatisticsAggregator aggregator,
                      VerbosityController verbosity,
                      MetricsHelper metricsHelper,
                      Clock clock,
                      QueryStatsProperties properties) {
        this(aggregator, verbosity, metricsHelper, clock, properties.getSqlPreviewLength());
    }

    public QueryTimer(StatisticsAggregator aggregator,
                      VerbosityController verbosity,
                      MetricsHelper metricsHelper,
                      Clock clock,
                      int sqlPreviewLength) {
        this.aggregator = aggregator;
        this.verbosity = verbosity;
        this.metricsHelper = metricsHelper;
        this.clock = clock;
        this.slowPreviewLength = sqlPreviewLength > 0 ? sqlPreviewLength : DEFAULT_PREVIEW_LENGTH;
        this.detailedPreviewLength = Math.max(1, this.slowPreviewLength / 2);
    }

    /**
     * Runs {@code execution} and reports its timing.
     *
     * @param sql SQL text, for the statistics and log lines
     * @param parameters bound values, may be null
     * @param execution the database call
     * @return whatever the call returned
     * @throws E whatever the call threw, unchanged
     */
    public <T, E extends Exception> T time(String sql, Object[] parameters, QueryExecution<T, E> execution) throws E {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = execution.execute();
            success = true;
            return result;
        } finally {
            report(sql, parameters, System.nanoTime() - start, success);
        }
    }

    /**
     * Records a completed execution measured elsewhere.
     *
     * @param sql SQL text
     * @param parameters bound values, may be null
     * @param durationNanos elapsed wall-clock time
     * @param success false when the execution raised
     */
    public void report(String sql, Object[] parameters, long durationNanos, boolean success) {
        try {
            double seconds = durationNanos / 1_000_000_000.0;
            QuerySample sample = QuerySample.of(seconds, clock.instant(), sql, parameters, success);
            boolean slow = aggregator.record(sample);
            metricsHelper.recordQuery(durationNanos, success, slow);
            logCompletion(sample, slow);
        } catch (RuntimeException e) {
            log.error("Failed to record query timing for: {}", preview(sql, slowPreviewLength), e);
        }
    }

    private void logCompletion(QuerySample sample, boolean slow) {
        String outcome = sample.success() ? "" : "FAILED ";
        String seconds = String.format(Locale.ROOT, "%.4f", sample.durationSeconds());

        if (slow) {
            log.warn("{}SLOW QUERY ({}s): {}", outcome, seconds, preview(sample.query(), slowPreviewLength));
        }

        if (verbosity.isDetailed()) {
            log.info("{}QUERY ({}s): {}", outcome, seconds, preview(sample.query(), detailedPreviewLength));
        }
    }

    static String preview(String sql, int maxLength) {
        if (sql == null) {
            return "null";
        }
        String collapsed = sql.replaceAll("\\s+", " ").trim();
        if (collapsed.length() > maxLength) {
            return collapsed.substring(0, maxLength) + "...";
        }
        return collapsed;
    }
}
