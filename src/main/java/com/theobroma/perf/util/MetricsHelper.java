package com.theobroma.perf.util;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Micrometer bridge for query metrics.
 *
 * Metrics exposed via Prometheus at /actuator/prometheus:
 * - db.query.duration (timer): every timed query, tagged outcome=success/failure and slow=true/false
 * - db.query.slow (counter): queries above the slow threshold
 * - db.query.stats.* (gauges): live values of the in-process statistics
 *
 * The in-process statistics stay the source of truth for the debug endpoints;
 * these meters feed dashboards and alerting.
 *
 * @see com.theobroma.perf.config.ObservabilityConfig
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsHelper {

    private static final String QUERY_PREFIX = "db.query";

    private final MeterRegistry meterRegistry;

    /**
     * Records one timed query.
     *
     * @param durationNanos execution time
     * @param success whether the query completed without raising
     * @param slow whether it was classified as slow
     */
    public void recordQuery(long durationNanos, boolean success, boolean slow) {
        String outcome = success ? "success" : "failure";

        Timer.builder(QUERY_PREFIX + ".duration")
            .tag("outcome", outcome)
            .tag("slow", Boolean.toString(slow))
            .description("Database query execution time")
            .register(meterRegistry)
            .record(durationNanos, TimeUnit.NANOSECONDS);

        if (slow) {
            Counter.builder(QUERY_PREFIX + ".slow")
                .tag("outcome", outcome)
                .description("Queries slower than the slow query threshold")
                .register(meterRegistry)
                .increment();
        }
    }

    /**
     * Registers a gauge for a value supplier.
     *
     * @param name the gauge name
     * @param valueSupplier the supplier for the gauge value
     * @param tags optional tags (must be even number: key1, value1, key2, value2, ...)
     */
    public void registerGauge(String name, Supplier<Number> valueSupplier, String... tags) {
        Gauge.Builder<?> builder = Gauge.builder(name, valueSupplier);

        for (int i = 0; i < tags.length - 1; i += 2) {
            builder.tag(tags[i], tags[i + 1]);
        }

        builder.register(meterRegistry);
        log.debug("Registered gauge {}", name);
    }
}
