package com.theobroma.perf.instrumentation;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.theobroma.perf.config.QueryStatsProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a completed query was slow.
 *
 * A query is slow when its duration is strictly greater than the threshold; a query
 * that takes exactly the threshold is not. The threshold can be changed at runtime
 * and only affects classifications made afterwards.
 */
@Slf4j
@Component
public class SlowQueryClassifier {

    private volatile double thresholdSeconds;

    @Autowired
    public SlowQueryClassifier(QueryStatsProperties properties) {
        this(properties.getSlowQueryThresholdSeconds());
    }

    public SlowQueryClassifier(double thresholdSeconds) {
        this.thresholdSeconds = validate(thresholdSeconds);
    }

    public boolean isSlow(double durationSeconds) {
        return durationSeconds > thresholdSeconds;
    }

    public double getThresholdSeconds() {
        return thresholdSeconds;
    }

    /**
     * Replaces the threshold.
     *
     * @param thresholdSeconds new threshold, finite and non-negative
     * @throws IllegalArgumentException when invalid; the current threshold is kept
     */
    public void setThresholdSeconds(double thresholdSeconds) {
        double previous = this.thresholdSeconds;
        this.thresholdSeconds = validate(thresholdSeconds);
        log.info("Slow query threshold changed: {}s -> {}s", previous, thresholdSeconds);
    }

    private static double validate(double thresholdSeconds) {
        if (Double.isNaN(thresholdSeconds) || Double.isInfinite(thresholdSeconds) || thresholdSeconds < 0) {
            throw new IllegalArgumentException(
                "Slow query threshold must be a finite, non-negative number of seconds: " + thresholdSeconds);
        }
        return thresholdSeconds;
    }
}
