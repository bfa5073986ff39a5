package com.theobroma.perf.instrumentation;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.theobroma.perf.config.QueryStatsProperties;
import com.theobroma.perf.domain.QuerySample;
import com.theobroma.perf.domain.StatisticsSnapshot;

/**
 * Process-wide query statistics: count, sum, min and max of durations, the number of
 * slow queries and a bounded ring of the latest slow samples.
 *
 * One lock guards all of it. {@link #record}, {@link #reset} and {@link #snapshot}
 * never observe or leave a half-updated state, and concurrent records never lose
 * updates. Nothing under the lock does I/O or logging.
 *
 * A Spring singleton; tests create fresh instances instead of sharing global state.
 */
@Component
public class StatisticsAggregator {

    private final ReentrantLock lock = new ReentrantLock();
    private final SlowQueryClassifier classifier;
    private final SlowQueryRing ring;
    private final int recentLimit;

    private long totalCount;
    private double sumDuration;
    private double minDuration = Double.POSITIVE_INFINITY;
    private double maxDuration;
    private long slowCount;

    @Autowired
    public StatisticsAggregator(SlowQueryClassifier classifier, QueryStatsProperties properties) {
        this(classifier, properties.getRingCapacity(), properties.getRecentLimit());
    }

    public StatisticsAggregator(SlowQueryClassifier classifier, int ringCapacity, int recentLimit) {
        if (recentLimit < 0) {
            throw new IllegalArgumentException("Recent limit must not be negative: " + recentLimit);
        }
        this.classifier = classifier;
        this.ring = new SlowQueryRing(ringCapacity);
        this.recentLimit = recentLimit;
    }

    /**
     * Adds one completed execution.
     *
     * @param sample the execution
     * @return true when the sample was classified as slow and retained
     */
    public boolean record(QuerySample sample) {
        double duration = sample.durationSeconds();
        lock.lock();
        try {
            totalCount++;
            sumDuration += duration;
            if (duration < minDuration) {
                minDuration = duration;
            }
            if (duration > maxDuration) {
                maxDuration = duration;
            }
            if (classifier.isSlow(duration)) {
                slowCount++;
                ring.add(sample);
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies the current state. The result is immutable and unaffected by later records.
     */
    public StatisticsSnapshot snapshot() {
        lock.lock();
        try {
            if (totalCount == 0) {
                return new StatisticsSnapshot(0L, 0.0, 0.0, 0.0, slowCount, ring.newest(recentLimit));
            }
            return new StatisticsSnapshot(
                totalCount,
                sumDuration / totalCount,
                maxDuration,
                minDuration,
                slowCount,
                ring.newest(recentLimit)
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores the initial state and empties the slow query ring.
     */
    public void reset() {
        lock.lock();
        try {
            totalCount = 0;
            sumDuration = 0.0;
            minDuration = Double.POSITIVE_INFINITY;
            maxDuration = 0.0;
            slowCount = 0;
            ring.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copies every retained slow sample, oldest first.
     */
    public List<QuerySample> retainedSlowQueries() {
        lock.lock();
        try {
            return List.copyOf(ring.newest(ring.capacity()));
        } finally {
            lock.unlock();
        }
    }

    public long totalCount() {
        lock.lock();
        try {
            return totalCount;
        } finally {
            lock.unlock();
        }
    }

    public long slowCount() {
        lock.lock();
        try {
            return slowCount;
        } finally {
            lock.unlock();
        }
    }

    public SlowQueryClassifier classifier() {
        return classifier;
    }
}
