package com.theobroma.perf.instrumentation;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.theobroma.perf.domain.QuerySample;

/**
 * Fixed-capacity FIFO of slow query samples.
 *
 * Adding to a full ring evicts the oldest sample. Not thread-safe: the owning
 * {@link StatisticsAggregator} guards every access with its lock.
 */
class SlowQueryRing {

    private final int capacity;
    private final ArrayDeque<QuerySample> samples;

    SlowQueryRing(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ring capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    void add(QuerySample sample) {
        if (samples.size() == capacity) {
            samples.pollFirst();
        }
        samples.addLast(sample);
    }

    /**
     * Copies the newest {@code limit} samples, oldest first.
     */
    List<QuerySample> newest(int limit) {
        int skip = Math.max(0, samples.size() - limit);
        List<QuerySample> copy = new ArrayList<>(Math.min(limit, samples.size()));
        Iterator<QuerySample> it = samples.iterator();
        for (int i = 0; it.hasNext(); i++) {
            QuerySample sample = it.next();
            if (i >= skip) {
                copy.add(sample);
            }
        }
        return copy;
    }

    int size() {
        return samples.size();
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        samples.clear();
    }
}
