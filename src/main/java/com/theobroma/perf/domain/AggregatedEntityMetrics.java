package com.theobroma.perf.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A parent row together with aggregates computed over its children in the same round trip.
 *
 * Count, sum and average aggregates are never null: a parent without children reports
 * zero for all of them. Because an average over zero children is also zero,
 * {@link #hasChildren()} is the way to tell "no children" from "children averaging zero".
 * MAX aggregates keep SQL semantics and are null when there is nothing to compare.
 *
 * Column and MAX values are whatever the JDBC driver returned for them.
 *
 * Transient; built per request by the batch fetch planner.
 */
public record AggregatedEntityMetrics(
    long id,
    Map<String, Object> columns,
    Map<String, Object> aggregates,
    long childRows,
    GeoPoint location
) {

    public AggregatedEntityMetrics {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        aggregates = Collections.unmodifiableMap(new LinkedHashMap<>(aggregates));
    }

    public boolean hasChildren() {
        return childRows > 0;
    }

    public boolean hasLocation() {
        return location != null;
    }

    public Object column(String name) {
        return columns.get(name);
    }

    public long count(String alias) {
        return number(alias).longValue();
    }

    public double average(String alias) {
        return number(alias).doubleValue();
    }

    public double sum(String alias) {
        return number(alias).doubleValue();
    }

    public Object max(String alias) {
        return requireAggregate(alias);
    }

    private Number number(String alias) {
        Object value = requireAggregate(alias);
        return value == null ? 0 : (Number) value;
    }

    private Object requireAggregate(String alias) {
        if (!aggregates.containsKey(alias)) {
            throw new IllegalArgumentException("Aggregate not requested: " + alias);
        }
        return aggregates.get(alias);
    }
}
