package com.theobroma.perf.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One completed query execution, successful or not.
 *
 * Immutable: parameters are copied on construction, so later mutation of the
 * caller's array never leaks into recorded statistics. Null parameters are
 * allowed (SQL NULL binds).
 *
 * @param durationSeconds wall-clock execution time in seconds
 * @param timestamp completion time
 * @param query SQL text as sent to the database
 * @param parameters bound parameter values, in bind order
 * @param success false when the execution raised
 */
public record QuerySample(
    double durationSeconds,
    Instant timestamp,
    String query,
    List<Object> parameters,
    boolean success
) {

    public QuerySample {
        Objects.requireNonNull(timestamp, "timestamp");
        query = query == null ? "" : query;
        parameters = parameters == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static QuerySample of(double durationSeconds, Instant timestamp, String query,
                                 Object[] parameters, boolean success) {
        List<Object> params = parameters == null ? List.of() : Arrays.asList(parameters);
        return new QuerySample(durationSeconds, timestamp, query, params, success);
    }
}
