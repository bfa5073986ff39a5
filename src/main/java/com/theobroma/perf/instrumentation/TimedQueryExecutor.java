package com.theobroma.perf.instrumentation;

import lombok.RequiredArgsConstructor;

/**
 * Decorates a {@link QueryExecutor} so every call goes through {@link QueryTimer}.
 */
@RequiredArgsConstructor
public class TimedQueryExecutor implements QueryExecutor {

    private final QueryExecutor delegate;
    private final QueryTimer queryTimer;

    @Override
    public QueryResult execute(String sql, Object... parameters) {
        return queryTimer.time(sql, parameters, () -> delegate.execute(sql, parameters));
    }
}
