package com.theobroma.perf.instrumentation;

import java.util.List;
import java.util.Map;

/**
 * Query execution primitive: run SQL with positional parameters, get rows back.
 *
 * Implementations know nothing about statistics; wrap them in
 * {@link TimedQueryExecutor} to have every call timed.
 */
public interface QueryExecutor {

    /**
     * Executes {@code sql}.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param parameters values bound in order
     * @return the rows and the elapsed time
     * @throws org.springframework.dao.DataAccessException when the database call fails
     */
    QueryResult execute(String sql, Object... parameters);

    /**
     * Rows of one execution, each as column label to value, plus its elapsed time.
     */
    record QueryResult(List<Map<String, Object>> rows, double elapsedSeconds) {

        public QueryResult {
            rows = rows == null ? List.of() : List.copyOf(rows);
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }
    }
}
