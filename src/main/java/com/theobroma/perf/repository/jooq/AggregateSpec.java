package com.theobroma.perf.repository.jooq;

import java.util.List;
import java.util.Objects;

/**
 * One per-parent aggregate over child rows.
 *
 * @param function aggregate to compute
 * @param column child column the aggregate reads; ignored for {@link Function#COUNT}
 * @param alias result column name
 * @param matchValues values counted by {@link Function#COUNT_MATCHING}
 */
public record AggregateSpec(Function function, String column, String alias, List<String> matchValues) {

    public enum Function {
        /** Number of child rows. */
        COUNT,
        /** Number of child rows whose column is one of the match values. */
        COUNT_MATCHING,
        /** Average of a numeric child column, 0 without children. */
        AVG,
        /** Sum of a numeric child column, 0 without children. */
        SUM,
        /** Largest value of a child column, null without children. */
        MAX
    }

    public AggregateSpec {
        Objects.requireNonNull(function, "function");
        Objects.requireNonNull(alias, "alias");
        if (function != Function.COUNT && column == null) {
            throw new IllegalArgumentException(function + " requires a child column");
        }
        matchValues = matchValues == null ? List.of() : List.copyOf(matchValues);
        if (function == Function.COUNT_MATCHING && matchValues.isEmpty()) {
            throw new IllegalArgumentException("COUNT_MATCHING requires at least one value");
        }
    }

    public static AggregateSpec count(String alias) {
        return new AggregateSpec(Function.COUNT, null, alias, null);
    }

    public static AggregateSpec countMatching(String column, List<String> values, String alias) {
        return new AggregateSpec(Function.COUNT_MATCHING, column, alias, values);
    }

    public static AggregateSpec avg(String column, String alias) {
        return new AggregateSpec(Function.AVG, column, alias, null);
    }

    public static AggregateSpec sum(String column, String alias) {
        return new AggregateSpec(Function.SUM, column, alias, null);
    }

    public static AggregateSpec max(String column, String alias) {
        return new AggregateSpec(Function.MAX, column, alias, null);
    }
}
