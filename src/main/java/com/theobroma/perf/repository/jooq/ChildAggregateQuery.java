package com.theobroma.perf.repository.jooq;

import java.util.Collection;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Describes a parent/child batch fetch: which parents, which of their columns, and
 * which aggregates over their children.
 *
 * Example, every lot of farm 3 with its tree count and average maturity:
 * <pre>
 * ChildAggregateQuery.builder()
 *     .parentTable("lots").childTable("trees").childForeignKey("lot_id")
 *     .parentColumn("lot_number")
 *     .scope("farm_id", 3L)
 *     .aggregate(AggregateSpec.count("tree_count"))
 *     .aggregate(AggregateSpec.avg("maturity_index", "avg_maturity"))
 *     .orderBy("lot_number")
 *     .build();
 * </pre>
 *
 * {@code parentIds == null} means "every parent in scope"; an empty collection means
 * "no parents" and short-circuits without a query. The same holds for
 * {@code filterValues} once a filter column is set.
 */
@Value
@Builder
public class ChildAggregateQuery {

    @NonNull
    String parentTable;

    @Builder.Default
    String parentKey = "id";

    @Singular
    List<String> parentColumns;

    /** Optional geography column on the parent whose coordinates are extracted in the same pass. */
    String locationColumn;

    /** Optional parent column restricting the scope, e.g. {@code farm_id}. */
    String scopeColumn;

    Object scopeValue;

    Collection<Long> parentIds;

    /** Optional parent column restricted to {@link #filterValues}, e.g. {@code lot_number}. */
    String filterColumn;

    Collection<?> filterValues;

    @NonNull
    String childTable;

    @Builder.Default
    String childKey = "id";

    @NonNull
    String childForeignKey;

    @Singular
    List<AggregateSpec> aggregates;

    /** Parent column to order by; defaults to the parent key. */
    String orderBy;

    public boolean selectsNothing() {
        return (parentIds != null && parentIds.isEmpty())
            || (filterColumn != null && filterValues != null && filterValues.isEmpty());
    }

    public static class ChildAggregateQueryBuilder {

        public ChildAggregateQueryBuilder scope(String column, Object value) {
            this.scopeColumn = column;
            this.scopeValue = value;
            return this;
        }

        public ChildAggregateQueryBuilder filter(String column, Collection<?> values) {
            this.filterColumn = column;
            this.filterValues = values;
            return this;
        }
    }
}
