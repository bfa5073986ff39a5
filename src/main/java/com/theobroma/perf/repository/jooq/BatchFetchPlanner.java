package com.theobroma.perf.repository.jooq;

import static org.jooq.impl.DSL.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.GroupField;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SelectField;
import org.jooq.Table;
import org.springframework.stereotype.Repository;

import com.theobroma.perf.domain.AggregatedEntityMetrics;
import com.theobroma.perf.domain.GeoPoint;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds and runs single-round-trip parent/child aggregate queries.
 *
 * Replaces the "one query per parent" pattern:
 * <pre>
 * for lot in lots:
 *     SELECT COUNT(*), AVG(maturity_index) FROM trees WHERE lot_id = ?
 * </pre>
 * with one grouped outer join:
 * <pre>
 * SELECT lots.id, lots.lot_number, ST_Y(CAST(lots.centroid AS geometry)) AS lat, ...,
 *        COUNT(trees.id) AS tree_count, COALESCE(AVG(trees.maturity_index), 0) AS avg_maturity
 * FROM lots LEFT JOIN trees ON trees.lot_id = lots.id
 * WHERE lots.farm_id = ?
 * GROUP BY lots.id, lots.lot_number, ...
 * ORDER BY lots.lot_number
 * </pre>
 *
 * Round trips are constant in the number of parents. The LEFT JOIN keeps parents
 * without children; COALESCE turns their aggregates into zeros. Coordinates are
 * extracted in the same pass, never by a follow-up query per row.
 *
 * Table and column names are rendered as plain SQL, so they are validated against
 * a conservative identifier pattern. Values are always bound.
 *
 * Stateless: one instance serves all requests.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class BatchFetchPlanner {

    static final String LATITUDE = "lat";
    static final String LONGITUDE = "lng";
    static final String CHILD_ROWS = "child_rows";

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final DSLContext dsl;

    /**
     * Runs the aggregate query described by {@code query}.
     *
     * @param query parent scope, columns and aggregates
     * @return parent id to metrics, in the requested parent order; empty when no parent matches
     */
    public Map<Long, AggregatedEntityMetrics> fetch(ChildAggregateQuery query) {
        if (query.selectsNothing()) {
            log.debug("Batch fetch on {} skipped: empty parent id set", query.getParentTable());
            return Collections.emptyMap();
        }

        String p = identifier(query.getParentTable()) + ".";
        String c = identifier(query.getChildTable()) + ".";
        Table<?> parent = table(query.getParentTable());
        Table<?> child = table(query.getChildTable());
        Field<Long> parentKey = field(p + identifier(query.getParentKey()), Long.class);
        Field<Object> childKey = field(c + identifier(query.getChildKey()));
        Field<Long> childForeignKey = field(c + identifier(query.getChildForeignKey()), Long.class);

        List<SelectField<?>> select = new ArrayList<>();
        List<GroupField> groupBy = new ArrayList<>();
        select.add(parentKey.as(query.getParentKey()));
        groupBy.add(parentKey);

        for (String column : query.getParentColumns()) {
            Field<Object> parentColumn = field(p + identifier(column));
            select.add(parentColumn.as(column));
            groupBy.add(parentColumn);
        }

        if (query.getLocationColumn() != null) {
            Field<Object> geography = field(p + identifier(query.getLocationColumn()));
            Field<Double> lat = field("ST_Y(CAST({0} AS geometry))", Double.class, geography);
            Field<Double> lng = field("ST_X(CAST({0} AS geometry))", Double.class, geography);
            select.add(lat.as(LATITUDE));
            select.add(lng.as(LONGITUDE));
            groupBy.add(lat);
            groupBy.add(lng);
        }

        select.add(count(childKey).as(CHILD_ROWS));
        for (AggregateSpec aggregate : query.getAggregates()) {
            select.add(aggregateField(aggregate, c, childKey).as(identifier(aggregate.alias())));
        }

        String orderColumn = query.getOrderBy() != null ? query.getOrderBy() : query.getParentKey();

        Result<Record> rows = dsl
            .select(select)
            .from(parent)
            .leftJoin(child).on(childForeignKey.eq(parentKey))
            .where(scopeCondition(query, p, parentKey))
            .groupBy(groupBy)
            .orderBy(field(p + identifier(orderColumn)))
            .fetch();

        Map<Long, AggregatedEntityMetrics> metrics = new LinkedHashMap<>();
        for (Record row : rows) {
            AggregatedEntityMetrics entity = toMetrics(row, query);
            metrics.put(entity.id(), entity);
        }

        log.debug("Batch fetch on {} returned {} parents in one query", query.getParentTable(), metrics.size());
        return metrics;
    }

    private Condition scopeCondition(ChildAggregateQuery query, String p, Field<Long> parentKey) {
        Condition condition = noCondition();
        if (query.getScopeColumn() != null) {
            condition = condition.and(field(p + identifier(query.getScopeColumn())).eq(val(query.getScopeValue())));
        }
        if (query.getParentIds() != null) {
            condition = condition.and(parentKey.in(query.getParentIds()));
        }
        if (query.getFilterColumn() != null && query.getFilterValues() != null) {
            condition = condition.and(field(p + identifier(query.getFilterColumn())).in(query.getFilterValues()));
        }
        return condition;
    }

    private Field<?> aggregateField(AggregateSpec aggregate, String c, Field<Object> childKey) {
        switch (aggregate.function()) {
            case COUNT:
                return count(childKey);
            case COUNT_MATCHING:
                Field<Object> matched = field(c + identifier(aggregate.column()));
                return count(when(matched.in(aggregate.matchValues()), inline(1)));
            case AVG:
                return coalesce(avg(numericChildColumn(aggregate, c)), inline(BigDecimal.ZERO));
            case SUM:
                return coalesce(sum(numericChildColumn(aggregate, c)), inline(BigDecimal.ZERO));
            case MAX:
                return max(field(c + identifier(aggregate.column())));
            default:
                throw new IllegalArgumentException("Unsupported aggregate: " + aggregate.function());
        }
    }

    private Field<BigDecimal> numericChildColumn(AggregateSpec aggregate, String c) {
        return field(c + identifier(aggregate.column()), BigDecimal.class);
    }

    private AggregatedEntityMetrics toMetrics(Record row, ChildAggregateQuery query) {
        Map<String, Object> columns = new LinkedHashMap<>();
        for (String column : query.getParentColumns()) {
            columns.put(column, row.get(column));
        }

        Map<String, Object> aggregates = new LinkedHashMap<>();
        for (AggregateSpec aggregate : query.getAggregates()) {
            Object value = row.get(aggregate.alias());
            if (value == null && aggregate.function() != AggregateSpec.Function.MAX) {
                // Outer-joined parents without children
                value = aggregate.function() == AggregateSpec.Function.AVG
                    || aggregate.function() == AggregateSpec.Function.SUM ? BigDecimal.ZERO : 0L;
            }
            aggregates.put(aggregate.alias(), value);
        }

        GeoPoint location = null;
        if (query.getLocationColumn() != null) {
            location = GeoPoint.of((Number) row.get(LATITUDE), (Number) row.get(LONGITUDE));
        }

        Number childRows = (Number) row.get(CHILD_ROWS);
        Number id = (Number) row.get(query.getParentKey());
        return new AggregatedEntityMetrics(
            id.longValue(),
            columns,
            aggregates,
            childRows == null ? 0L : childRows.longValue(),
            location
        );
    }

    static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + name);
        }
        return name;
    }
}
