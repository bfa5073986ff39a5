package com.theobroma.perf.repository.jooq;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.jooq.tools.jdbc.MockConnection;
import org.jooq.tools.jdbc.MockResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.theobroma.perf.domain.AggregatedEntityMetrics;

/**
 * Query construction and round trips of the batch fetch planner, against a jOOQ
 * mock connection that counts executions and captures SQL.
 */
class BatchFetchPlannerTest {

    private final AtomicInteger executions = new AtomicInteger();
    private final List<String> statements = new ArrayList<>();
    private final List<Object[]> bindings = new ArrayList<>();

    private MockRows response;
    private BatchFetchPlanner planner;

    @BeforeEach
    void setUp() {
        response = lotRows();
        planner = new BatchFetchPlanner(DSL.using(new MockConnection(ctx -> {
            executions.incrementAndGet();
            statements.add(ctx.sql());
            bindings.add(ctx.bindings());
            return new MockResult[] {response.toResult()};
        }), SQLDialect.POSTGRES));
    }

    // =========================================================================
    // Round trips
    // =========================================================================

    @Test
    @DisplayName("One round trip whatever the number of parents")
    void fetch_ShouldUseOneRoundTrip_RegardlessOfParentCount() {
        response.row(1L, 1, 0.0, 0.0, 3L, 3L, new BigDecimal("60.00"));
        Map<Long, AggregatedEntityMetrics> one = planner.fetch(lotsOfFarm(3L));
        assertThat(executions.get()).isEqualTo(1);

        response = lotRows();
        for (long id = 1; id <= 25; id++) {
            response.row(id, (int) id, 14.1, -89.2, 10L, 10L, new BigDecimal("55.50"));
        }
        Map<Long, AggregatedEntityMetrics> many = planner.fetch(lotsOfFarm(3L));

        assertThat(one).hasSize(1);
        assertThat(many).hasSize(25);
        assertThat(executions.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Parents come back in query order, keyed by id")
    void fetch_ShouldPreserveOrder() {
        response.row(12L, 1, 0.0, 0.0, 1L, 1L, BigDecimal.ONE)
            .row(10L, 2, 0.0, 0.0, 1L, 1L, BigDecimal.ONE)
            .row(11L, 3, 0.0, 0.0, 1L, 1L, BigDecimal.ONE);

        Map<Long, AggregatedEntityMetrics> result = planner.fetch(lotsOfFarm(3L));

        assertThat(result.keySet()).containsExactly(12L, 10L, 11L);
        assertThat(result.get(10L).column("lot_number")).isEqualTo(2);
    }

    // =========================================================================
    // Zero children
    // =========================================================================

    @Test
    @DisplayName("Parents without children report zero aggregates and no children")
    void parentWithoutChildren_ShouldReportZeros() {
        response.row(5L, 4, 14.5, -89.9, 0L, null, null);

        AggregatedEntityMetrics lot = planner.fetch(lotsOfFarm(3L)).get(5L);

        assertThat(lot.hasChildren()).isFalse();
        assertThat(lot.count("tree_count")).isZero();
        assertThat(lot.average("avg_maturity")).isZero();
        assertThat(lot.location().latitude()).isEqualTo(14.5);
        assertThat(lot.location().longitude()).isEqualTo(-89.9);
    }

    @Test
    @DisplayName("A zero average over real children is told apart from no children")
    void zeroAverageWithChildren_ShouldHaveChildren() {
        response.row(6L, 5, 0.0, 0.0, 2L, 2L, BigDecimal.ZERO);

        AggregatedEntityMetrics lot = planner.fetch(lotsOfFarm(3L)).get(6L);

        assertThat(lot.hasChildren()).isTrue();
        assertThat(lot.average("avg_maturity")).isZero();
    }

    @Test
    @DisplayName("Asking for an aggregate that was not requested fails")
    void unknownAggregate_ShouldFail() {
        response.row(6L, 5, 0.0, 0.0, 2L, 2L, BigDecimal.ONE);

        AggregatedEntityMetrics lot = planner.fetch(lotsOfFarm(3L)).get(6L);

        assertThatThrownBy(() -> lot.average("avg_height")).isInstanceOf(IllegalArgumentException.class);
    }

    // =========================================================================
    // Short circuits and validation
    // =========================================================================

    @Test
    @DisplayName("An empty parent id set returns nothing without touching the database")
    void emptyParentIds_ShouldSkipQuery() {
        ChildAggregateQuery query = ChildAggregateQuery.builder()
            .parentTable("lots").childTable("trees").childForeignKey("lot_id")
            .parentIds(List.of())
            .aggregate(AggregateSpec.count("tree_count"))
            .build();

        assertThat(planner.fetch(query)).isEmpty();
        assertThat(executions.get()).isZero();
    }

    @Test
    @DisplayName("An empty filter value set returns nothing without touching the database")
    void emptyFilterValues_ShouldSkipQuery() {
        ChildAggregateQuery query = ChildAggregateQuery.builder()
            .parentTable("lots").childTable("trees").childForeignKey("lot_id")
            .filter("lot_number", List.of())
            .aggregate(AggregateSpec.count("tree_count"))
            .build();

        assertThat(planner.fetch(query)).isEmpty();
        assertThat(executions.get()).isZero();
    }

    @Test
    @DisplayName("Identifiers that are not plain lowercase names are rejected")
    void invalidIdentifier_ShouldBeRejected() {
        ChildAggregateQuery query = ChildAggregateQuery.builder()
            .parentTable("lots; DROP TABLE trees").childTable("trees").childForeignKey("lot_id")
            .aggregate(AggregateSpec.count("tree_count"))
            .build();

        assertThatThrownBy(() -> planner.fetch(query))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Invalid SQL identifier");
        assertThat(executions.get()).isZero();
    }

    // =========================================================================
    // Query shape
    // =========================================================================

    @Test
    @DisplayName("The query is a grouped LEFT JOIN with COALESCE and in-query coordinates")
    void query_ShouldBeGroupedLeftJoin() {
        planner.fetch(lotsOfFarm(3L));

        String sql = statements.get(0).toLowerCase();
        assertThat(sql)
            .contains("left outer join trees")
            .contains("trees.lot_id = lots.id")
            .contains("coalesce(avg(")
            .contains("st_y(cast(lots.centroid as geometry))")
            .contains("group by")
            .contains("order by lots.lot_number");
        assertThat(bindings.get(0)).contains(3L);
    }

    @Test
    @DisplayName("Explicit parent ids and filter values are bound, not inlined")
    void parentIdsAndFilters_ShouldBeBound() {
        ChildAggregateQuery query = ChildAggregateQuery.builder()
            .parentTable("lots").childTable("trees").childForeignKey("lot_id")
            .parentIds(List.of(10L, 11L))
            .filter("lot_number", List.of(1, 2))
            .aggregate(AggregateSpec.countMatching("health_status", List.of("healthy", "good"), "healthy_trees"))
            .build();
        response = MockRows.columns(Map.of("id", Long.class, "child_rows", Long.class, "healthy_trees", Long.class));

        planner.fetch(query);

        String sql = statements.get(0).toLowerCase();
        assertThat(sql).contains("lots.id in (").contains("lots.lot_number in (").contains("case when");
        assertThat(bindings.get(0)).contains(10L, 11L, 1, 2);
    }

    private static ChildAggregateQuery lotsOfFarm(long farmId) {
        return ChildAggregateQuery.builder()
            .parentTable("lots")
            .parentColumn("lot_number")
            .locationColumn("centroid")
            .scope("farm_id", farmId)
            .childTable("trees")
            .childForeignKey("lot_id")
            .aggregate(AggregateSpec.count("tree_count"))
            .aggregate(AggregateSpec.avg("maturity_index", "avg_maturity"))
            .orderBy("lot_number")
            .build();
    }

    private static MockRows lotRows() {
        Map<String, Class<?>> columns = new LinkedHashMap<>();
        columns.put("id", Long.class);
        columns.put("lot_number", Integer.class);
        columns.put("lat", Double.class);
        columns.put("lng", Double.class);
        columns.put("child_rows", Long.class);
        columns.put("tree_count", Long.class);
        columns.put("avg_maturity", BigDecimal.class);
        return MockRows.columns(columns);
    }
}
