package com.theobroma.perf.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.test.web.servlet.MockMvc;

import com.theobroma.perf.instrumentation.SlowQueryClassifier;
import com.theobroma.perf.instrumentation.StatisticsAggregator;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * End-to-end checks that every database call is timed exactly once and that the
 * plantation endpoints cost a fixed number of queries.
 */
@AutoConfigureMockMvc
class QueryProfilingIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private StatisticsAggregator aggregator;

    @Autowired
    private SlowQueryClassifier classifier;

    @Autowired
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        aggregator.reset();
    }

    @AfterEach
    void restoreThreshold() {
        classifier.setThresholdSeconds(0.5);
    }

    // =========================================================================
    // Batch fetch
    // =========================================================================

    @Test
    @DisplayName("Lots summary costs two queries: farm lookup and one aggregate")
    void lotsSummary_ShouldUseConstantQueries() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/lots"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_lots").value(3))
            .andExpect(jsonPath("$.total_trees").value(6))
            .andExpect(jsonPath("$.lots[0].total_trees").value(4))
            .andExpect(jsonPath("$.lots[0].healthy_trees").value(2))
            .andExpect(jsonPath("$.lots[0].unhealthy_trees").value(1))
            .andExpect(jsonPath("$.lots[0].security_events").value(9))
            .andExpect(jsonPath("$.lots[0].avg_maturity").value(75.0))
            .andExpect(jsonPath("$.lots[2].total_trees").value(0))
            .andExpect(jsonPath("$.lots[2].avg_maturity").value(0.0))
            .andExpect(jsonPath("$.lots[0].centroid.latitude").value(-14.235));

        assertThat(aggregator.totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("min_maturity drops lots below it, including lots without trees")
    void lotsSummary_ShouldFilterByMaturity() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/lots").param("min_maturity", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_lots").value(1))
            .andExpect(jsonPath("$.lots[0].lot_id").value(1));
    }

    @Test
    @DisplayName("Farm analytics fold everything into one query after the farm lookup")
    void analytics_ShouldUseOneAggregateQuery() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/analytics/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_lots").value(3))
            .andExpect(jsonPath("$.total_trees").value(6))
            .andExpect(jsonPath("$.total_security_events").value(11))
            .andExpect(jsonPath("$.total_lot_area_hectares").value(46.5));

        assertThat(aggregator.totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Production analytics cost two queries and mark lots at the threshold ready")
    void productionAnalytics_ShouldUseConstantQueries() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/analytics/production").param("ready_threshold", "70"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.production_metrics.length()").value(3))
            .andExpect(jsonPath("$.production_metrics[2].lot_id").value(3))
            .andExpect(jsonPath("$.production_metrics[2].estimated_yield").value(0.0))
            .andExpect(jsonPath("$.production_metrics[2].quality_score").value(100.0))
            .andExpect(jsonPath("$.lots_ready_for_harvest").value(1));

        assertThat(aggregator.totalCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Security trees come back most affected first")
    void securityTrees_ShouldOrderByEvents() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/security/trees").param("min_events", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_trees").value(3))
            .andExpect(jsonPath("$.trees[0].tree_code").value("FB-L1-0003"))
            .andExpect(jsonPath("$.total_security_events").value(10));
    }

    @Test
    @DisplayName("Unknown lot answers 404")
    void lotTrees_ShouldAnswer404_ForUnknownLot() throws Exception {
        mockMvc.perform(get("/farms/fazenda-bahia/lots/9/trees"))
            .andExpect(status().isNotFound());
    }

    // =========================================================================
    // Statistics
    // =========================================================================

    @Test
    @DisplayName("With a zero threshold every query is slow and listed")
    void zeroThreshold_ShouldListQueriesAsSlow() throws Exception {
        mockMvc.perform(put("/debug/slow-query-threshold").param("seconds", "0"))
            .andExpect(status().isOk());

        mockMvc.perform(get("/farms"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_farms").value(2));

        mockMvc.perform(get("/debug/query-stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.query_performance.total_queries").value(1))
            .andExpect(jsonPath("$.query_performance.slow_queries_count").value(1))
            .andExpect(jsonPath("$.query_performance.recent_slow_queries[0].query").value(containsString("farms")));
    }

    @Test
    @DisplayName("The plain JDBC health check is timed like jOOQ queries")
    void healthCheck_ShouldBeCounted() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"));

        assertThat(aggregator.totalCount()).isEqualTo(1);
        assertThat(meterRegistry.get("db.query.duration").tag("outcome", "success").timer().count()).isPositive();
    }
}
