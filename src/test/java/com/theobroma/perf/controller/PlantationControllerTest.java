package com.theobroma.perf.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

import com.theobroma.perf.domain.GeoPoint;
import com.theobroma.perf.service.HealthService;
import com.theobroma.perf.service.PlantationService;
import com.theobroma.perf.service.PlantationService.LotSummary;
import com.theobroma.perf.service.PlantationService.LotsResponse;
import com.theobroma.perf.service.PlantationService.ProductionAnalyticsResponse;
import com.theobroma.perf.service.PlantationService.ProductionMetrics;
import com.theobroma.perf.util.ResourceNotFoundException;

/**
 * Web layer tests for the plantation endpoints: parameter validation, error mapping
 * and response shape.
 */
@WebMvcTest(PlantationController.class)
class PlantationControllerTest {

    private static final String CORRELATION_ID = "550e8400-e29b-41d4-a716-446655440000";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlantationService plantationService;

    @MockBean
    private HealthService healthService;

    // =========================================================================
    // Lots
    // =========================================================================

    @Test
    @DisplayName("Lots summary serialises with snake_case keys")
    void getLotsSummary_ShouldReturnSummary() throws Exception {
        LotSummary lot = new LotSummary(1, 10, 8, 1, 3, 72.5, 4.2, 0.3,
            new BigDecimal("2.50"), null, new GeoPoint(14.1, -89.2));
        when(plantationService.getLotsSummary("finca-esperanza", 5, 50.0))
            .thenReturn(new LotsResponse(List.of(lot), 1, new BigDecimal("2.50"), 10));

        mockMvc.perform(get("/farms/finca-esperanza/lots").param("limit", "5").param("min_maturity", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_lots").value(1))
            .andExpect(jsonPath("$.total_trees").value(10))
            .andExpect(jsonPath("$.lots[0].lot_id").value(1))
            .andExpect(jsonPath("$.lots[0].avg_maturity").value(72.5))
            .andExpect(jsonPath("$.lots[0].centroid.latitude").value(14.1));
    }

    @Test
    @DisplayName("Out-of-range lots parameters answer 400 without calling the service")
    void getLotsSummary_ShouldRejectOutOfRangeParameters() throws Exception {
        mockMvc.perform(get("/farms/finca-esperanza/lots").param("limit", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/farms/finca-esperanza/lots").param("limit", "101"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/farms/finca-esperanza/lots").param("min_maturity", "100.5"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("min_maturity must be between 0 and 100"));

        verify(plantationService, never()).getLotsSummary(anyString(), any(), any());
    }

    @Test
    @DisplayName("Unknown farm answers 404 carrying the request correlation id")
    void getLotsSummary_ShouldAnswer404_WhenFarmUnknown() throws Exception {
        when(plantationService.getLotsSummary("nowhere", null, null))
            .thenThrow(new ResourceNotFoundException("Farm not found: nowhere"));

        mockMvc.perform(get("/farms/nowhere/lots").header("X-Correlation-ID", CORRELATION_ID))
            .andExpect(status().isNotFound())
            .andExpect(header().string("X-Correlation-ID", CORRELATION_ID))
            .andExpect(jsonPath("$.message").value("Farm not found: nowhere"))
            .andExpect(jsonPath("$.correlationId").value(CORRELATION_ID));
    }

    @Test
    @DisplayName("Database failure answers 503 without leaking details")
    void getLotsSummary_ShouldAnswer503_WhenDatabaseFails() throws Exception {
        when(plantationService.getLotsSummary("finca-esperanza", null, null))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        mockMvc.perform(get("/farms/finca-esperanza/lots"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.message").value("Database error. Please contact support with correlation ID."));
    }

    // =========================================================================
    // Trees
    // =========================================================================

    @Test
    @DisplayName("Tree limit above 1000 answers 400")
    void getLotTrees_ShouldRejectLimitAbove1000() throws Exception {
        mockMvc.perform(get("/farms/finca-esperanza/lots/1/trees").param("limit", "1001"))
            .andExpect(status().isBadRequest());

        verify(plantationService, never()).getLotTrees(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("Security trees default min_events to one and bound the limit at 200")
    void getSecurityTrees_ShouldValidateParameters() throws Exception {
        when(plantationService.getSecurityTrees("finca-esperanza", null, 1, null))
            .thenReturn(new PlantationService.SecurityTreesResponse(List.of(), 0, 0, "finca-esperanza"));

        mockMvc.perform(get("/farms/finca-esperanza/security/trees"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_security_events").value(0))
            .andExpect(jsonPath("$.farm_id").value("finca-esperanza"));
        mockMvc.perform(get("/farms/finca-esperanza/security/trees").param("limit", "201"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/farms/finca-esperanza/security/trees").param("lot_id", "0"))
            .andExpect(status().isBadRequest());
    }

    // =========================================================================
    // Production analytics
    // =========================================================================

    @Test
    @DisplayName("Production analytics defaults ready_threshold to 80 and renders snake_case")
    void getProductionAnalytics_ShouldDefaultThreshold() throws Exception {
        when(plantationService.getProductionAnalytics("finca-esperanza", 80.0)).thenReturn(
            new ProductionAnalyticsResponse(
                List.of(new ProductionMetrics(1, 12.5, 85.0, 100.0, LocalDate.of(2025, 3, 1))),
                12.5, 100.0, 1));

        mockMvc.perform(get("/farms/finca-esperanza/analytics/production"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.lots_ready_for_harvest").value(1))
            .andExpect(jsonPath("$.total_estimated_yield").value(12.5))
            .andExpect(jsonPath("$.production_metrics[0].lot_id").value(1))
            .andExpect(jsonPath("$.production_metrics[0].optimal_harvest_date").value("2025-03-01"));
    }

    @Test
    @DisplayName("ready_threshold outside 0..100 answers 400 without calling the service")
    void getProductionAnalytics_ShouldRejectOutOfRangeThreshold() throws Exception {
        mockMvc.perform(get("/farms/finca-esperanza/analytics/production").param("ready_threshold", "-1"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/farms/finca-esperanza/analytics/production").param("ready_threshold", "100.5"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("ready_threshold must be between 0 and 100"));

        verify(plantationService, never()).getProductionAnalytics(anyString(), anyDouble());
    }

    // =========================================================================
    // Health
    // =========================================================================

    @Test
    @DisplayName("Health reports the service status")
    void health_ShouldReturnStatus() throws Exception {
        when(healthService.health()).thenReturn(new HealthService.HealthResponse(
            "healthy", 12.5, new HealthService.DatabaseStatus(true, 2, null), "2025-11-16T10:30:00Z"));

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.uptime_seconds").value(12.5))
            .andExpect(jsonPath("$.database.connected").value(true));
    }
}
