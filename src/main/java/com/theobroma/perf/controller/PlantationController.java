package com.theobroma.perf.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.theobroma.perf.domain.FarmAnalytics;
import com.theobroma.perf.service.HealthService;
import com.theobroma.perf.service.PlantationService;
import com.theobroma.perf.service.PlantationService.FarmsResponse;
import com.theobroma.perf.service.PlantationService.LotTreesResponse;
import com.theobroma.perf.service.PlantationService.LotsResponse;
import com.theobroma.perf.service.PlantationService.ProductionAnalyticsResponse;
import com.theobroma.perf.service.PlantationService.SecurityTreesResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for plantation data.
 *
 * Every endpoint is served by batch queries: the number of database round trips does
 * not grow with the number of lots or trees returned.
 *
 * Unknown farms and lots answer 404, out-of-range parameters 400.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@Tag(name = "Plantation", description = "Farms, lots and trees")
public class PlantationController {

    private final PlantationService plantationService;
    private final HealthService healthService;

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Uptime and database connectivity")
    public ResponseEntity<HealthService.HealthResponse> health() {
        return ResponseEntity.ok(healthService.health());
    }

    @GetMapping("/farms")
    @Operation(summary = "List farms", description = "Farm slugs plus farm data with coordinates")
    public ResponseEntity<FarmsResponse> listFarms() {
        return ResponseEntity.ok(plantationService.listFarms());
    }

    @GetMapping("/farms/{farmSlug}/lots")
    @Operation(summary = "Get lots summary",
               description = "Tree counts, health, security events, maturity and fungal threat per lot")
    public ResponseEntity<LotsResponse> getLotsSummary(
            @PathVariable String farmSlug,
            @RequestParam(required = false) Integer limit,
            @RequestParam(name = "min_maturity", required = false) Double minMaturity) {

        checkRange("limit", limit, 1, 100);
        if (minMaturity != null && (minMaturity < 0 || minMaturity > 100)) {
            throw new IllegalArgumentException("min_maturity must be between 0 and 100");
        }

        log.info("API: Lots summary - farm={}, limit={}, minMaturity={}", farmSlug, limit, minMaturity);
        return ResponseEntity.ok(plantationService.getLotsSummary(farmSlug, limit, minMaturity));
    }

    @GetMapping("/farms/{farmSlug}/lots/{lotNumber}/trees")
    @Operation(summary = "Get lot trees", description = "Trees of one lot with their coordinates")
    public ResponseEntity<LotTreesResponse> getLotTrees(
            @PathVariable String farmSlug,
            @PathVariable int lotNumber,
            @RequestParam(required = false) Integer limit) {

        checkRange("limit", limit, 1, 1000);

        log.info("API: Lot trees - farm={}, lot={}, limit={}", farmSlug, lotNumber, limit);
        return ResponseEntity.ok(plantationService.getLotTrees(farmSlug, lotNumber, limit));
    }

    @GetMapping("/farms/{farmSlug}/security/trees")
    @Operation(summary = "Get trees with security events",
               description = "Trees with at least min_events security events, most affected first")
    public ResponseEntity<SecurityTreesResponse> getSecurityTrees(
            @PathVariable String farmSlug,
            @RequestParam(name = "lot_id", required = false) Integer lotNumber,
            @RequestParam(name = "min_events", defaultValue = "1") int minEvents,
            @RequestParam(required = false) Integer limit) {

        checkRange("lot_id", lotNumber, 1, Integer.MAX_VALUE);
        checkRange("limit", limit, 1, 200);

        log.info("API: Security trees - farm={}, lot={}, minEvents={}, limit={}",
            farmSlug, lotNumber, minEvents, limit);
        return ResponseEntity.ok(plantationService.getSecurityTrees(farmSlug, lotNumber, minEvents, limit));
    }

    @GetMapping("/farms/{farmSlug}/analytics/summary")
    @Operation(summary = "Get farm analytics", description = "Farm-wide lot and tree aggregates in one query")
    public ResponseEntity<FarmAnalytics> getFarmAnalytics(@PathVariable String farmSlug) {
        return ResponseEntity.ok(plantationService.getFarmAnalytics(farmSlug));
    }

    @GetMapping("/farms/{farmSlug}/analytics/production")
    @Operation(summary = "Get production analytics",
               description = "Estimated yield, quality score and harvest readiness per lot")
    public ResponseEntity<ProductionAnalyticsResponse> getProductionAnalytics(
            @PathVariable String farmSlug,
            @RequestParam(name = "ready_threshold", defaultValue = "80") double readyThreshold) {

        if (readyThreshold < 0 || readyThreshold > 100) {
            throw new IllegalArgumentException("ready_threshold must be between 0 and 100");
        }

        log.info("API: Production analytics - farm={}, readyThreshold={}", farmSlug, readyThreshold);
        return ResponseEntity.ok(plantationService.getProductionAnalytics(farmSlug, readyThreshold));
    }

    private static void checkRange(String name, Integer value, int min, int max) {
        if (value != null && (value < min || value > max)) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max);
        }
    }
}
