package com.theobroma.perf.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.theobroma.perf.service.QueryStatsService;
import com.theobroma.perf.service.QueryStatsService.QueryPerformanceReport;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST controller for query profiling.
 *
 * Endpoints:
 * - GET  /debug/query-stats: live query statistics and recent slow queries
 * - POST /debug/reset-query-stats: start counting from zero
 * - POST /debug/enable-detailed-logging: log every query
 * - POST /debug/disable-detailed-logging: log slow queries only
 * - PUT  /debug/slow-query-threshold?seconds=: change the slow query threshold
 */
@Slf4j
@RestController
@RequestMapping("/debug")
@RequiredArgsConstructor
@Tag(name = "Debug", description = "Query performance monitoring")
public class QueryStatsController {

    private final QueryStatsService queryStatsService;

    @GetMapping("/query-stats")
    @Operation(summary = "Get query performance statistics",
               description = "Returns query counts, execution time aggregates and the most recent slow queries")
    public ResponseEntity<QueryPerformanceReport> getQueryStats() {
        return ResponseEntity.ok(queryStatsService.queryStats());
    }

    @PostMapping("/reset-query-stats")
    @Operation(summary = "Reset query performance statistics",
               description = "Clears all collected query statistics and slow query history")
    public ResponseEntity<Map<String, Object>> resetQueryStats() {
        log.info("API: Reset query statistics");
        return ResponseEntity.ok(queryStatsService.resetStats());
    }

    @PostMapping("/enable-detailed-logging")
    @Operation(summary = "Enable detailed SQL query logging",
               description = "Logs every query with its execution time. Generates a lot of log output.")
    public ResponseEntity<Map<String, Object>> enableDetailedLogging() {
        log.info("API: Enable detailed query logging");
        return ResponseEntity.ok(queryStatsService.enableDetailedLogging());
    }

    @PostMapping("/disable-detailed-logging")
    @Operation(summary = "Disable detailed SQL query logging",
               description = "Returns to logging slow queries only")
    public ResponseEntity<Map<String, Object>> disableDetailedLogging() {
        log.info("API: Disable detailed query logging");
        return ResponseEntity.ok(queryStatsService.disableDetailedLogging());
    }

    @PutMapping("/slow-query-threshold")
    @Operation(summary = "Change the slow query threshold",
               description = "Queries taking strictly longer than this many seconds are reported as slow")
    public ResponseEntity<Map<String, Object>> updateSlowQueryThreshold(@RequestParam double seconds) {
        log.info("API: Slow query threshold - seconds={}", seconds);
        return ResponseEntity.ok(queryStatsService.updateSlowQueryThreshold(seconds));
    }
}
