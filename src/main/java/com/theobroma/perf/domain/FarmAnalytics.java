package com.theobroma.perf.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Farm-wide lot and tree aggregates.
 */
public record FarmAnalytics(
    String farmName,
    String farmSlug,
    BigDecimal farmAreaHectares,
    long totalLots,
    BigDecimal totalLotAreaHectares,
    long totalTrees,
    long healthyTrees,
    long unhealthyTrees,
    double avgMaturity,
    double avgHeight,
    double avgFungalThreat,
    long totalSecurityEvents,
    LocalDate lastInspection,
    LocalDate oldestPlanting,
    LocalDate newestPlanting
) {}
