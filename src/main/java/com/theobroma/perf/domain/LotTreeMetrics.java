package com.theobroma.perf.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A lot with metrics aggregated over its trees.
 *
 * Counts and averages are zero for a lot without trees; {@code hasTrees} tells the
 * two cases apart.
 */
public record LotTreeMetrics(
    long lotId,
    int lotNumber,
    BigDecimal areaHectares,
    Integer treeDensity,
    String soilType,
    Integer elevationMeters,
    LocalDate plantingDate,
    LocalDate lastHarvest,
    GeoPoint centroid,
    long treeCount,
    long healthyTrees,
    long unhealthyTrees,
    double avgMaturity,
    double avgHeight,
    double avgDiameter,
    double avgFungalThreat,
    long totalSecurityEvents,
    LocalDate lastTreeInspection,
    boolean hasTrees
) {}
