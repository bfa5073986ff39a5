package com.theobroma.perf.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A tree with recorded security events, joined to its lot.
 */
public record SecurityTree(
    Long id,
    String treeCode,
    int securityEventsCount,
    Long lotId,
    Integer lotNumber,
    BigDecimal lotAreaHectares,
    String healthStatus,
    BigDecimal maturityIndex,
    LocalDate lastInspection,
    GeoPoint location
) {}
