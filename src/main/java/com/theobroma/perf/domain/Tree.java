package com.theobroma.perf.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record Tree(
    Long id,
    String treeCode,
    String variety,
    LocalDate plantingDate,
    Integer ageYears,
    BigDecimal heightMeters,
    BigDecimal trunkDiameterCm,
    String healthStatus,
    LocalDate lastInspection,
    BigDecimal maturityIndex,
    BigDecimal fungalThreatLevel,
    int securityEventsCount,
    GeoPoint location
) {}
