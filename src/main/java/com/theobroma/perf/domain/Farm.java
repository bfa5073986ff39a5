package com.theobroma.perf.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A farm with the coordinates of its location.
 */
public record Farm(
    Long id,
    String name,
    String slug,
    BigDecimal totalAreaHectares,
    LocalDate establishedDate,
    String contactEmail,
    String contactPhone,
    GeoPoint location
) {}
