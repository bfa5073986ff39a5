package com.theobroma.perf.domain;

/**
 * WGS84 coordinates extracted from a PostGIS geography column.
 *
 * Missing coordinates map to 0/0, matching what API consumers have always received.
 */
public record GeoPoint(double latitude, double longitude) {

    public static final GeoPoint ORIGIN = new GeoPoint(0.0, 0.0);

    public static GeoPoint of(Number latitude, Number longitude) {
        if (latitude == null && longitude == null) {
            return ORIGIN;
        }
        return new GeoPoint(
            latitude == null ? 0.0 : latitude.doubleValue(),
            longitude == null ? 0.0 : longitude.doubleValue()
        );
    }
}
