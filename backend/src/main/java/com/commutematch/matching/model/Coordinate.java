package com.commutematch.matching.model;

/**
 * A geographic point in signed decimal degrees.
 */
public record Coordinate(double lat, double lon) {

    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }

    public boolean isValid() {
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90 && lat <= 90
                && lon >= -180 && lon <= 180;
    }
}
