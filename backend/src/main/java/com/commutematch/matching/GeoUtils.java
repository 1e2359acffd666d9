package com.commutematch.matching;

import com.commutematch.matching.model.Coordinate;

/**
 * Great-circle helpers on a spherical earth.
 */
public final class GeoUtils {

    public static final double EARTH_RADIUS_METERS = 6_371_000d;

    // Below this two points are treated as the same spot.
    public static final double SAME_POINT_METERS = 1.0;

    private GeoUtils() {
    }

    public static double haversineMeters(Coordinate a, Coordinate b) {
        return haversineMeters(a.lat(), a.lon(), b.lat(), b.lon());
    }

    public static double haversineMeters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Linear interpolation in degree space, adequate for segments of a few kilometres.
     */
    public static Coordinate interpolate(Coordinate from, Coordinate to, double fraction) {
        double lat = from.lat() + fraction * (to.lat() - from.lat());
        double lon = from.lon() + fraction * (to.lon() - from.lon());
        return new Coordinate(lat, lon);
    }
}
