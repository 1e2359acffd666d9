package com.commutematch.matching.model;

import com.commutematch.matching.GeoUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view of a trip as seen by the matching engine.
 */
public record TripSnapshot(
        String id,
        String userId,
        Coordinate origin,
        Coordinate destination,
        List<Coordinate> sampledPoints,
        Instant departTime,
        TripStatus status
) {

    public TripSnapshot {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(departTime, "departTime");
        Objects.requireNonNull(status, "status");
        sampledPoints = sampledPoints == null ? List.of() : List.copyOf(sampledPoints);
    }

    public boolean isActive() {
        return status == TripStatus.ACTIVE;
    }

    /**
     * A trip with no samples, or whose samples all collapse onto one spot, has no route to share.
     */
    public boolean isRoutable() {
        if (sampledPoints.isEmpty()) {
            return false;
        }
        Coordinate first = sampledPoints.get(0);
        Coordinate last = sampledPoints.get(sampledPoints.size() - 1);
        return sampledPoints.size() > 1 && GeoUtils.haversineMeters(first, last) > GeoUtils.SAME_POINT_METERS;
    }

    public Duration departDelta(TripSnapshot other) {
        return Duration.between(departTime, other.departTime).abs();
    }
}
