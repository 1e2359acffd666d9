package com.commutematch.matching.index;

import com.commutematch.matching.model.Coordinate;

import java.util.List;
import java.util.Set;

/**
 * Proximity lookup over the sampled points of indexed trips.
 * <p>
 * Implementations may be eventually consistent: a freshly indexed trip can stay invisible
 * to {@link #queryNear} for a short while.
 */
public interface SpatialIndex {

    /**
     * Trips having at least one sample within {@code radiusMeters} of {@code point}, one hit per trip.
     *
     * @throws com.commutematch.matching.exception.IndexUnavailableException if the backing store cannot be reached
     */
    Set<IndexHit> queryNear(Coordinate point, double radiusMeters);

    /**
     * Replaces whatever was indexed for the trip with the given samples.
     */
    void index(String tripId, List<Coordinate> sampledPoints);

    void remove(String tripId);
}
