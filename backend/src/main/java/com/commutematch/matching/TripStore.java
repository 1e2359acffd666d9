package com.commutematch.matching;

import com.commutematch.matching.model.TripSnapshot;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Read access to trips owned by the persistence layer.
 */
public interface TripStore {

    Optional<TripSnapshot> findTrip(String tripId);

    /**
     * Loads the given trips; ids that do not exist are simply absent from the map.
     */
    Map<String, TripSnapshot> findTrips(Collection<String> tripIds);
}
