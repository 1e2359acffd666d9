package com.commutematch.matching;

import com.commutematch.matching.model.TripSnapshot;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

class InMemoryTripStore implements TripStore {

    private final Map<String, TripSnapshot> trips = new ConcurrentHashMap<>();

    void put(TripSnapshot trip) {
        trips.put(trip.id(), trip);
    }

    @Override
    public Optional<TripSnapshot> findTrip(String tripId) {
        return Optional.ofNullable(trips.get(tripId));
    }

    @Override
    public Map<String, TripSnapshot> findTrips(Collection<String> tripIds) {
        Map<String, TripSnapshot> found = new HashMap<>();
        for (String id : tripIds) {
            TripSnapshot trip = trips.get(id);
            if (trip != null) {
                found.put(id, trip);
            }
        }
        return found;
    }
}
