package com.commutematch.service;

import com.commutematch.entity.Trip;
import com.commutematch.matching.TripStore;
import com.commutematch.matching.model.TripSnapshot;
import com.commutematch.repository.TripRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Service
public class JpaTripStore implements TripStore {

    private final TripRepository tripRepository;

    public JpaTripStore(TripRepository tripRepository) {
        this.tripRepository = tripRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TripSnapshot> findTrip(String tripId) {
        return tripRepository.findById(tripId).map(Trip::toSnapshot);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, TripSnapshot> findTrips(Collection<String> tripIds) {
        Map<String, TripSnapshot> snapshots = new HashMap<>();
        for (Trip trip : tripRepository.findAllById(tripIds)) {
            snapshots.put(trip.getId(), trip.toSnapshot());
        }
        return snapshots;
    }
}
