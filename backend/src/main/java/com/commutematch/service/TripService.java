package com.commutematch.service;

import com.commutematch.dto.CreateTripRequest;
import com.commutematch.entity.Trip;
import com.commutematch.matching.GeoUtils;
import com.commutematch.matching.PolylineSampler;
import com.commutematch.matching.exception.InvalidGeometryException;
import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.matching.index.SpatialIndex;
import com.commutematch.matching.model.Coordinate;
import com.commutematch.matching.model.TripStatus;
import com.commutematch.repository.TripRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class TripService {

    private static final Logger logger = LoggerFactory.getLogger(TripService.class);

    private final TripRepository tripRepository;
    private final SpatialIndex spatialIndex;
    private final PolylineSampler polylineSampler;
    private final DirectionsClient directionsClient;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Clock clock;
    private final String matchJobsTopic;
    private final double endpointToleranceMeters;

    public TripService(TripRepository tripRepository,
                       SpatialIndex spatialIndex,
                       PolylineSampler polylineSampler,
                       DirectionsClient directionsClient,
                       KafkaTemplate<String, String> kafkaTemplate,
                       Clock clock,
                       @Value("${matching.jobs.topic:trip-match-jobs}") String matchJobsTopic,
                       @Value("${trips.route.endpoint-tolerance-meters:500}") double endpointToleranceMeters) {
        this.tripRepository = tripRepository;
        this.spatialIndex = spatialIndex;
        this.polylineSampler = polylineSampler;
        this.directionsClient = directionsClient;
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
        this.matchJobsTopic = matchJobsTopic;
        this.endpointToleranceMeters = endpointToleranceMeters;
    }

    @Transactional
    public Trip createTrip(CreateTripRequest request) {
        if (request.getOriginLat() == null || request.getOriginLon() == null
                || request.getDestinationLat() == null || request.getDestinationLon() == null) {
            throw new InvalidGeometryException("Origin and destination coordinates are required");
        }
        Coordinate origin = new Coordinate(request.getOriginLat(), request.getOriginLon());
        Coordinate destination = new Coordinate(request.getDestinationLat(), request.getDestinationLon());
        if (!origin.isValid() || !destination.isValid()) {
            throw new InvalidGeometryException("Invalid origin or destination coordinates");
        }

        List<Coordinate> polyline = request.getPolyline();
        if (polyline == null || polyline.isEmpty()) {
            polyline = directionsClient.fetchRoute(origin, destination);
        }
        List<Coordinate> sampled = polylineSampler.sample(polyline);
        requireEndpointsMatch(polyline, origin, destination);

        Trip trip = new Trip();
        trip.setId(UUID.randomUUID().toString());
        trip.setUserId(request.getUserId());
        trip.setOrigin(origin);
        trip.setDestination(destination);
        trip.setDepartTime(request.getDepartTime());
        trip.setRoute(polyline, sampled);

        Trip saved = tripRepository.save(trip);
        spatialIndex.index(saved.getId(), sampled);
        logger.info("Trip created: ID={}, User={}, samples={}", saved.getId(), saved.getUserId(), sampled.size());

        enqueueMatchJob(saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Trip getTrip(String tripId) {
        return tripRepository.findById(tripId).orElseThrow(() -> new TripNotFoundException(tripId));
    }

    /**
     * Replaces the route of an active trip, resamples it and schedules a new matching run.
     */
    @Transactional
    public Trip updateRoute(String tripId, List<Coordinate> polyline) {
        Trip trip = getTrip(tripId);
        if (trip.getStatus() != TripStatus.ACTIVE) {
            throw new IllegalStateException("Only active trips can change route, trip " + tripId + " is " + trip.getStatus());
        }
        if (polyline == null || polyline.isEmpty()) {
            throw new InvalidGeometryException("Route polyline is required");
        }
        List<Coordinate> sampled = polylineSampler.sample(polyline);
        requireEndpointsMatch(polyline, trip.getOrigin(), trip.getDestination());
        trip.setRoute(polyline, sampled);
        Trip saved = tripRepository.save(trip);
        spatialIndex.index(tripId, sampled);
        logger.info("Trip {} route updated, samples={}", tripId, sampled.size());

        enqueueMatchJob(tripId);
        return saved;
    }

    @Transactional
    public Trip confirmMatch(String tripId) {
        return moveTo(tripId, TripStatus.MATCHED);
    }

    @Transactional
    public Trip cancelTrip(String tripId) {
        return moveTo(tripId, TripStatus.CANCELLED);
    }

    /**
     * Expires active trips whose departure lies more than {@code grace} in the past.
     *
     * @return number of trips expired
     */
    @Transactional
    public int expireOverdueTrips(Duration grace) {
        Instant threshold = clock.instant().minus(grace);
        List<Trip> overdue = tripRepository.findByStatusAndDepartTimeBefore(TripStatus.ACTIVE, threshold);
        for (Trip trip : overdue) {
            trip.transitionTo(TripStatus.EXPIRED);
            tripRepository.save(trip);
            removeFromIndex(trip.getId());
        }
        if (!overdue.isEmpty()) {
            logger.info("Expired {} trips departing before {}", overdue.size(), threshold);
        }
        return overdue.size();
    }

    public void requestRematch(String tripId) {
        Trip trip = getTrip(tripId);
        enqueueMatchJob(trip.getId());
    }

    // Sampled points and origin/destination must describe the same route.
    private void requireEndpointsMatch(List<Coordinate> polyline, Coordinate origin, Coordinate destination) {
        double startGap = GeoUtils.haversineMeters(polyline.get(0), origin);
        double endGap = GeoUtils.haversineMeters(polyline.get(polyline.size() - 1), destination);
        if (startGap > endpointToleranceMeters || endGap > endpointToleranceMeters) {
            throw new InvalidGeometryException(String.format(
                    "Route endpoints are %.0f m from origin and %.0f m from destination, tolerance is %.0f m",
                    startGap, endGap, endpointToleranceMeters));
        }
    }

    private Trip moveTo(String tripId, TripStatus next) {
        Trip trip = getTrip(tripId);
        trip.transitionTo(next);
        Trip saved = tripRepository.save(trip);
        removeFromIndex(tripId);
        logger.info("Trip {} is now {}", tripId, next);
        return saved;
    }

    // Candidates are re-checked against the store, so a stale index entry only costs a lookup.
    private void removeFromIndex(String tripId) {
        try {
            spatialIndex.remove(tripId);
        } catch (RuntimeException e) {
            logger.warn("Failed to remove trip {} from spatial index: {}", tripId, e.getMessage());
        }
    }

    void enqueueMatchJob(String tripId) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publish(tripId);
                }
            });
        } else {
            publish(tripId);
        }
    }

    private void publish(String tripId) {
        try {
            kafkaTemplate.send(matchJobsTopic, tripId, tripId);
            logger.info("Match job published for trip {} on {}", tripId, matchJobsTopic);
        } catch (Exception e) {
            logger.error("Failed to publish match job for trip {}: {}", tripId, e.getMessage());
        }
    }
}
