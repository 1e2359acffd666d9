package com.commutematch.dto;

import com.commutematch.entity.Trip;
import com.commutematch.matching.model.Coordinate;

import java.time.Instant;
import java.util.List;

public class TripResponse {
    private final String id;
    private final String userId;
    private final Coordinate origin;
    private final Coordinate destination;
    private final int polylinePoints;
    private final List<Coordinate> sampledPoints;
    private final Instant departTime;
    private final String status;
    private final Instant createdAt;

    public TripResponse(String id, String userId, Coordinate origin, Coordinate destination, int polylinePoints,
                        List<Coordinate> sampledPoints, Instant departTime, String status, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.origin = origin;
        this.destination = destination;
        this.polylinePoints = polylinePoints;
        this.sampledPoints = sampledPoints;
        this.departTime = departTime;
        this.status = status;
        this.createdAt = createdAt;
    }

    public static TripResponse from(Trip trip) {
        return new TripResponse(trip.getId(), trip.getUserId(), trip.getOrigin(), trip.getDestination(),
                trip.getPolyline().size(), trip.getSampledPoints(), trip.getDepartTime(),
                trip.getStatus().name(), trip.getCreatedAt());
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public Coordinate getOrigin() { return origin; }
    public Coordinate getDestination() { return destination; }
    public int getPolylinePoints() { return polylinePoints; }
    public List<Coordinate> getSampledPoints() { return sampledPoints; }
    public Instant getDepartTime() { return departTime; }
    public String getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
}
