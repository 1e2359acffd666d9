package com.commutematch.entity;

import com.commutematch.matching.model.Coordinate;
import com.commutematch.matching.model.TripSnapshot;
import com.commutematch.matching.model.TripStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Entity
@Table(name = "trips", indexes = {
    @Index(name = "idx_trip_status", columnList = "status"),
    @Index(name = "idx_trip_depart_time", columnList = "depart_time"),
    @Index(name = "idx_trip_user_id", columnList = "user_id")
})
public class Trip {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @NotBlank
    @Column(name = "user_id", nullable = false)
    private String userId;

    @Min(-90)
    @Max(90)
    @Column(name = "origin_lat", nullable = false)
    private double originLat;

    @Min(-180)
    @Max(180)
    @Column(name = "origin_lon", nullable = false)
    private double originLon;

    @Min(-90)
    @Max(90)
    @Column(name = "destination_lat", nullable = false)
    private double destinationLat;

    @Min(-180)
    @Max(180)
    @Column(name = "destination_lon", nullable = false)
    private double destinationLon;

    @ElementCollection
    @CollectionTable(name = "trip_polyline", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "seq")
    private List<GeoPoint> polyline = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "trip_sampled_points", joinColumns = @JoinColumn(name = "trip_id"))
    @OrderColumn(name = "seq")
    private List<GeoPoint> sampledPoints = new ArrayList<>();

    @Column(name = "depart_time", nullable = false)
    private Instant departTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private TripStatus status = TripStatus.ACTIVE;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    public TripSnapshot toSnapshot() {
        return new TripSnapshot(id, userId, getOrigin(), getDestination(),
                toCoordinates(sampledPoints), departTime, status);
    }

    /**
     * Replaces the route; the sampled points must be derived from the same polyline.
     */
    public void setRoute(List<Coordinate> polyline, List<Coordinate> sampledPoints) {
        this.polyline.clear();
        polyline.forEach(c -> this.polyline.add(GeoPoint.from(c)));
        this.sampledPoints.clear();
        sampledPoints.forEach(c -> this.sampledPoints.add(GeoPoint.from(c)));
    }

    /**
     * @throws IllegalStateException if the lifecycle does not allow moving to {@code next}
     */
    public void transitionTo(TripStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Trip " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    private static List<Coordinate> toCoordinates(List<GeoPoint> points) {
        return points.stream().map(GeoPoint::toCoordinate).collect(Collectors.toList());
    }

    public Coordinate getOrigin() { return new Coordinate(originLat, originLon); }
    public void setOrigin(Coordinate origin) {
        this.originLat = origin.lat();
        this.originLon = origin.lon();
    }
    public Coordinate getDestination() { return new Coordinate(destinationLat, destinationLon); }
    public void setDestination(Coordinate destination) {
        this.destinationLat = destination.lat();
        this.destinationLon = destination.lon();
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public List<Coordinate> getPolyline() { return toCoordinates(polyline); }
    public List<Coordinate> getSampledPoints() { return toCoordinates(sampledPoints); }
    public Instant getDepartTime() { return departTime; }
    public void setDepartTime(Instant departTime) { this.departTime = departTime; }
    public TripStatus getStatus() { return status; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
