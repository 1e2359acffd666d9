package com.commutematch.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest ranked matches computed for a trip.
 */
@Entity
@Table(name = "trip_matches", indexes = {
    @Index(name = "idx_trip_match_for_trip", columnList = "for_trip_id", unique = true)
})
public class TripMatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "for_trip_id", nullable = false)
    private String forTripId;

    @ElementCollection
    @CollectionTable(name = "trip_match_candidates", joinColumns = @JoinColumn(name = "trip_match_id"))
    @OrderColumn(name = "rank_position")
    private List<MatchedTrip> candidates = new ArrayList<>();

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getForTripId() { return forTripId; }
    public void setForTripId(String forTripId) { this.forTripId = forTripId; }
    public List<MatchedTrip> getCandidates() { return candidates; }
    public void setCandidates(List<MatchedTrip> candidates) { this.candidates = candidates; }
    public Instant getComputedAt() { return computedAt; }
    public void setComputedAt(Instant computedAt) { this.computedAt = computedAt; }
}
