package com.commutematch.matching;

import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.matching.index.H3SpatialIndex;
import com.commutematch.matching.index.SpatialIndex;
import com.commutematch.matching.model.MatchCandidate;
import com.commutematch.matching.model.MatchResult;
import com.commutematch.matching.model.TripSnapshot;
import com.commutematch.matching.model.TripStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.commutematch.matching.TripFixtures.NINE_AM;
import static com.commutematch.matching.TripFixtures.trip;
import static com.commutematch.matching.TripFixtures.tripA;
import static com.commutematch.matching.TripFixtures.tripB;
import static com.commutematch.matching.TripFixtures.tripC;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MatchingOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T08:30:00Z");

    private H3SpatialIndex index;
    private InMemoryTripStore store;
    private ExecutorService executor;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() throws IOException {
        index = new H3SpatialIndex();
        store = new InMemoryTripStore();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private MatchingOrchestrator orchestrator(SpatialIndex spatialIndex, int concurrency) {
        CandidateRetriever retriever = new CandidateRetriever(spatialIndex, store, executor);
        return new MatchingOrchestrator(store, retriever, new OverlapScorer(), new Ranker(),
                MatchingSettings.DEFAULT, executor, concurrency, clock);
    }

    private MatchingOrchestrator orchestrator() {
        return orchestrator(index, 4);
    }

    private void add(TripSnapshot trip) {
        store.put(trip);
        index.index(trip.id(), trip.sampledPoints());
    }

    private static List<String> ids(MatchResult result) {
        return result.candidates().stream().map(MatchCandidate::tripId).collect(Collectors.toList());
    }

    @Test
    void commuteSharingTheRouteRanksFirst() {
        add(tripA());
        add(tripB());
        add(trip("D", 12.90, 77.585, 12.95, 77.605, NINE_AM.plusSeconds(840)));

        MatchResult result = orchestrator().findMatches("A");

        assertEquals("A", result.forTripId());
        assertEquals(NOW, result.computedAt());
        MatchCandidate first = result.candidates().get(0);
        assertEquals("B", first.tripId());
        assertTrue(first.score() > 0.8, "score " + first.score());
    }

    @Test
    void tripTwoHoursLaterIsNeverScored() {
        add(tripA());
        add(tripB());
        add(tripC());

        MatchResult result = orchestrator().findMatches("A");

        assertEquals(List.of("B"), ids(result));
    }

    @Test
    void sixEqualCandidatesAreCutToFive() {
        add(tripA());
        for (int i = 1; i <= 6; i++) {
            add(trip("trip-" + i, 12.901, 77.581, 12.949, 77.599, NINE_AM.plusSeconds(300)));
        }

        MatchResult result = orchestrator().findMatches("A");

        assertEquals(List.of("trip-1", "trip-2", "trip-3", "trip-4", "trip-5"), ids(result));
    }

    @Test
    void resultNeverContainsQueryingTripAndRespectsLimit() {
        add(tripA());
        for (int i = 0; i < 12; i++) {
            add(trip("c" + i, 12.90 + i * 0.0001, 77.58, 12.95, 77.60, NINE_AM.plusSeconds(60L * i)));
        }

        MatchResult result = orchestrator().findMatches("A");

        assertEquals(5, result.candidates().size());
        assertFalse(ids(result).contains("A"));
    }

    @Test
    void repeatedRunsGiveIdenticalResults() {
        add(tripA());
        add(tripB());
        for (int i = 0; i < 8; i++) {
            add(trip("r" + i, 12.90, 77.58 + i * 0.0002, 12.95, 77.60, NINE_AM.plusSeconds(90L * i)));
        }
        MatchingOrchestrator orchestrator = orchestrator();

        MatchResult first = orchestrator.findMatches("A");
        MatchResult second = orchestrator.findMatches("A");

        assertEquals(first, second);
    }

    @Test
    void sequentialAndParallelScoringAgree() {
        add(tripA());
        add(tripB());
        for (int i = 0; i < 8; i++) {
            add(trip("s" + i, 12.90, 77.58 + i * 0.0003, 12.95, 77.60, NINE_AM.plusSeconds(45L * i)));
        }

        assertEquals(orchestrator(index, 1).findMatches("A"), orchestrator(index, 4).findMatches("A"));
    }

    @Test
    void inactiveCandidatesNeverAppear() {
        add(tripA());
        add(TripFixtures.withStatus(tripB(), TripStatus.CANCELLED));

        assertTrue(orchestrator().findMatches("A").isEmpty());
    }

    @Test
    void inactiveQueryTripYieldsEmptyResult() {
        add(TripFixtures.withStatus(tripA(), TripStatus.EXPIRED));
        add(tripB());

        MatchResult result = orchestrator().findMatches("A");

        assertTrue(result.isEmpty());
        assertEquals("A", result.forTripId());
    }

    @Test
    void zeroLengthQueryTripYieldsEmptyResult() {
        add(trip("parked", 12.90, 77.58, 12.90, 77.58, NINE_AM));
        add(tripB());

        assertTrue(orchestrator().findMatches("parked").isEmpty());
    }

    @Test
    void noNearbyTripsIsAnEmptyResultNotAnError() {
        add(tripA());

        assertTrue(orchestrator().findMatches("A").isEmpty());
    }

    @Test
    void unknownTripFails() {
        TripNotFoundException e = assertThrows(TripNotFoundException.class,
                () -> orchestrator().findMatches("missing"));
        assertEquals("missing", e.getTripId());
        assertFalse(e.isRetryable());
    }

    @Test
    void unreachableIndexPropagates() {
        store.put(tripA());
        SpatialIndex down = mock(SpatialIndex.class);
        when(down.queryNear(any(), anyDouble())).thenThrow(new IndexUnavailableException("redis down"));

        assertThrows(IndexUnavailableException.class, () -> orchestrator(down, 4).findMatches("A"));
    }
}
