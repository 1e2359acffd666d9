package com.commutematch.matching;

import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.index.H3SpatialIndex;
import com.commutematch.matching.index.IndexHit;
import com.commutematch.matching.index.SpatialIndex;
import com.commutematch.matching.model.Coordinate;
import com.commutematch.matching.model.TripSnapshot;
import com.commutematch.matching.model.TripStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static com.commutematch.matching.TripFixtures.NINE_AM;
import static com.commutematch.matching.TripFixtures.trip;
import static com.commutematch.matching.TripFixtures.tripA;
import static com.commutematch.matching.TripFixtures.tripB;
import static com.commutematch.matching.TripFixtures.tripC;
import static com.commutematch.matching.TripFixtures.withStatus;
import static org.junit.jupiter.api.Assertions.*;

class CandidateRetrieverTest {

    private static final Duration WINDOW = Duration.ofMinutes(15);

    private H3SpatialIndex index;
    private InMemoryTripStore store;
    private ExecutorService executor;
    private CandidateRetriever retriever;

    @BeforeEach
    void setUp() throws IOException {
        index = new H3SpatialIndex();
        store = new InMemoryTripStore();
        executor = Executors.newFixedThreadPool(4);
        retriever = new CandidateRetriever(index, store, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void add(TripSnapshot trip) {
        store.put(trip);
        index.index(trip.id(), trip.sampledPoints());
    }

    @Test
    void findsOverlappingTripAndExcludesItself() {
        add(tripA());
        add(tripB());

        Set<String> ids = retriever.retrieve(tripA(), 200, WINDOW);

        assertEquals(Set.of("B"), ids);
    }

    @Test
    void tripOutsideTimeWindowIsNotACandidate() {
        add(tripA());
        add(tripB());
        add(tripC());

        Set<String> ids = retriever.retrieve(tripA(), 200, WINDOW);

        assertFalse(ids.contains("C"));
        assertEquals(Set.of("B"), ids);
    }

    @Test
    void departureExactlyOnWindowEdgeIsKept() {
        add(tripA());
        add(trip("edge", 12.90, 77.58, 12.95, 77.60, NINE_AM.minus(WINDOW)));

        assertEquals(Set.of("edge"), retriever.retrieve(tripA(), 200, WINDOW));
    }

    @Test
    void inactiveTripsAreFilteredOut() {
        add(tripA());
        add(withStatus(tripB(), TripStatus.MATCHED));
        add(trip("cancelled", 12.90, 77.58, 12.95, 77.60, NINE_AM, TripStatus.CANCELLED));
        add(trip("expired", 12.90, 77.58, 12.95, 77.60, NINE_AM, TripStatus.EXPIRED));

        assertTrue(retriever.retrieve(tripA(), 200, WINDOW).isEmpty());
    }

    @Test
    void distantRoutesAreNotRetrieved() {
        add(tripA());
        add(trip("elsewhere", 13.05, 77.70, 13.10, 77.72, NINE_AM));

        assertTrue(retriever.retrieve(tripA(), 200, WINDOW).isEmpty());
    }

    @Test
    void indexedButMissingFromStoreIsIgnored() {
        add(tripA());
        index.index("ghost", tripB().sampledPoints());

        assertTrue(retriever.retrieve(tripA(), 200, WINDOW).isEmpty());
    }

    @Test
    void zeroLengthTripsTakeNoPart() {
        TripSnapshot parked = trip("parked", 12.90, 77.58, 12.90, 77.58, NINE_AM);
        add(tripA());
        add(parked);

        assertTrue(retriever.retrieve(tripA(), 200, WINDOW).isEmpty());
        assertTrue(retriever.retrieve(parked, 200, WINDOW).isEmpty());
    }

    @Test
    void candidatesAreOrderedById() {
        add(tripA());
        add(trip("z", 12.90, 77.58, 12.95, 77.60, NINE_AM));
        add(trip("m", 12.90, 77.58, 12.95, 77.60, NINE_AM));
        add(trip("b", 12.90, 77.58, 12.95, 77.60, NINE_AM));

        List<TripSnapshot> trips = retriever.retrieveTrips(tripA(), 200, WINDOW);

        assertEquals(List.of("b", "m", "z"), trips.stream().map(TripSnapshot::id).collect(Collectors.toList()));
    }

    @Test
    void partialQueryFailuresAreAbsorbed() {
        store.put(tripB());
        AtomicInteger calls = new AtomicInteger();
        SpatialIndex flaky = new StubIndex() {
            @Override
            public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
                if (calls.incrementAndGet() % 2 == 0) {
                    throw new IndexUnavailableException("connection reset");
                }
                return Set.of(new IndexHit("B", 10.0));
            }
        };
        CandidateRetriever withFlakyIndex = new CandidateRetriever(flaky, store, executor);

        assertEquals(Set.of("B"), withFlakyIndex.retrieve(tripA(), 200, WINDOW));
    }

    @Test
    void slowQueriesCountAsEmpty() {
        store.put(tripB());
        Coordinate origin = tripA().origin();
        SpatialIndex slowExceptAtOrigin = new StubIndex() {
            @Override
            public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
                if (point.equals(origin)) {
                    return Set.of(new IndexHit("B", 150.0));
                }
                sleep(500);
                return Set.of(new IndexHit("never", 1.0));
            }
        };
        CandidateRetriever withTimeout = new CandidateRetriever(
                slowExceptAtOrigin, store, executor, Duration.ofMillis(50));

        assertEquals(Set.of("B"), withTimeout.retrieve(tripA(), 200, WINDOW));
    }

    @Test
    void allQueriesFailingMeansIndexUnavailable() {
        SpatialIndex down = new StubIndex() {
            @Override
            public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
                throw new IndexUnavailableException("redis down");
            }
        };
        CandidateRetriever withDownIndex = new CandidateRetriever(down, store, executor);

        IndexUnavailableException e = assertThrows(IndexUnavailableException.class,
                () -> withDownIndex.retrieve(tripA(), 200, WINDOW));
        assertTrue(e.isRetryable());
    }

    @Test
    void allQueriesTimingOutMeansIndexUnavailable() {
        SpatialIndex hanging = new StubIndex() {
            @Override
            public Set<IndexHit> queryNear(Coordinate point, double radiusMeters) {
                sleep(500);
                return Set.of();
            }
        };
        TripSnapshot shortTrip = trip("short", 12.90, 77.58, 12.901, 77.58, NINE_AM);
        CandidateRetriever withTimeout = new CandidateRetriever(hanging, store, executor, Duration.ofMillis(50));

        assertThrows(IndexUnavailableException.class, () -> withTimeout.retrieve(shortTrip, 200, WINDOW));
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private abstract static class StubIndex implements SpatialIndex {
        @Override
        public void index(String tripId, List<Coordinate> sampledPoints) {
        }

        @Override
        public void remove(String tripId) {
        }
    }
}
