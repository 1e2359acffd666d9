package com.commutematch.matching;

import com.commutematch.matching.exception.IndexUnavailableException;
import com.commutematch.matching.index.IndexHit;
import com.commutematch.matching.index.SpatialIndex;
import com.commutematch.matching.model.Coordinate;
import com.commutematch.matching.model.TripSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Collects trips whose routes pass near the querying trip and whose departure falls in the window.
 * <p>
 * This is a cheap pre-filter and may let through trips the scorer later rates poorly.
 */
public class CandidateRetriever {

    private static final Logger logger = LoggerFactory.getLogger(CandidateRetriever.class);

    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(5);

    private final SpatialIndex spatialIndex;
    private final TripStore tripStore;
    private final Executor executor;
    private final Duration queryTimeout;

    public CandidateRetriever(SpatialIndex spatialIndex, TripStore tripStore, Executor executor) {
        this(spatialIndex, tripStore, executor, DEFAULT_QUERY_TIMEOUT);
    }

    public CandidateRetriever(SpatialIndex spatialIndex, TripStore tripStore, Executor executor, Duration queryTimeout) {
        this.spatialIndex = spatialIndex;
        this.tripStore = tripStore;
        this.executor = executor;
        this.queryTimeout = queryTimeout;
    }

    public Set<String> retrieve(TripSnapshot trip, double radiusMeters, Duration timeWindow) {
        return retrieveTrips(trip, radiusMeters, timeWindow).stream()
                .map(TripSnapshot::id)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Same as {@link #retrieve} but returns the loaded candidate snapshots, ordered by trip id.
     *
     * @throws IndexUnavailableException if every sample query failed or timed out
     */
    public List<TripSnapshot> retrieveTrips(TripSnapshot trip, double radiusMeters, Duration timeWindow) {
        if (!trip.isRoutable()) {
            return List.of();
        }
        Set<String> nearby = queryAllSamples(trip, radiusMeters);
        nearby.remove(trip.id());
        if (nearby.isEmpty()) {
            return List.of();
        }

        Map<String, TripSnapshot> loaded = tripStore.findTrips(nearby);
        List<TripSnapshot> candidates = new ArrayList<>();
        for (TripSnapshot other : loaded.values()) {
            if (other.id().equals(trip.id())) {
                continue;
            }
            if (!other.isActive()) {
                logger.debug("Skipping trip {} with status {}", other.id(), other.status());
                continue;
            }
            if (!other.isRoutable()) {
                logger.debug("Skipping trip {} without a usable route", other.id());
                continue;
            }
            if (trip.departDelta(other).compareTo(timeWindow) > 0) {
                logger.debug("Skipping trip {} departing outside the {} window", other.id(), timeWindow);
                continue;
            }
            candidates.add(other);
        }
        candidates.sort(Comparator.comparing(TripSnapshot::id));
        logger.info("Trip {}: {} nearby trips, {} candidates after filtering",
                trip.id(), nearby.size(), candidates.size());
        return candidates;
    }

    private Set<String> queryAllSamples(TripSnapshot trip, double radiusMeters) {
        List<Coordinate> samples = trip.sampledPoints();
        List<CompletableFuture<Set<IndexHit>>> queries = new ArrayList<>(samples.size());
        for (Coordinate sample : samples) {
            queries.add(CompletableFuture
                    .supplyAsync(() -> spatialIndex.queryNear(sample, radiusMeters), executor)
                    .orTimeout(queryTimeout.toMillis(), TimeUnit.MILLISECONDS));
        }

        Set<String> tripIds = new TreeSet<>();
        int failed = 0;
        Throwable lastFailure = null;
        for (CompletableFuture<Set<IndexHit>> query : queries) {
            try {
                for (IndexHit hit : query.join()) {
                    tripIds.add(hit.tripId());
                }
            } catch (CompletionException e) {
                failed++;
                lastFailure = e.getCause() != null ? e.getCause() : e;
                logger.debug("Sample query for trip {} failed: {}", trip.id(), lastFailure.toString());
            }
        }

        if (failed == queries.size()) {
            throw new IndexUnavailableException(
                    "All " + failed + " sample queries failed for trip " + trip.id(), lastFailure);
        }
        if (failed > 0) {
            logger.warn("Trip {}: {} of {} sample queries failed, continuing with partial results",
                    trip.id(), failed, queries.size());
        }
        return tripIds;
    }
}
