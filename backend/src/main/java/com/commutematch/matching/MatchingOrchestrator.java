package com.commutematch.matching;

import com.commutematch.matching.exception.TripNotFoundException;
import com.commutematch.matching.model.MatchCandidate;
import com.commutematch.matching.model.MatchResult;
import com.commutematch.matching.model.TripSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one "find matches for trip T" pass: load, retrieve, score, rank.
 * <p>
 * Holds no state between calls; invoking it twice for the same trip against the same
 * store and index contents yields the same ranking.
 */
public class MatchingOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(MatchingOrchestrator.class);

    private final TripStore tripStore;
    private final CandidateRetriever candidateRetriever;
    private final OverlapScorer scorer;
    private final Ranker ranker;
    private final MatchingSettings settings;
    private final Executor scoringExecutor;
    private final int scoringConcurrency;
    private final Clock clock;

    public MatchingOrchestrator(TripStore tripStore,
                                CandidateRetriever candidateRetriever,
                                OverlapScorer scorer,
                                Ranker ranker,
                                MatchingSettings settings,
                                Executor scoringExecutor,
                                int scoringConcurrency,
                                Clock clock) {
        this.tripStore = tripStore;
        this.candidateRetriever = candidateRetriever;
        this.scorer = scorer;
        this.ranker = ranker;
        this.settings = settings;
        this.scoringExecutor = scoringExecutor;
        this.scoringConcurrency = Math.max(1, scoringConcurrency);
        this.clock = clock;
    }

    /**
     * @throws TripNotFoundException if no trip has this id
     * @throws com.commutematch.matching.exception.IndexUnavailableException if the spatial index cannot answer
     */
    public MatchResult findMatches(String tripId) {
        TripSnapshot trip = tripStore.findTrip(tripId)
                .orElseThrow(() -> new TripNotFoundException(tripId));

        if (!trip.isActive()) {
            logger.info("Trip {} is {}, nothing to match", tripId, trip.status());
            return MatchResult.empty(tripId, clock.instant());
        }
        if (!trip.isRoutable()) {
            logger.info("Trip {} has no usable route, skipping matching", tripId);
            return MatchResult.empty(tripId, clock.instant());
        }

        List<TripSnapshot> candidates = candidateRetriever.retrieveTrips(
                trip, settings.radiusMeters(), settings.timeWindow());
        List<MatchCandidate> scored = scoreAll(trip, candidates);
        List<MatchCandidate> ranked = ranker.rank(scored, settings.resultLimit());

        MatchResult result = new MatchResult(tripId, ranked, clock.instant());
        logger.info("Trip {}: scored {} candidates, returning {}", tripId, scored.size(), ranked.size());
        return result;
    }

    private List<MatchCandidate> scoreAll(TripSnapshot trip, List<TripSnapshot> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        if (scoringConcurrency == 1 || candidates.size() == 1) {
            List<MatchCandidate> scored = new ArrayList<>(candidates.size());
            for (TripSnapshot candidate : candidates) {
                scored.add(scorer.score(trip, candidate));
            }
            return scored;
        }

        List<CompletableFuture<MatchCandidate>> futures = new ArrayList<>(candidates.size());
        for (TripSnapshot candidate : candidates) {
            futures.add(CompletableFuture.supplyAsync(() -> scorer.score(trip, candidate), scoringExecutor));
        }
        List<MatchCandidate> scored = new ArrayList<>(futures.size());
        for (CompletableFuture<MatchCandidate> future : futures) {
            try {
                scored.add(future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Scoring failed for trip " + trip.id(), cause);
            }
        }
        return scored;
    }
}
