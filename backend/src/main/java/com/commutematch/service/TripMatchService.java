package com.commutematch.service;

import com.commutematch.entity.MatchedTrip;
import com.commutematch.entity.TripMatch;
import com.commutematch.matching.MatchResultSink;
import com.commutematch.matching.model.MatchCandidate;
import com.commutematch.matching.model.MatchResult;
import com.commutematch.repository.TripMatchRepository;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Keeps the most recent match result per trip.
 */
@Service
public class TripMatchService implements MatchResultSink {

    private static final Logger logger = LoggerFactory.getLogger(TripMatchService.class);

    private final TripMatchRepository tripMatchRepository;

    public TripMatchService(TripMatchRepository tripMatchRepository) {
        this.tripMatchRepository = tripMatchRepository;
    }

    @Override
    @Transactional
    public void accept(MatchResult result) {
        TripMatch match = tripMatchRepository.findByForTripId(result.forTripId()).orElseGet(TripMatch::new);
        if (match.getComputedAt() != null && match.getComputedAt().isAfter(result.computedAt())) {
            logger.info("Ignoring stale result for trip {} computed at {}", result.forTripId(), result.computedAt());
            return;
        }
        match.setForTripId(result.forTripId());
        match.setComputedAt(result.computedAt());
        match.getCandidates().clear();
        for (MatchCandidate candidate : result.candidates()) {
            match.getCandidates().add(MatchedTrip.from(candidate));
        }
        tripMatchRepository.save(match);
        logger.info("Saved {} matches for trip {}", result.candidates().size(), result.forTripId());
    }

    @Transactional(readOnly = true)
    public Optional<TripMatch> findLatest(String tripId) {
        Optional<TripMatch> match = tripMatchRepository.findByForTripId(tripId);
        match.ifPresent(m -> Hibernate.initialize(m.getCandidates()));
        return match;
    }
}
