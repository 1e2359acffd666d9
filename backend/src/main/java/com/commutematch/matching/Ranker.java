package com.commutematch.matching;

import com.commutematch.matching.model.MatchCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orders scored candidates: best score first, then closest departure, then smallest trip id.
 */
public class Ranker {

    public static final int DEFAULT_LIMIT = 5;

    static final Comparator<MatchCandidate> ORDER = Comparator
            .<MatchCandidate>comparingDouble(MatchCandidate::score).reversed()
            .thenComparing(MatchCandidate::timeDelta)
            .thenComparing(MatchCandidate::tripId);

    public List<MatchCandidate> rank(List<MatchCandidate> candidates) {
        return rank(candidates, DEFAULT_LIMIT);
    }

    public List<MatchCandidate> rank(List<MatchCandidate> candidates, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .sorted(ORDER)
                .limit(limit)
                .collect(Collectors.toUnmodifiableList());
    }
}
