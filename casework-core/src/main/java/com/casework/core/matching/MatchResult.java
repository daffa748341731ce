package com.casework.core.matching;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a match.
 *
 * @param matches candidates sharing the highest score, in input order
 * @param single true when exactly one candidate holds the highest score
 * @param matchedId id of the single winner, empty when ambiguous or unmatched
 */
public record MatchResult<T extends Matchable>(
    List<T> matches,
    boolean single,
    Optional<String> matchedId
) {
    public MatchResult {
        matches = List.copyOf(matches);
    }

    public static <T extends Matchable> MatchResult<T> empty() {
        return new MatchResult<>(List.of(), false, Optional.empty());
    }

    public static <T extends Matchable> MatchResult<T> of(List<T> topTier) {
        if (topTier.isEmpty()) {
            return empty();
        }
        boolean single = topTier.size() == 1;
        return new MatchResult<>(
            topTier,
            single,
            single ? Optional.of(topTier.get(0).matchId()) : Optional.empty()
        );
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    /**
     * The single winner, if there is one.
     */
    public Optional<T> winner() {
        return single ? Optional.of(matches.get(0)) : Optional.empty();
    }
}
