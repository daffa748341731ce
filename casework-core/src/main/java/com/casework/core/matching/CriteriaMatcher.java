package com.casework.core.matching;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ranks candidates against criteria over a fixed set of dimensions.
 *
 * <p>A candidate survives when, for every dimension it declares, the criteria
 * supply a value contained in the declared set. A declared dimension with no
 * criteria value eliminates the candidate. Survivors are scored by the number
 * of dimensions they declare; only the highest-scoring tier is returned.
 *
 * <p>Dimensions outside the matcher's set are ignored on both sides. The
 * matcher is stateless and thread-safe.
 */
public class CriteriaMatcher {

    private final Set<MatchDimension> dimensions;

    public CriteriaMatcher(Set<MatchDimension> dimensions) {
        if (dimensions.isEmpty()) {
            throw new IllegalArgumentException("Matcher needs at least one dimension");
        }
        this.dimensions = EnumSet.copyOf(dimensions);
    }

    public static CriteriaMatcher over(MatchDimension first, MatchDimension... rest) {
        return new CriteriaMatcher(EnumSet.of(first, rest));
    }

    public <T extends Matchable> MatchResult<T> match(Collection<T> candidates, MatchCriteria criteria) {
        int bestScore = -1;
        List<T> topTier = new ArrayList<>();

        for (T candidate : candidates) {
            int score = score(candidate.constraints(), criteria);
            if (score < 0) {
                continue;
            }
            if (score > bestScore) {
                bestScore = score;
                topTier.clear();
                topTier.add(candidate);
            } else if (score == bestScore) {
                topTier.add(candidate);
            }
        }

        return MatchResult.of(topTier);
    }

    /**
     * Score of a candidate, or -1 when it is filtered out.
     */
    int score(MatchConstraints constraints, MatchCriteria criteria) {
        int score = 0;
        for (MatchDimension dimension : dimensions) {
            if (!constraints.declares(dimension)) {
                continue;
            }
            var value = criteria.valueOf(dimension);
            if (value.isEmpty() || !constraints.accepted(dimension).contains(value.get())) {
                return -1;
            }
            score++;
        }
        return score;
    }

    public Set<MatchDimension> dimensions() {
        return EnumSet.copyOf(dimensions);
    }
}
