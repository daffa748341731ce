package com.casework.core.matching;

/**
 * A candidate the {@link CriteriaMatcher} can rank.
 */
public interface Matchable {

    /**
     * Stable identifier reported in {@link MatchResult#matchedId()}.
     */
    String matchId();

    MatchConstraints constraints();
}
