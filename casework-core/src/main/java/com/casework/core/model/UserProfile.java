package com.casework.core.model;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.Matchable;

import java.util.Set;

/**
 * Assignable user with the routing attributes they cover.
 */
public record UserProfile(
    String id,
    String displayName,
    Set<String> roles,
    boolean active,
    MatchConstraints constraints
) implements Matchable {

    public UserProfile {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    @Override
    public String matchId() {
        return id;
    }
}
