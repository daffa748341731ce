package com.casework.core.model;

import com.casework.core.matching.MatchConstraints;
import com.casework.core.matching.Matchable;

/**
 * Department as seen by auto-detection: its id and the routing attributes it serves.
 */
public record DepartmentProfile(String id, String name, MatchConstraints constraints) implements Matchable {

    @Override
    public String matchId() {
        return id;
    }
}
