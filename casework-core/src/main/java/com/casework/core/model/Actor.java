package com.casework.core.model;

import java.util.Set;

/**
 * Authenticated caller identity. Authentication itself happens upstream.
 */
public record Actor(String id, Set<String> roles, boolean superAdmin) {

    public static final String SYSTEM_ID = "system";

    private static final Actor SYSTEM = new Actor(SYSTEM_ID, Set.of(), true);

    public Actor {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static Actor of(String id, String... roles) {
        return new Actor(id, Set.of(roles), false);
    }

    /**
     * Identity used by background jobs.
     */
    public static Actor system() {
        return SYSTEM;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(Set<String> candidates) {
        for (String role : candidates) {
            if (roles.contains(role)) {
                return true;
            }
        }
        return false;
    }
}
