package com.casework.core.matching;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-dimension sets of accepted values declared by a candidate.
 * A dimension that is absent or maps to an empty set is a wildcard.
 */
public record MatchConstraints(Map<MatchDimension, Set<String>> values) {

    private static final MatchConstraints NONE = new MatchConstraints(Map.of());

    public MatchConstraints {
        var copy = new EnumMap<MatchDimension, Set<String>>(MatchDimension.class);
        if (values != null) {
            values.forEach((dimension, accepted) -> {
                if (accepted != null && !accepted.isEmpty()) {
                    copy.put(dimension, Set.copyOf(accepted));
                }
            });
        }
        values = Map.copyOf(copy);
    }

    public static MatchConstraints none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean declares(MatchDimension dimension) {
        return values.containsKey(dimension);
    }

    public Set<String> accepted(MatchDimension dimension) {
        return values.getOrDefault(dimension, Set.of());
    }

    public MatchConstraints with(MatchDimension dimension, Set<String> accepted) {
        var copy = new EnumMap<MatchDimension, Set<String>>(MatchDimension.class);
        copy.putAll(values);
        copy.put(dimension, accepted);
        return new MatchConstraints(copy);
    }

    public static class Builder {
        private final Map<MatchDimension, Set<String>> values = new EnumMap<>(MatchDimension.class);

        public Builder accept(MatchDimension dimension, String... accepted) {
            return accept(dimension, Set.copyOf(Arrays.asList(accepted)));
        }

        public Builder accept(MatchDimension dimension, Set<String> accepted) {
            values.put(dimension, accepted);
            return this;
        }

        public MatchConstraints build() {
            return new MatchConstraints(values);
        }
    }
}
