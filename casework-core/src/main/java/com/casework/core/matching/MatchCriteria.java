package com.casework.core.matching;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute values of the thing being matched, typically a case record.
 * Null values are treated as missing.
 */
public record MatchCriteria(Map<MatchDimension, String> values) {

    public MatchCriteria {
        var copy = new EnumMap<MatchDimension, String>(MatchDimension.class);
        if (values != null) {
            values.forEach((dimension, value) -> {
                if (value != null && !value.isBlank()) {
                    copy.put(dimension, value);
                }
            });
        }
        values = Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> valueOf(MatchDimension dimension) {
        return Optional.ofNullable(values.get(dimension));
    }

    public static class Builder {
        private final Map<MatchDimension, String> values = new EnumMap<>(MatchDimension.class);

        public Builder with(MatchDimension dimension, String value) {
            if (value != null) {
                values.put(dimension, value);
            }
            return this;
        }

        public MatchCriteria build() {
            return new MatchCriteria(values);
        }
    }
}
