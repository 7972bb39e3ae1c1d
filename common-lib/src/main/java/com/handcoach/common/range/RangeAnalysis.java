package com.handcoach.common.range;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.handcoach.common.model.Street;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Street-by-street range picture for a hand. The final ranges themselves stay out of the
 * serialised report; only their statistics are published.
 */
public record RangeAnalysis(
    @JsonProperty("streets") Map<Street, StreetRanges> streets,
    @JsonIgnore Range finalHeroRange,
    @JsonIgnore Range finalVillainRange
) {
    public RangeAnalysis {
        Map<Street, StreetRanges> copy = new EnumMap<>(Street.class);
        if (streets != null) copy.putAll(streets);
        streets = Collections.unmodifiableMap(copy);
    }

    public static RangeAnalysis empty() {
        return new RangeAnalysis(Map.of(), Range.empty(), Range.empty());
    }

    public Optional<StreetRanges> on(Street street) {
        return Optional.ofNullable(streets.get(street));
    }
}
